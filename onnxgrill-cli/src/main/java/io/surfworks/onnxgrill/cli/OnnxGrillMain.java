package io.surfworks.onnxgrill.cli;

import io.surfworks.onnxgrill.codegen.CodegenException;
import io.surfworks.onnxgrill.codegen.ModelGen;
import io.surfworks.onnxgrill.onnx.OnnxImportException;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

public final class OnnxGrillMain {

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parses arguments and runs the generator.
     *
     * @return process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return 0;
        }

        ModelGen.Builder builder = ModelGen.builder().outDir(".");
        int inputs = 0;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> {
                    printUsage(out);
                    return 0;
                }
                case "--dev" -> builder.development(true);
                case "--parallel" -> builder.parallel(true);
                case "--out-dir", "--package" -> {
                    if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                        err.println("Error: " + arg + " requires a value");
                        return 1;
                    }
                    String value = args[++i];
                    if (arg.equals("--out-dir")) {
                        builder.outDir(value);
                    } else {
                        builder.packageName(value);
                    }
                }
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Unknown option: " + arg);
                        printUsage(err);
                        return 1;
                    }
                    builder.input(arg);
                    inputs++;
                }
            }
        }

        if (inputs == 0) {
            err.println("Error: no input files");
            return 1;
        }

        try {
            List<Path> generated = builder.build().runFromCli();
            for (Path path : generated) {
                out.println("Generated " + path);
            }
            return 0;
        } catch (CodegenException | OnnxImportException | IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("onnxgrill - ONNX graph to Java model generator");
        out.println();
        out.println("Usage: onnxgrill [options] FILE...");
        out.println();
        out.println("Options:");
        out.println("  --out-dir DIR    Directory for generated files (default: current directory)");
        out.println("  --package NAME   Package of the generated classes");
        out.println("  --dev            Also write the parsed graph, and parameters as JSON");
        out.println("  --parallel       Convert models concurrently");
        out.println("  --help, -h       Print this help message");
    }
}
