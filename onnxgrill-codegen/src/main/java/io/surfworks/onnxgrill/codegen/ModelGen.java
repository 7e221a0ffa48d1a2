package io.surfworks.onnxgrill.codegen;

import io.surfworks.onnxgrill.api.ModelMetadata;
import io.surfworks.onnxgrill.codegen.record.JsonRecordWriter;
import io.surfworks.onnxgrill.codegen.record.RecordWriter;
import io.surfworks.onnxgrill.codegen.record.SafeTensorsRecordWriter;
import io.surfworks.onnxgrill.graph.PrecisionSettings;
import io.surfworks.onnxgrill.graph.TargetGraph;
import io.surfworks.onnxgrill.onnx.GraphJson;
import io.surfworks.onnxgrill.onnx.JsonGraphParser;
import io.surfworks.onnxgrill.onnx.ModelParser;
import io.surfworks.onnxgrill.onnx.OnnxGraph;
import io.surfworks.onnxgrill.onnx.OnnxImportException;
import io.surfworks.onnxgrill.onnx.OnnxOpConfigs;
import io.surfworks.onnxgrill.onnx.OpConfigExtractor;
import io.surfworks.onnxgrill.translate.OnnxToGraph;

import javax.lang.model.SourceVersion;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates model sources and parameter records from ONNX graphs.
 *
 * <p>For every input {@code <dir>/<base>.<ext>} the generator writes, into the
 * output directory:
 * <ul>
 *   <li>{@code <base>.graph.txt}: the parsed graph as JSON (development mode only)</li>
 *   <li>{@code <base>.java}: the generated model class</li>
 *   <li>{@code <base>.safetensors}, or {@code <base>.json} in development mode: the learned parameters</li>
 * </ul>
 *
 * <p>A model is fully translated before any of its files is written, so an
 * unsupported operator leaves no output for that model.
 *
 * <pre>{@code
 * ModelGen.builder()
 *     .outDir("generated/onnx")
 *     .input("models/mnist.json")
 *     .build()
 *     .runFromScript();
 * }</pre>
 */
public final class ModelGen {

    private static final Logger LOG = Logger.getLogger(ModelGen.class.getName());

    /** System property naming the build directory that {@link #runFromScript()} resolves against. */
    public static final String BUILD_DIR_PROPERTY = "onnxgrill.build.dir";

    /** Environment variable consulted when {@link #BUILD_DIR_PROPERTY} is unset. */
    public static final String BUILD_DIR_ENV = "ONNXGRILL_BUILD_DIR";

    public static final String GRAPH_EXTENSION = ".graph.txt";
    public static final String SOURCE_EXTENSION = ".java";

    private static final PrecisionSettings PRECISION = PrecisionSettings.FULL;

    private final String outDir;
    private final List<String> inputs;
    private final boolean development;
    private final ModelParser parser;
    private final OpConfigExtractor configs;
    private final String packageName;
    private final boolean parallel;

    private ModelGen(Builder builder) {
        this.outDir = builder.outDir;
        this.inputs = List.copyOf(builder.inputs);
        this.development = builder.development;
        this.parser = builder.parser;
        this.configs = builder.configs;
        this.packageName = builder.packageName;
        this.parallel = builder.parallel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs as a build step, resolving the output directory against the build
     * directory from {@value #BUILD_DIR_PROPERTY} or {@value #BUILD_DIR_ENV}.
     *
     * @return generated source files, in input order
     * @throws CodegenException if neither is set, or generation fails
     */
    public List<Path> runFromScript() throws CodegenException {
        String buildDir = System.getProperty(BUILD_DIR_PROPERTY);
        if (buildDir == null || buildDir.isBlank()) {
            buildDir = System.getenv(BUILD_DIR_ENV);
        }
        if (buildDir == null || buildDir.isBlank()) {
            throw new CodegenException(
                "Build directory not set: define system property " + BUILD_DIR_PROPERTY
                    + " or environment variable " + BUILD_DIR_ENV);
        }
        return runFromScript(Paths.get(buildDir));
    }

    /**
     * Runs as a build step with an explicit build directory.
     */
    public List<Path> runFromScript(Path buildDir) throws CodegenException {
        return run(buildDir.resolve(outDir));
    }

    /**
     * Runs as a standalone command; the output directory is used as given.
     */
    public List<Path> runFromCli() throws CodegenException {
        return run(Paths.get(outDir));
    }

    private List<Path> run(Path out) throws CodegenException {
        LOG.info("Generating " + inputs.size() + " model(s) into " + out);
        LOG.fine(() -> "Development mode: " + development + ", parallel: " + parallel);

        try {
            Files.createDirectories(out);
        } catch (IOException e) {
            throw new CodegenException("Failed to create output directory: " + out, e);
        }

        List<Path> generated = parallel && inputs.size() > 1 ? runParallel(out) : runSequential(out);
        LOG.info("Finished generating " + generated.size() + " model(s)");
        return generated;
    }

    private List<Path> runSequential(Path out) throws CodegenException {
        List<Path> generated = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            generated.add(generate(input, out));
        }
        return generated;
    }

    private List<Path> runParallel(Path out) throws CodegenException {
        AtomicInteger threadCounter = new AtomicInteger();
        int threads = Math.min(inputs.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "onnxgrill-gen-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Path>> futures = new ArrayList<>(inputs.size());
            for (String input : inputs) {
                futures.add(executor.submit(() -> generate(input, out)));
            }
            List<Path> generated = new ArrayList<>(inputs.size());
            for (Future<Path> future : futures) {
                generated.add(future.get());
            }
            return generated;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CodegenException codegen) {
                throw codegen;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CodegenException("Model generation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CodegenException("Interrupted while generating models", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Generates all outputs for one input.
     *
     * @return path of the generated source
     * @throws CodegenException    if the input cannot be read or outputs cannot be written
     * @throws OnnxImportException if the graph cannot be translated
     */
    Path generate(String input, Path out) throws CodegenException {
        Path inputPath = Paths.get(input);
        String base = baseName(inputPath);
        if (!SourceVersion.isIdentifier(base) || SourceVersion.isKeyword(base)) {
            throw new CodegenException(
                "Model file name '" + base + "' is not a valid Java class name: " + input);
        }
        LOG.info("Converting " + input);

        OnnxGraph graph;
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(inputPath);
            graph = parser.parse(inputPath);
        } catch (IOException e) {
            throw new CodegenException("Failed to read model: " + input, e);
        }

        TargetGraph target = new OnnxToGraph(PRECISION, configs).translate(graph);
        ModelMetadata metadata = new ModelMetadata(base, input, sha256(bytes), ModelSourceGenerator.GENERATOR_VERSION);
        String source = new ModelSourceGenerator().generate(packageName, base, input, target, metadata);

        Path sourcePath = out.resolve(base + SOURCE_EXTENSION);
        try {
            if (development) {
                Path graphPath = out.resolve(base + GRAPH_EXTENSION);
                Files.writeString(graphPath, GraphJson.write(graph), StandardCharsets.UTF_8);
                LOG.fine(() -> "Wrote " + graphPath);
            }

            Files.writeString(sourcePath, source, StandardCharsets.UTF_8);
            LOG.fine(() -> "Wrote " + sourcePath);

            RecordWriter writer = development ? new JsonRecordWriter() : new SafeTensorsRecordWriter();
            Path recordPath = out.resolve(base + writer.extension());
            writer.write(recordPath, target.parameters(), PRECISION);
            LOG.fine(() -> "Wrote " + recordPath);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to write outputs for " + input, e);
            throw new CodegenException("Failed to write outputs for " + input + " to " + out, e);
        }
        return sourcePath;
    }

    static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(bytes);
            StringBuilder hex = new StringBuilder();
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    public static class Builder {
        private String outDir;
        private final List<String> inputs = new ArrayList<>();
        private boolean development = false;
        private ModelParser parser = new JsonGraphParser();
        private OpConfigExtractor configs = new OnnxOpConfigs();
        private String packageName = "";
        private boolean parallel = false;

        /**
         * Output directory; relative to the build directory in {@link #runFromScript()}.
         */
        public Builder outDir(String outDir) {
            this.outDir = outDir;
            return this;
        }

        /**
         * Adds an input model. Inputs are processed in the order added.
         */
        public Builder input(String input) {
            this.inputs.add(Objects.requireNonNull(input, "input"));
            return this;
        }

        /**
         * Writes the parsed graph next to the source and the parameters as JSON.
         */
        public Builder development(boolean development) {
            this.development = development;
            return this;
        }

        public Builder parser(ModelParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
            return this;
        }

        public Builder configExtractor(OpConfigExtractor configs) {
            this.configs = Objects.requireNonNull(configs, "configs");
            return this;
        }

        /**
         * Package of the generated classes; empty for the default package.
         */
        public Builder packageName(String packageName) {
            this.packageName = Objects.requireNonNull(packageName, "packageName");
            return this;
        }

        /**
         * Processes inputs concurrently, one task per model.
         */
        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        /**
         * @throws IllegalStateException if no output directory or no input was given, the package
         *                               name is invalid, or two inputs share a base name
         */
        public ModelGen build() {
            if (outDir == null || outDir.isBlank()) {
                throw new IllegalStateException("Output directory is required");
            }
            if (inputs.isEmpty()) {
                throw new IllegalStateException("At least one input is required");
            }
            if (!packageName.isEmpty() && !SourceVersion.isName(packageName)) {
                throw new IllegalStateException("Invalid package name: " + packageName);
            }
            Map<String, String> byBaseName = new HashMap<>();
            for (String input : inputs) {
                String previous = byBaseName.putIfAbsent(baseName(Paths.get(input)), input);
                if (previous != null) {
                    throw new IllegalStateException(
                        "Inputs " + previous + " and " + input + " would both generate class '"
                            + baseName(Paths.get(input)) + "'");
                }
            }
            return new ModelGen(this);
        }
    }
}
