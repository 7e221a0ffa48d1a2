package io.surfworks.onnxgrill.codegen;

import io.surfworks.onnxgrill.api.ModelBackend;
import io.surfworks.onnxgrill.graph.ScalarKind;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Supplier;

/**
 * Compiles Java sources in memory against the api and core classes, for
 * checking that generated source is valid and behaves as intended.
 */
final class InMemoryCompiler {

    private InMemoryCompiler() {}

    /**
     * Compiles the given sources, keyed by fully qualified class name.
     *
     * @return a loader for the compiled classes, delegating to the test class loader
     */
    static ClassLoader compile(Map<String, String> sources) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No system Java compiler; tests must run on a JDK");
        }
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        Map<String, ByteArrayOutputStream> classes = new HashMap<>();

        List<JavaFileObject> units = new ArrayList<>();
        sources.forEach((name, source) -> units.add(new SourceFile(name, source)));

        boolean ok;
        try (StandardJavaFileManager standard =
                 compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8);
             JavaFileManager fileManager = new ForwardingJavaFileManager<>(standard) {
                 @Override
                 public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                            JavaFileObject.Kind kind, FileObject sibling) {
                     return new SimpleJavaFileObject(
                         URI.create("mem:///" + className.replace('.', '/') + kind.extension), kind) {
                         @Override
                         public OutputStream openOutputStream() {
                             ByteArrayOutputStream out = new ByteArrayOutputStream();
                             classes.put(className, out);
                             return out;
                         }
                     };
                 }
             }) {
            List<String> options = List.of("-classpath", classpath(), "-proc:none");
            ok = compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        if (!ok) {
            StringBuilder message = new StringBuilder("Compilation failed:\n");
            for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
                message.append(d.getKind()).append(" line ").append(d.getLineNumber())
                    .append(": ").append(d.getMessage(null)).append('\n');
            }
            sources.values().forEach(source -> message.append("----\n").append(source));
            throw new AssertionError(message.toString());
        }

        return new ClassLoader(InMemoryCompiler.class.getClassLoader()) {
            @Override
            protected Class<?> findClass(String name) throws ClassNotFoundException {
                ByteArrayOutputStream out = classes.get(name);
                if (out == null) {
                    throw new ClassNotFoundException(name);
                }
                byte[] bytes = out.toByteArray();
                return defineClass(name, bytes, 0, bytes.length);
            }
        };
    }

    /**
     * Compiles and evaluates a single expression, boxing primitives.
     */
    @SuppressWarnings("unchecked")
    static Object evaluate(String expression) {
        String source = "import io.surfworks.onnxgrill.api.*;\n"
            + "import io.surfworks.onnxgrill.api.config.*;\n"
            + "import io.surfworks.onnxgrill.graph.*;\n"
            + "import java.util.List;\n"
            + "\n"
            + "public class Fragment implements java.util.function.Supplier<Object> {\n"
            + "    public Object get() {\n"
            + "        return " + expression + ";\n"
            + "    }\n"
            + "}\n";
        ClassLoader loader = compile(Map.of("Fragment", source));
        try {
            Class<?> fragment = loader.loadClass("Fragment");
            return ((Supplier<Object>) fragment.getConstructor().newInstance()).get();
        } catch (ReflectiveOperationException e) {
            throw new AssertionError("Cannot evaluate " + expression, e);
        }
    }

    private static String classpath() {
        StringJoiner joiner = new StringJoiner(File.pathSeparator);
        for (Class<?> anchor : List.of(ModelBackend.class, ScalarKind.class)) {
            try {
                joiner.add(Paths.get(anchor.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
            } catch (URISyntaxException e) {
                throw new IllegalStateException(e);
            }
        }
        return joiner.toString();
    }

    private static final class SourceFile extends SimpleJavaFileObject {
        private final String source;

        SourceFile(String className, String source) {
            super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }
}
