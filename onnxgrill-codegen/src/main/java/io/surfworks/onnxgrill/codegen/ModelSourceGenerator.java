package io.surfworks.onnxgrill.codegen;

import io.surfworks.onnxgrill.api.ModelMetadata;
import io.surfworks.onnxgrill.graph.GraphNode;
import io.surfworks.onnxgrill.graph.GraphNode.BatchNormNode;
import io.surfworks.onnxgrill.graph.GraphNode.BinaryNode;
import io.surfworks.onnxgrill.graph.GraphNode.ConcatNode;
import io.surfworks.onnxgrill.graph.GraphNode.ConstantNode;
import io.surfworks.onnxgrill.graph.GraphNode.ConstantValue;
import io.surfworks.onnxgrill.graph.GraphNode.Conv2dNode;
import io.surfworks.onnxgrill.graph.GraphNode.DropoutNode;
import io.surfworks.onnxgrill.graph.GraphNode.GlobalAvgPoolNode;
import io.surfworks.onnxgrill.graph.GraphNode.LinearNode;
import io.surfworks.onnxgrill.graph.GraphNode.MatmulNode;
import io.surfworks.onnxgrill.graph.GraphNode.MaxPool2dNode;
import io.surfworks.onnxgrill.graph.GraphNode.ReshapeNode;
import io.surfworks.onnxgrill.graph.GraphNode.UnaryNode;
import io.surfworks.onnxgrill.graph.ParamData;
import io.surfworks.onnxgrill.graph.ScalarKind;
import io.surfworks.onnxgrill.graph.ScalarType;
import io.surfworks.onnxgrill.graph.TargetGraph;
import io.surfworks.onnxgrill.graph.TensorType;
import io.surfworks.onnxgrill.graph.Type;

import javax.lang.model.SourceVersion;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Emits the Java source of a model class from a complete {@link TargetGraph}.
 *
 * <p>The generated class is generic in the backend tensor type {@code T}:
 * <pre>{@code
 * public final class mnist<T> implements GeneratedModel {
 *     public mnist(ModelBackend<T> backend, ParameterRecord<T> record) { ... }
 *     public T forward(T input) { ... }
 * }
 * }</pre>
 * Each layer node becomes a {@code Layer<T>} field built in the constructor from
 * the parameter record; every node becomes one statement of {@code forward}, in
 * graph order. Output is a pure function of the graph and metadata.
 */
public final class ModelSourceGenerator {

    public static final String GENERATOR_VERSION = "0.1.0";

    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int indent = 0;

    /**
     * Generates the source of a model class.
     *
     * @param packageName package of the class, or empty for the default package
     * @param className   simple class name
     * @param source      label of the source model, written to the provenance comment
     * @param graph       complete target graph
     * @param metadata    metadata embedded as the {@code METADATA} constant
     * @throws CodegenException if a node's argument types have no Java rendering
     */
    public String generate(String packageName, String className, String source,
                           TargetGraph graph, ModelMetadata metadata) throws CodegenException {
        if (!graph.isComplete()) {
            throw new CodegenException("Graph inputs and outputs are not registered");
        }
        requireIdentifier(className, "class name");

        sb.setLength(0);
        indent = 0;

        line("// Generated from ONNX %s by onnxgrill", SourceLiterals.toSource(source));
        if (packageName != null && !packageName.isEmpty()) {
            line("package %s;", packageName);
        }
        line("");
        line("import io.surfworks.onnxgrill.api.GeneratedModel;");
        line("import io.surfworks.onnxgrill.api.Layer;");
        line("import io.surfworks.onnxgrill.api.ModelBackend;");
        line("import io.surfworks.onnxgrill.api.ModelMetadata;");
        line("import io.surfworks.onnxgrill.api.ParameterRecord;");
        line("import io.surfworks.onnxgrill.api.TensorKind;");
        line("import io.surfworks.onnxgrill.api.config.*;");
        line("");
        line("import java.util.List;");
        line("");
        line("public final class %s<T> implements GeneratedModel {", className);
        indent++;
        line("");
        line("public static final ModelMetadata METADATA = %s;", SourceLiterals.toSource(metadata));
        line("");
        line("private final ModelBackend<T> backend;");
        for (GraphNode node : graph.nodes()) {
            if (isLayer(node)) {
                line("private final Layer<T> %s;", node.field().orElseThrow());
            }
        }
        line("");

        emitConstructor(className, graph);
        emitSignature(graph);
        emitForward(graph);

        indent--;
        line("}");
        return sb.toString();
    }

    // ==================== Class members ====================

    private void emitConstructor(String className, TargetGraph graph) throws CodegenException {
        line("public %s(ModelBackend<T> backend, ParameterRecord<T> record) {", className);
        indent++;
        line("this.backend = backend;");
        for (GraphNode node : graph.nodes()) {
            if (isLayer(node)) {
                line("this.%s = %s;", node.field().orElseThrow(), layerInit(node));
            }
        }
        indent--;
        line("}");
        line("");
    }

    private void emitSignature(TargetGraph graph) {
        line("@Override");
        line("public ModelMetadata metadata() {");
        line(INDENT + "return METADATA;");
        line("}");
        line("");
        line("@Override");
        line("public List<String> inputNames() {");
        line(INDENT + "return %s;", SourceLiterals.toSource(graph.inputNames()));
        line("}");
        line("");
        line("@Override");
        line("public List<String> outputNames() {");
        line(INDENT + "return %s;", SourceLiterals.toSource(graph.outputNames()));
        line("}");
        line("");
    }

    private void emitForward(TargetGraph graph) throws CodegenException {
        StringJoiner params = new StringJoiner(", ");
        for (Type input : graph.inputs()) {
            params.add(javaType(input) + " " + input.name());
        }
        List<Type> outputs = graph.outputs();
        String returnType = outputs.size() == 1 ? javaType(outputs.get(0)) : "List<Object>";

        line("public %s forward(%s) {", returnType, params);
        indent++;
        for (GraphNode node : graph.nodes()) {
            emitNode(node);
        }
        if (outputs.size() == 1) {
            line("return %s;", outputs.get(0).name());
        } else {
            StringJoiner names = new StringJoiner(", ", "List.of(", ")");
            for (Type output : outputs) {
                names.add(output.name());
            }
            line("return %s;", names);
        }
        indent--;
        line("}");
    }

    // ==================== Layers ====================

    private static boolean isLayer(GraphNode node) {
        return node.field().isPresent();
    }

    private static String layerInit(GraphNode node) throws CodegenException {
        if (node instanceof LinearNode linear) {
            return "backend.linear(" + SourceLiterals.toSource(linear.config()) + ", "
                + param(linear.fieldName(), "weight") + ", "
                + (linear.bias() == null ? "null" : param(linear.fieldName(), "bias")) + ")";
        }
        if (node instanceof Conv2dNode conv) {
            return "backend.conv2d(" + SourceLiterals.toSource(conv.config()) + ", "
                + param(conv.fieldName(), "weight") + ", "
                + (conv.bias() == null ? "null" : param(conv.fieldName(), "bias")) + ")";
        }
        if (node instanceof BatchNormNode bn) {
            return "backend.batchNorm(" + bn.dim() + ", " + SourceLiterals.toSource(bn.config()) + ", "
                + param(bn.fieldName(), "gamma") + ", "
                + param(bn.fieldName(), "beta") + ", "
                + param(bn.fieldName(), "running_mean") + ", "
                + param(bn.fieldName(), "running_var") + ")";
        }
        if (node instanceof MaxPool2dNode pool) {
            return "backend.maxPool2d(" + SourceLiterals.toSource(pool.config()) + ")";
        }
        if (node instanceof DropoutNode dropout) {
            return "backend.dropout(" + SourceLiterals.toSource(dropout.config()) + ")";
        }
        if (node instanceof GlobalAvgPoolNode) {
            return "backend.globalAvgPool()";
        }
        throw new CodegenException("Node " + node.getClass().getSimpleName() + " is not a layer");
    }

    private static String param(String field, String key) {
        return "record.tensor(" + SourceLiterals.toSource(field + "." + key) + ")";
    }

    // ==================== Forward statements ====================

    private void emitNode(GraphNode node) throws CodegenException {
        if (isLayer(node)) {
            Type output = node.outputTypes().get(0);
            line("T %s = this.%s.forward(%s);", output.name(), node.field().orElseThrow(),
                node.inputTypes().get(0).name());
        } else if (node instanceof BinaryNode binary) {
            assign(binary.output(), binary(binary));
        } else if (node instanceof UnaryNode unary) {
            assign(unary.output(), unary(unary));
        } else if (node instanceof MatmulNode matmul) {
            assign(matmul.output(), "this.backend.matmul(" + matmul.lhs().name() + ", " + matmul.rhs().name() + ")");
        } else if (node instanceof ConcatNode concat) {
            StringJoiner inputs = new StringJoiner(", ", "List.of(", ")");
            for (TensorType input : concat.inputs()) {
                inputs.add(input.name());
            }
            assign(concat.output(), "this.backend.concat(" + inputs + ", " + concat.dim() + ")");
        } else if (node instanceof ReshapeNode reshape) {
            assign(reshape.output(), "this.backend.reshape(" + reshape.input().name() + ", "
                + SourceLiterals.toSource(reshape.shape()) + ")");
        } else if (node instanceof ConstantNode constant) {
            assign(constant.output(), constant(constant));
        } else {
            throw new CodegenException("No source rendering for " + node.getClass().getSimpleName());
        }
    }

    private void assign(Type output, String expression) {
        line("%s %s = %s;", javaType(output), output.name(), expression);
    }

    private static String binary(BinaryNode node) throws CodegenException {
        Type lhs = node.lhs();
        Type rhs = node.rhs();
        String a = lhs.name();
        String b = rhs.name();
        String op = node.op().name().toLowerCase(Locale.ROOT);

        if (lhs instanceof TensorType && rhs instanceof TensorType) {
            requireTensorOutput(node, node.output());
            return "this.backend." + op + "(" + a + ", " + b + ")";
        }
        if (lhs instanceof TensorType) {
            requireTensorOutput(node, node.output());
            requireNumeric(node, rhs);
            return "this.backend." + op + "Scalar(" + a + ", " + b + ")";
        }
        if (rhs instanceof TensorType) {
            requireTensorOutput(node, node.output());
            requireNumeric(node, lhs);
            switch (node.op()) {
                case ADD:
                    return "this.backend.addScalar(" + b + ", " + a + ")";
                case MUL:
                    return "this.backend.mulScalar(" + b + ", " + a + ")";
                case SUB:
                    return "this.backend.neg(this.backend.subScalar(" + b + ", " + a + "))";
                case DIV:
                    return "this.backend.mulScalar(this.backend.reciprocal(" + b + "), " + a + ")";
                case EQUAL:
                    return "this.backend.equalScalar(" + b + ", " + a + ")";
                default:
                    throw new CodegenException("Unknown binary operator " + node.op());
            }
        }

        ScalarType out = requireScalarOutput(node, node.output());
        if (node.op() == GraphNode.BinaryOp.EQUAL) {
            if (out.kind() == ScalarKind.BOOL) {
                return a + " == " + b;
            }
            return "(" + out.kind().javaType() + ") (" + a + " == " + b + " ? 1 : 0)";
        }
        requireNumeric(node, lhs);
        requireNumeric(node, rhs);
        requireNumeric(node, out);
        String symbol = switch (node.op()) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
            case EQUAL -> "==";
        };
        return "(" + out.kind().javaType() + ") (" + a + " " + symbol + " " + b + ")";
    }

    private static String unary(UnaryNode node) throws CodegenException {
        Type input = node.input();
        String x = input.name();

        if (input instanceof TensorType) {
            TensorType out = requireTensorOutput(node, node.output());
            switch (node.op()) {
                case RELU:
                    return "this.backend.relu(" + x + ")";
                case SIGMOID:
                    return "this.backend.sigmoid(" + x + ")";
                case TRANSPOSE:
                    return "this.backend.transpose(" + x + ")";
                case CAST:
                    return "this.backend.cast(" + x + ", " + SourceLiterals.toSource(out.kind()) + ")";
                case FLATTEN:
                    return "this.backend.flatten(" + x + ", " + node.params().get(0) + ", " + node.params().get(1) + ")";
                case LOG_SOFTMAX:
                    return "this.backend.logSoftmax(" + x + ", " + node.params().get(0) + ")";
                default:
                    throw new CodegenException("Unknown unary operator " + node.op());
            }
        }

        ScalarType in = (ScalarType) input;
        ScalarType out = requireScalarOutput(node, node.output());
        String cast = "(" + out.kind().javaType() + ") ";
        switch (node.op()) {
            case RELU:
                requireNumeric(node, in);
                requireNumeric(node, out);
                return cast + "Math.max(" + x + ", 0)";
            case SIGMOID:
                requireNumeric(node, in);
                requireNumeric(node, out);
                return cast + "(1.0 / (1.0 + Math.exp(-" + x + ")))";
            case TRANSPOSE:
            case CAST:
                if (out.kind() == ScalarKind.BOOL) {
                    return in.kind() == ScalarKind.BOOL ? x : x + " != 0";
                }
                if (in.kind() == ScalarKind.BOOL) {
                    return cast + "(" + x + " ? 1 : 0)";
                }
                return cast + x;
            default:
                throw new CodegenException(
                    "Operator " + node.op() + " on scalar '" + x + "' has no source rendering");
        }
    }

    private static String constant(ConstantNode node) throws CodegenException {
        ConstantValue value = node.value();
        if (value instanceof ConstantValue.Float32 f) {
            return SourceLiterals.toSource(f.value());
        } else if (value instanceof ConstantValue.Float64 d) {
            return SourceLiterals.toSource(d.value());
        } else if (value instanceof ConstantValue.Int32 i) {
            return SourceLiterals.toSource(i.value());
        } else if (value instanceof ConstantValue.Int64 l) {
            return SourceLiterals.toSource(l.value());
        } else if (value instanceof ConstantValue.Bool b) {
            return SourceLiterals.toSource(b.value());
        } else if (value instanceof ConstantValue.Tensor t) {
            return "this.backend.tensor(" + SourceLiterals.toSource(primitiveValues(t.data())) + ", "
                + SourceLiterals.toSource(t.data().shape()) + ")";
        }
        throw new CodegenException("Unknown constant " + value + " in node '" + node.name() + "'");
    }

    /**
     * Payload as the primitive array matching its kind, e.g. {@code float[]} for FLOAT32.
     */
    static Object primitiveValues(ParamData data) {
        if (data instanceof ParamData.Floats floats) {
            double[] values = floats.values();
            if (floats.kind() == ScalarKind.FLOAT32) {
                float[] narrowed = new float[values.length];
                for (int i = 0; i < values.length; i++) {
                    narrowed[i] = (float) values[i];
                }
                return narrowed;
            }
            return values.clone();
        }
        ParamData.Ints ints = (ParamData.Ints) data;
        long[] values = ints.values();
        if (ints.kind() == ScalarKind.INT32) {
            int[] narrowed = new int[values.length];
            for (int i = 0; i < values.length; i++) {
                narrowed[i] = (int) values[i];
            }
            return narrowed;
        }
        return values.clone();
    }

    // ==================== Checks ====================

    private static TensorType requireTensorOutput(GraphNode node, Type output) throws CodegenException {
        if (output instanceof TensorType tensor) {
            return tensor;
        }
        throw new CodegenException(
            node.getClass().getSimpleName() + " with tensor operand cannot produce scalar '" + output.name() + "'");
    }

    private static ScalarType requireScalarOutput(GraphNode node, Type output) throws CodegenException {
        if (output instanceof ScalarType scalar) {
            return scalar;
        }
        throw new CodegenException(
            node.getClass().getSimpleName() + " on scalars cannot produce tensor '" + output.name() + "'");
    }

    private static void requireNumeric(GraphNode node, Type type) throws CodegenException {
        if (type instanceof ScalarType scalar && scalar.kind() == ScalarKind.BOOL) {
            throw new CodegenException(
                node.getClass().getSimpleName() + " cannot use boolean scalar '" + type.name() + "' arithmetically");
        }
    }

    private static String javaType(Type type) {
        if (type instanceof ScalarType scalar) {
            return scalar.kind().javaType();
        }
        return "T";
    }

    private static void requireIdentifier(String name, String role) throws CodegenException {
        if (name == null || !SourceVersion.isIdentifier(name) || SourceVersion.isKeyword(name)) {
            throw new CodegenException("Invalid " + role + " '" + name + "'");
        }
    }

    private void line(String format, Object... args) {
        if (!format.isEmpty()) {
            sb.append(INDENT.repeat(indent));
            sb.append(args.length == 0 ? format : String.format(format, args));
        }
        sb.append('\n');
    }
}
