package io.surfworks.onnxgrill.translate;

import io.surfworks.onnxgrill.api.config.BatchNormConfig;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.LinearConfig;
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
import io.surfworks.onnxgrill.graph.PrecisionSettings;
import io.surfworks.onnxgrill.graph.ScalarKind;
import io.surfworks.onnxgrill.graph.ScalarType;
import io.surfworks.onnxgrill.graph.TargetGraph;
import io.surfworks.onnxgrill.graph.TensorType;
import io.surfworks.onnxgrill.graph.Type;
import io.surfworks.onnxgrill.onnx.Argument;
import io.surfworks.onnxgrill.onnx.AttributeValue;
import io.surfworks.onnxgrill.onnx.ElementType;
import io.surfworks.onnxgrill.onnx.Node;
import io.surfworks.onnxgrill.onnx.OnnxGraph;
import io.surfworks.onnxgrill.onnx.OnnxImportException;
import io.surfworks.onnxgrill.onnx.OpConfigExtractor;
import io.surfworks.onnxgrill.onnx.OpConfigExtractor.FlattenConfig;
import io.surfworks.onnxgrill.onnx.Tensor;
import io.surfworks.onnxgrill.onnx.TensorData;
import io.surfworks.onnxgrill.onnx.ZeroRankScalars;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Translates a parsed ONNX graph into a {@link TargetGraph}, one target node
 * per source node, in source order.
 *
 * <p>Every supported operator has its own method; anything else fails with
 * {@link UnsupportedOperatorException} so that a partially supported model
 * never yields a program.
 */
public final class OnnxToGraph {

    private static final Logger LOG = Logger.getLogger(OnnxToGraph.class.getName());

    private final OpConfigExtractor configs;
    private final ParamDataConverter converter;

    public OnnxToGraph(PrecisionSettings precision, OpConfigExtractor configs) {
        this.configs = configs;
        this.converter = new ParamDataConverter(precision);
    }

    /**
     * Translates every node and registers the graph's inputs and outputs.
     *
     * @throws OnnxImportException if any node cannot be translated
     */
    public TargetGraph translate(OnnxGraph graph) {
        TargetGraph target = new TargetGraph();
        for (Node node : graph.nodes()) {
            target.register(translate(node));
        }
        target.registerInputOutput(names(graph.inputs()), names(graph.outputs()), declaredTypes(graph.inputs()));
        LOG.fine("Translated " + graph.nodes().size() + " nodes");
        return target;
    }

    /**
     * Translates a single node.
     *
     * @throws UnsupportedOperatorException if the operator has no translation
     * @throws OnnxImportException          if the node is malformed
     */
    public GraphNode translate(Node node) {
        LOG.fine(() -> "Translating " + node.nodeType() + " node '" + node.name() + "'");
        switch (node.nodeType()) {
            case ADD:
                return BinaryNode.add(lhs(node), rhs(node), out(node));
            case SUB:
                return BinaryNode.sub(lhs(node), rhs(node), out(node));
            case MUL:
                return BinaryNode.mul(lhs(node), rhs(node), out(node));
            case DIV:
                return BinaryNode.div(lhs(node), rhs(node), out(node));
            case EQUAL:
                return BinaryNode.equal(lhs(node), rhs(node), out(node));
            case RELU:
                return UnaryNode.relu(in(node), out(node));
            case SIGMOID:
                return UnaryNode.sigmoid(in(node), out(node));
            case TRANSPOSE:
                return UnaryNode.transpose(in(node), out(node));
            case CAST:
                return UnaryNode.cast(in(node), out(node));
            case FLATTEN:
                return flatten(node);
            case LOG_SOFTMAX:
                return UnaryNode.logSoftmax(in(node), out(node), configs.logSoftmaxConfig(node));
            case CONSTANT:
                return constant(node);
            case RESHAPE:
                return reshape(node);
            case MAT_MUL:
                return new MatmulNode(
                    node.input(0).toTensorType(), node.input(1).toTensorType(), node.output(0).toTensorType());
            case LINEAR:
                return linear(node);
            case CONV2D:
                return conv2d(node);
            case BATCH_NORMALIZATION:
                return batchNorm(node);
            case CONCAT:
                return concat(node);
            case DROPOUT:
                return new DropoutNode(node.name(), tensorIn(node), tensorOut(node), configs.dropoutConfig(node));
            case MAX_POOL2D:
                return new MaxPool2dNode(node.name(), tensorIn(node), tensorOut(node), configs.maxPool2dConfig(node));
            case GLOBAL_AVERAGE_POOL:
                return new GlobalAvgPoolNode(node.name(), tensorIn(node), tensorOut(node));
            default:
                throw new UnsupportedOperatorException(node.nodeType(), node.name());
        }
    }

    // ==================== Operators ====================

    private GraphNode flatten(Node node) {
        FlattenConfig config = configs.flattenConfig(node);
        return UnaryNode.flatten(in(node), out(node), config.startDim(), config.endDim());
    }

    private GraphNode constant(Node node) {
        AttributeValue value = node.requireAttribute("value");
        String outputName = node.output(0).name();

        if (value instanceof AttributeValue.Float32 f) {
            return new ConstantNode(node.name(), new ConstantValue.Float32(f.value()),
                new ScalarType(outputName, ScalarKind.FLOAT32));
        }
        if (value instanceof AttributeValue.Int64 i) {
            return new ConstantNode(node.name(), new ConstantValue.Int64(i.value()),
                new ScalarType(outputName, ScalarKind.INT64));
        }
        if (value instanceof AttributeValue.TensorValue t) {
            Tensor tensor = t.tensor();
            if (ZeroRankScalars.isScalar(tensor.rank())) {
                ConstantValue scalar = ZeroRankScalars.scalarConstant(tensor);
                return new ConstantNode(node.name(), scalar,
                    ZeroRankScalars.scalarType(outputName, tensor.elementType()));
            }
            ConstantValue.Tensor constant = tensorConstant(node, outputName, tensor);
            return new ConstantNode(node.name(), constant, constant.type());
        }
        throw new OnnxImportException(
            "Unsupported value " + value + " for Constant node '" + node.name() + "'");
    }

    private ConstantValue.Tensor tensorConstant(Node node, String outputName, Tensor tensor) {
        String what = "Constant node '" + node.name() + "'";
        ElementType elementType = tensor.elementType();
        ParamData data;
        switch (elementType) {
            case FLOAT32:
            case FLOAT64:
                data = converter.toFloats(tensor, what);
                break;
            case INT32:
            case INT64:
                data = converter.toInts(tensor, what);
                break;
            default:
                throw new OnnxImportException(
                    "Unsupported " + elementType + " tensor for " + what);
        }
        TensorType type = new TensorType(outputName, tensor.rank(), elementType.toTensorKind(), data.shape());
        return new ConstantValue.Tensor(type, data);
    }

    private GraphNode reshape(Node node) {
        ParameterQueue queue = new ParameterQueue(node);
        Tensor shapeTensor = queue.take("shape");
        queue.requireDrained();

        if (!(shapeTensor.data() instanceof TensorData.Int64Data ints)) {
            throw new OnnxImportException(
                "Reshape node '" + node.name() + "' expects an INT64 shape, got " + shapeTensor.elementType());
        }
        long[] shape = ints.values().clone();
        for (long dim : shape) {
            if (dim < 0) {
                throw new OnnxImportException(
                    "Reshape node '" + node.name() + "' has negative dimension in " + Arrays.toString(shape));
            }
        }
        return new ReshapeNode(tensorIn(node), tensorOut(node), shape);
    }

    private GraphNode linear(Node node) {
        LinearConfig config = configs.linearConfig(node);
        String what = "Linear node '" + node.name() + "'";
        ParameterQueue queue = new ParameterQueue(node);
        ParamData weight = converter.toFloats(queue.takeWeight(), what + " weight");
        Tensor bias = queue.takeBias(config.bias());
        queue.requireDrained();
        return new LinearNode(node.name(), tensorIn(node), tensorOut(node),
            weight, bias == null ? null : converter.toFloats(bias, what + " bias"), config);
    }

    private GraphNode conv2d(Node node) {
        Conv2dConfig config = configs.conv2dConfig(node);
        String what = "Conv2d node '" + node.name() + "'";
        ParameterQueue queue = new ParameterQueue(node);
        ParamData weight = converter.toFloats(queue.takeWeight(), what + " weight");
        Tensor bias = queue.takeBias(config.bias());
        queue.requireDrained();
        return new Conv2dNode(node.name(), tensorIn(node), tensorOut(node),
            weight, bias == null ? null : converter.toFloats(bias, what + " bias"), config);
    }

    private GraphNode batchNorm(Node node) {
        String what = "BatchNormalization node '" + node.name() + "'";
        ParameterQueue queue = new ParameterQueue(node);
        ParamData gamma = converter.toFloats(queue.take("gamma"), what + " gamma");
        ParamData beta = converter.toFloats(queue.take("beta"), what + " beta");
        ParamData runningMean = converter.toFloats(queue.take("running mean"), what + " running mean");
        ParamData runningVar = converter.toFloats(queue.take("running var"), what + " running var");
        queue.requireDrained();

        BatchNormConfig config = configs.batchNormConfig(node);
        TensorType input = tensorIn(node);
        if (input.rank() < 2) {
            throw new OnnxImportException(
                "BatchNormalization node '" + node.name() + "' expects an input of rank 2 or more, got "
                    + input.rank());
        }
        return new BatchNormNode(input.rank() - 2, node.name(), input, tensorOut(node),
            gamma, beta, runningMean, runningVar, config);
    }

    private GraphNode concat(Node node) {
        List<TensorType> inputs = new ArrayList<>(node.inputs().size());
        for (Argument input : node.inputs()) {
            inputs.add(input.toTensorType());
        }
        return new ConcatNode(inputs, tensorOut(node), configs.concatConfig(node));
    }

    // ==================== Arguments ====================

    private static Type lhs(Node node) {
        return node.input(0).toType();
    }

    private static Type rhs(Node node) {
        return node.input(1).toType();
    }

    private static Type in(Node node) {
        return node.input(0).toType();
    }

    private static Type out(Node node) {
        return node.output(0).toType();
    }

    private static TensorType tensorIn(Node node) {
        return node.input(0).toTensorType();
    }

    private static TensorType tensorOut(Node node) {
        return node.output(0).toTensorType();
    }

    private static Map<String, Type> declaredTypes(List<Argument> arguments) {
        Map<String, Type> types = new LinkedHashMap<>();
        for (Argument argument : arguments) {
            types.put(argument.name(), argument.toType());
        }
        return types;
    }

    private static List<String> names(List<Argument> arguments) {
        List<String> names = new ArrayList<>(arguments.size());
        for (Argument argument : arguments) {
            names.add(argument.name());
        }
        return names;
    }
}
