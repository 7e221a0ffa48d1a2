package io.surfworks.onnxgrill.onnx;

import io.surfworks.onnxgrill.api.config.BatchNormConfig;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.DropoutConfig;
import io.surfworks.onnxgrill.api.config.LinearConfig;
import io.surfworks.onnxgrill.api.config.MaxPool2dConfig;
import io.surfworks.onnxgrill.api.config.PaddingConfig2d;

import java.util.Arrays;

/**
 * Config extraction following the ONNX operator attribute conventions.
 *
 * <p>Weights for Linear are expected in {@code [in, out]} layout, Conv2d
 * weights in {@code [out, in / groups, kH, kW]} layout.
 */
public final class OnnxOpConfigs implements OpConfigExtractor {

    private static final double DEFAULT_EPSILON = 1e-5;
    private static final double DEFAULT_MOMENTUM = 0.9;
    private static final double DEFAULT_DROPOUT = 0.5;

    @Override
    public FlattenConfig flattenConfig(Node node) {
        int rank = inputRank(node);
        int axis = normalizeAxis(node, intAttribute(node, "axis", 1), rank);
        return new FlattenConfig(axis, rank - 1);
    }

    @Override
    public int logSoftmaxConfig(Node node) {
        return normalizeAxis(node, intAttribute(node, "axis", -1), inputRank(node));
    }

    @Override
    public int concatConfig(Node node) {
        long axis = longAttribute(node, "axis");
        return normalizeAxis(node, (int) axis, inputRank(node));
    }

    @Override
    public LinearConfig linearConfig(Node node) {
        long[] weightShape = stateShape(node, 0, "weight");
        if (weightShape.length != 2) {
            throw new OnnxImportException(
                "Linear node '" + node.name() + "' expects a rank-2 weight, got " + Arrays.toString(weightShape));
        }
        return new LinearConfig((int) weightShape[0], (int) weightShape[1], node.states().size() == 2);
    }

    @Override
    public Conv2dConfig conv2dConfig(Node node) {
        long[] weightShape = stateShape(node, 0, "weight");
        if (weightShape.length != 4) {
            throw new OnnxImportException(
                "Conv2d node '" + node.name() + "' expects a rank-4 weight, got " + Arrays.toString(weightShape));
        }
        int groups = intAttribute(node, "group", 1);
        int[] channels = {(int) weightShape[1] * groups, (int) weightShape[0]};
        int[] kernel = pairAttribute(node, "kernel_shape", new int[]{(int) weightShape[2], (int) weightShape[3]});
        int[] strides = pairAttribute(node, "strides", new int[]{1, 1});
        int[] dilations = pairAttribute(node, "dilations", new int[]{1, 1});
        PaddingConfig2d padding = padding(node);
        return new Conv2dConfig(channels, kernel, strides, dilations, groups, padding, node.states().size() == 2);
    }

    @Override
    public MaxPool2dConfig maxPool2dConfig(Node node) {
        int[] kernel = pairAttribute(node, "kernel_shape", null);
        int[] strides = pairAttribute(node, "strides", new int[]{1, 1});
        return new MaxPool2dConfig(kernel, strides, padding(node));
    }

    @Override
    public BatchNormConfig batchNormConfig(Node node) {
        long[] gammaShape = stateShape(node, 0, "gamma");
        if (gammaShape.length != 1) {
            throw new OnnxImportException(
                "BatchNormalization node '" + node.name() + "' expects a rank-1 gamma, got "
                    + Arrays.toString(gammaShape));
        }
        double epsilon = doubleAttribute(node, "epsilon", DEFAULT_EPSILON);
        double momentum = doubleAttribute(node, "momentum", DEFAULT_MOMENTUM);
        return new BatchNormConfig((int) gammaShape[0], epsilon, momentum);
    }

    @Override
    public DropoutConfig dropoutConfig(Node node) {
        return new DropoutConfig(doubleAttribute(node, "ratio", DEFAULT_DROPOUT));
    }

    // ==================== Attribute access ====================

    private static PaddingConfig2d padding(Node node) {
        String autoPad = node.attribute("auto_pad")
            .map(value -> stringValue(node, "auto_pad", value))
            .orElse("NOTSET");
        switch (autoPad) {
            case "SAME_UPPER", "SAME_LOWER":
                return new PaddingConfig2d.Same();
            case "VALID":
                return new PaddingConfig2d.Valid();
            case "NOTSET":
                break;
            default:
                throw new OnnxImportException(
                    "Unsupported auto_pad '" + autoPad + "' on node '" + node.name() + "'");
        }

        long[] pads = node.attribute("pads")
            .map(value -> longsValue(node, "pads", value))
            .orElse(new long[]{0, 0, 0, 0});
        if (pads.length != 4) {
            throw new OnnxImportException(
                "Node '" + node.name() + "' expects 4 pads, got " + Arrays.toString(pads));
        }
        // ONNX order: [top, left, bottom, right]
        if (pads[0] != pads[2] || pads[1] != pads[3]) {
            throw new OnnxImportException(
                "Asymmetric padding " + Arrays.toString(pads) + " on node '" + node.name() + "' is not supported");
        }
        if (pads[0] == 0 && pads[1] == 0) {
            return new PaddingConfig2d.Valid();
        }
        return new PaddingConfig2d.Explicit((int) pads[0], (int) pads[1]);
    }

    private static int inputRank(Node node) {
        ArgType type = node.input(0).type();
        if (type instanceof ArgType.TensorArg tensor) {
            return tensor.rank();
        }
        throw new OnnxImportException(
            node.nodeType() + " node '" + node.name() + "' expects a tensor input");
    }

    private static int normalizeAxis(Node node, int axis, int rank) {
        int normalized = axis < 0 ? axis + rank : axis;
        if (normalized < 0 || normalized >= rank) {
            throw new OnnxImportException(
                "Axis " + axis + " out of range for rank " + rank + " on node '" + node.name() + "'");
        }
        return normalized;
    }

    private static long[] stateShape(Node node, int index, String what) {
        if (node.states().size() <= index) {
            throw new OnnxImportException(
                node.nodeType() + " node '" + node.name() + "' is missing its " + what);
        }
        long[] shape = node.states().get(index).tensor().shape();
        if (shape == null) {
            throw new OnnxImportException(
                node.nodeType() + " node '" + node.name() + "' has a " + what + " without shape");
        }
        return shape;
    }

    private static int intAttribute(Node node, String key, int defaultValue) {
        return node.attribute(key)
            .map(value -> (int) longValue(node, key, value))
            .orElse(defaultValue);
    }

    private static long longAttribute(Node node, String key) {
        return longValue(node, key, node.requireAttribute(key));
    }

    private static double doubleAttribute(Node node, String key, double defaultValue) {
        return node.attribute(key)
            .map(value -> {
                if (value instanceof AttributeValue.Float32 f) {
                    return (double) f.value();
                }
                throw unexpected(node, key, value);
            })
            .orElse(defaultValue);
    }

    private static int[] pairAttribute(Node node, String key, int[] defaultValue) {
        AttributeValue value = node.attributes().get(key);
        if (value == null) {
            if (defaultValue == null) {
                throw new OnnxImportException(
                    node.nodeType() + " node '" + node.name() + "' is missing required attribute '" + key + "'");
            }
            return defaultValue;
        }
        long[] values = longsValue(node, key, value);
        if (values.length != 2) {
            throw new OnnxImportException(
                "Attribute '" + key + "' on node '" + node.name() + "' must have 2 entries, got "
                    + Arrays.toString(values));
        }
        return new int[]{(int) values[0], (int) values[1]};
    }

    private static long longValue(Node node, String key, AttributeValue value) {
        if (value instanceof AttributeValue.Int64 i) {
            return i.value();
        }
        throw unexpected(node, key, value);
    }

    private static long[] longsValue(Node node, String key, AttributeValue value) {
        if (value instanceof AttributeValue.Int64s ints) {
            return ints.values();
        }
        throw unexpected(node, key, value);
    }

    private static String stringValue(Node node, String key, AttributeValue value) {
        if (value instanceof AttributeValue.Str s) {
            return s.value();
        }
        throw unexpected(node, key, value);
    }

    private static OnnxImportException unexpected(Node node, String key, AttributeValue value) {
        return new OnnxImportException(
            "Unexpected value " + value + " for attribute '" + key + "' on node '" + node.name() + "'");
    }
}
