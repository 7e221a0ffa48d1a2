package io.surfworks.onnxgrill.onnx;

import java.util.HashMap;
import java.util.Map;

/**
 * ONNX operator kinds known to the importer.
 *
 * <p>Only a subset is translatable; the rest are listed so that parsed graphs
 * can name them and translation can fail with a precise message.
 */
public enum NodeType {
    ADD("Add"),
    SUB("Sub"),
    MUL("Mul"),
    DIV("Div"),
    EQUAL("Equal"),
    CONV1D("Conv1d"),
    CONV2D("Conv2d"),
    MAX_POOL2D("MaxPool2d"),
    AVERAGE_POOL2D("AveragePool2d"),
    MAT_MUL("MatMul"),
    GEMM("Gemm"),
    LINEAR("Linear"),
    BATCH_NORMALIZATION("BatchNormalization"),
    RELU("Relu"),
    FLATTEN("Flatten"),
    LOG_SOFTMAX("LogSoftmax"),
    SOFTMAX("Softmax"),
    CONSTANT("Constant"),
    RESHAPE("Reshape"),
    SIGMOID("Sigmoid"),
    TANH("Tanh"),
    TRANSPOSE("Transpose"),
    CONCAT("Concat"),
    CAST("Cast"),
    DROPOUT("Dropout"),
    GLOBAL_AVERAGE_POOL("GlobalAveragePool"),
    GATHER("Gather"),
    SHAPE("Shape"),
    UNSQUEEZE("Unsqueeze"),
    SQUEEZE("Squeeze"),
    SLICE("Slice"),
    IDENTITY("Identity"),
    EXP("Exp"),
    LOG("Log"),
    SQRT("Sqrt"),
    POW("Pow"),
    REDUCE_MEAN("ReduceMean");

    private static final Map<String, NodeType> BY_ONNX_NAME = new HashMap<>();

    static {
        for (NodeType type : values()) {
            BY_ONNX_NAME.put(type.onnxName, type);
        }
    }

    private final String onnxName;

    NodeType(String onnxName) {
        this.onnxName = onnxName;
    }

    /**
     * The operator name as written in ONNX graphs.
     */
    public String onnxName() {
        return onnxName;
    }

    /**
     * Looks up an operator by its ONNX name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static NodeType fromOnnxName(String name) {
        NodeType type = BY_ONNX_NAME.get(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown ONNX operator: " + name);
        }
        return type;
    }

    @Override
    public String toString() {
        return onnxName;
    }
}
