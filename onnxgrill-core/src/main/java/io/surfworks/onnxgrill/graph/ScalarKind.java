package io.surfworks.onnxgrill.graph;

import io.surfworks.onnxgrill.api.TensorKind;

/**
 * Concrete element kinds of target scalars and parameter payloads.
 */
public enum ScalarKind {
    INT32("int", TensorKind.INT),
    INT64("long", TensorKind.INT),
    FLOAT32("float", TensorKind.FLOAT),
    FLOAT64("double", TensorKind.FLOAT),
    BOOL("boolean", TensorKind.BOOL);

    private final String javaType;
    private final TensorKind tensorKind;

    ScalarKind(String javaType, TensorKind tensorKind) {
        this.javaType = javaType;
        this.tensorKind = tensorKind;
    }

    /**
     * The Java primitive type holding a value of this kind.
     */
    public String javaType() {
        return javaType;
    }

    public TensorKind tensorKind() {
        return tensorKind;
    }

    public boolean isFloatingPoint() {
        return tensorKind == TensorKind.FLOAT;
    }
}
