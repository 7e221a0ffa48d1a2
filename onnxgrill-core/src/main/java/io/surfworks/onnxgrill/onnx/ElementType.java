package io.surfworks.onnxgrill.onnx;

import io.surfworks.onnxgrill.api.TensorKind;
import io.surfworks.onnxgrill.graph.ScalarKind;

/**
 * Element types of ONNX tensors and scalars.
 */
public enum ElementType {
    FLOAT32,
    FLOAT64,
    INT32,
    INT64,
    BOOL,
    STRING,
    FLOAT16;

    /**
     * Maps to the target scalar kind.
     *
     * @throws OnnxImportException for STRING and FLOAT16
     */
    public ScalarKind toScalarKind() {
        return switch (this) {
            case FLOAT32 -> ScalarKind.FLOAT32;
            case FLOAT64 -> ScalarKind.FLOAT64;
            case INT32 -> ScalarKind.INT32;
            case INT64 -> ScalarKind.INT64;
            case BOOL -> ScalarKind.BOOL;
            case STRING -> throw new OnnxImportException("String scalar unsupported");
            case FLOAT16 -> throw new OnnxImportException("Float16 scalar unsupported");
        };
    }

    /**
     * Maps to the target tensor kind.
     *
     * @throws OnnxImportException for STRING and FLOAT16
     */
    public TensorKind toTensorKind() {
        return switch (this) {
            case FLOAT32, FLOAT64 -> TensorKind.FLOAT;
            case INT32, INT64 -> TensorKind.INT;
            case BOOL -> TensorKind.BOOL;
            case STRING -> throw new OnnxImportException("String tensor unsupported");
            case FLOAT16 -> throw new OnnxImportException("Float16 tensor unsupported");
        };
    }
}
