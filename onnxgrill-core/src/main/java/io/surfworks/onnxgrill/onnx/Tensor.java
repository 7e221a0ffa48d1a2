package io.surfworks.onnxgrill.onnx;

import java.util.Arrays;
import java.util.Objects;

/**
 * An ONNX tensor, used both for attribute values and for learned parameters.
 *
 * <p>A rank-0 tensor is a scalar container; see {@link ZeroRankScalars}.
 *
 * @param rank        number of dimensions
 * @param elementType element type
 * @param shape       dimensions, or {@code null} when the parser did not record them
 * @param data        payload, or {@code null} for shape-only tensors
 */
public record Tensor(int rank, ElementType elementType, long[] shape, TensorData data) {

    public Tensor {
        Objects.requireNonNull(elementType, "elementType");
        if (shape != null && shape.length != rank) {
            throw new IllegalArgumentException(
                "Shape " + Arrays.toString(shape) + " does not match rank " + rank);
        }
    }

    public static Tensor of(long[] shape, TensorData data) {
        return new Tensor(shape.length, data.elementType(), shape, data);
    }

    public static Tensor floats(long[] shape, float... values) {
        return of(shape, new TensorData.Float32Data(values));
    }

    public static Tensor longs(long[] shape, long... values) {
        return of(shape, new TensorData.Int64Data(values));
    }

    @Override
    public String toString() {
        return "Tensor[rank=" + rank + ", elementType=" + elementType
            + ", shape=" + Arrays.toString(shape)
            + ", elements=" + (data == null ? "none" : data.length()) + "]";
    }
}
