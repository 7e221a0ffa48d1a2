package io.surfworks.onnxgrill.onnx;

import java.util.Objects;

/**
 * Typed payload of an ONNX tensor.
 *
 * <p>Float16 payloads arrive already widened to {@code float} by the parser.
 */
public sealed interface TensorData permits
        TensorData.Float16Data, TensorData.Float32Data, TensorData.Float64Data,
        TensorData.Int32Data, TensorData.Int64Data, TensorData.BoolData, TensorData.StringData {

    int length();

    ElementType elementType();

    record Float16Data(float[] values) implements TensorData {
        public Float16Data { Objects.requireNonNull(values); }
        @Override public int length() { return values.length; }
        @Override public ElementType elementType() { return ElementType.FLOAT16; }
    }

    record Float32Data(float[] values) implements TensorData {
        public Float32Data { Objects.requireNonNull(values); }
        @Override public int length() { return values.length; }
        @Override public ElementType elementType() { return ElementType.FLOAT32; }
    }

    record Float64Data(double[] values) implements TensorData {
        public Float64Data { Objects.requireNonNull(values); }
        @Override public int length() { return values.length; }
        @Override public ElementType elementType() { return ElementType.FLOAT64; }
    }

    record Int32Data(int[] values) implements TensorData {
        public Int32Data { Objects.requireNonNull(values); }
        @Override public int length() { return values.length; }
        @Override public ElementType elementType() { return ElementType.INT32; }
    }

    record Int64Data(long[] values) implements TensorData {
        public Int64Data { Objects.requireNonNull(values); }
        @Override public int length() { return values.length; }
        @Override public ElementType elementType() { return ElementType.INT64; }
    }

    record BoolData(boolean[] values) implements TensorData {
        public BoolData { Objects.requireNonNull(values); }
        @Override public int length() { return values.length; }
        @Override public ElementType elementType() { return ElementType.BOOL; }
    }

    record StringData(String[] values) implements TensorData {
        public StringData { Objects.requireNonNull(values); }
        @Override public int length() { return values.length; }
        @Override public ElementType elementType() { return ElementType.STRING; }
    }
}
