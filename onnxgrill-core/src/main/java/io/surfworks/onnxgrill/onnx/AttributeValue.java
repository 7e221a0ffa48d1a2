package io.surfworks.onnxgrill.onnx;

import java.util.Arrays;
import java.util.Objects;

/**
 * ONNX node attribute values.
 */
public sealed interface AttributeValue permits
        AttributeValue.Float32, AttributeValue.Int64, AttributeValue.TensorValue,
        AttributeValue.Float32s, AttributeValue.Int64s, AttributeValue.Str {

    record Float32(float value) implements AttributeValue {}

    record Int64(long value) implements AttributeValue {}

    record TensorValue(Tensor tensor) implements AttributeValue {
        public TensorValue {
            Objects.requireNonNull(tensor, "tensor");
        }
    }

    record Float32s(float[] values) implements AttributeValue {
        @Override
        public String toString() {
            return "Float32s" + Arrays.toString(values);
        }
    }

    record Int64s(long[] values) implements AttributeValue {
        @Override
        public String toString() {
            return "Int64s" + Arrays.toString(values);
        }
    }

    record Str(String value) implements AttributeValue {}
}
