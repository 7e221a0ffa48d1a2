package io.surfworks.onnxgrill.graph;

import java.util.Arrays;
import java.util.Objects;

/**
 * A parameter payload already converted to the run's precision.
 *
 * <p>Values are kept widened ({@code double} / {@code long}) but are exactly
 * representable in {@link #kind()}: conversion rounds to {@code float} or
 * narrows to {@code int} up front, so writers can narrow losslessly.
 */
public sealed interface ParamData permits ParamData.Floats, ParamData.Ints {

    ScalarKind kind();

    long[] shape();

    /**
     * Number of elements.
     */
    int size();

    record Floats(ScalarKind kind, long[] shape, double[] values) implements ParamData {

        public Floats {
            Objects.requireNonNull(shape, "shape");
            Objects.requireNonNull(values, "values");
            if (!kind.isFloatingPoint()) {
                throw new IllegalArgumentException("Float payload with non-float kind " + kind);
            }
            requireElementCount(shape, values.length);
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Floats that)) return false;
            return kind == that.kind && Arrays.equals(shape, that.shape) && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * kind.hashCode() + Arrays.hashCode(shape)) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "Floats[" + kind + " " + Arrays.toString(shape) + "]";
        }
    }

    record Ints(ScalarKind kind, long[] shape, long[] values) implements ParamData {

        public Ints {
            Objects.requireNonNull(shape, "shape");
            Objects.requireNonNull(values, "values");
            if (kind != ScalarKind.INT32 && kind != ScalarKind.INT64) {
                throw new IllegalArgumentException("Integer payload with non-integer kind " + kind);
            }
            requireElementCount(shape, values.length);
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Ints that)) return false;
            return kind == that.kind && Arrays.equals(shape, that.shape) && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * kind.hashCode() + Arrays.hashCode(shape)) + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "Ints[" + kind + " " + Arrays.toString(shape) + "]";
        }
    }

    private static void requireElementCount(long[] shape, int length) {
        long count = 1;
        for (long d : shape) {
            count *= d;
        }
        if (count != length) {
            throw new IllegalArgumentException(
                "Shape " + Arrays.toString(shape) + " holds " + count + " elements, payload has " + length);
        }
    }
}
