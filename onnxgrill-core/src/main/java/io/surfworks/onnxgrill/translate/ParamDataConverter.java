package io.surfworks.onnxgrill.translate;

import io.surfworks.onnxgrill.graph.ParamData;
import io.surfworks.onnxgrill.graph.PrecisionSettings;
import io.surfworks.onnxgrill.graph.ScalarKind;
import io.surfworks.onnxgrill.onnx.OnnxImportException;
import io.surfworks.onnxgrill.onnx.Tensor;
import io.surfworks.onnxgrill.onnx.TensorData;

import java.util.Arrays;

/**
 * Converts parameter and constant tensors to the run's precision.
 */
final class ParamDataConverter {

    private final PrecisionSettings precision;

    ParamDataConverter(PrecisionSettings precision) {
        this.precision = precision;
    }

    /**
     * Converts to floating-point values of the precision's float kind.
     * Integer payloads are widened; a long with no exact double form is fatal.
     */
    ParamData.Floats toFloats(Tensor tensor, String what) {
        long[] shape = requireShape(tensor, what);
        TensorData data = requireData(tensor, what);
        double[] values;
        if (data instanceof TensorData.Float16Data h) {
            values = widen(h.values());
        } else if (data instanceof TensorData.Float32Data f) {
            values = widen(f.values());
        } else if (data instanceof TensorData.Float64Data d) {
            values = d.values().clone();
        } else if (data instanceof TensorData.Int32Data i) {
            values = new double[i.values().length];
            for (int k = 0; k < values.length; k++) {
                values[k] = i.values()[k];
            }
        } else if (data instanceof TensorData.Int64Data l) {
            values = new double[l.values().length];
            for (int k = 0; k < values.length; k++) {
                long v = l.values()[k];
                values[k] = v;
                if (!exactInDouble(v)) {
                    throw new OnnxImportException(
                        "Value " + v + " at index " + k + " of " + what + " has no exact floating-point form");
                }
            }
        } else {
            throw unsupported(tensor, what);
        }
        requireElementCount(shape, values.length, what);
        if (precision.floatKind() == ScalarKind.FLOAT32) {
            for (int k = 0; k < values.length; k++) {
                values[k] = (float) values[k];
            }
        }
        return new ParamData.Floats(precision.floatKind(), shape, values);
    }

    /**
     * Converts to integer values of the precision's int kind. Float payloads
     * are truncated toward zero; values outside the int kind's range are fatal.
     */
    ParamData.Ints toInts(Tensor tensor, String what) {
        long[] shape = requireShape(tensor, what);
        TensorData data = requireData(tensor, what);
        long[] values;
        if (data instanceof TensorData.Int32Data i) {
            values = new long[i.values().length];
            for (int k = 0; k < values.length; k++) {
                values[k] = i.values()[k];
            }
        } else if (data instanceof TensorData.Int64Data l) {
            values = l.values().clone();
        } else if (data instanceof TensorData.Float16Data h) {
            values = truncate(widen(h.values()));
        } else if (data instanceof TensorData.Float32Data f) {
            values = truncate(widen(f.values()));
        } else if (data instanceof TensorData.Float64Data d) {
            values = truncate(d.values());
        } else {
            throw unsupported(tensor, what);
        }
        requireElementCount(shape, values.length, what);
        if (precision.intKind() == ScalarKind.INT32) {
            for (int k = 0; k < values.length; k++) {
                if (values[k] < Integer.MIN_VALUE || values[k] > Integer.MAX_VALUE) {
                    throw new OnnxImportException(
                        "Value " + values[k] + " at index " + k + " of " + what + " does not fit in INT32");
                }
            }
        }
        return new ParamData.Ints(precision.intKind(), shape, values);
    }

    private static long[] requireShape(Tensor tensor, String what) {
        if (tensor.shape() == null) {
            throw new OnnxImportException("Tensor shape is required for " + what);
        }
        return tensor.shape().clone();
    }

    private static void requireElementCount(long[] shape, int length, String what) {
        long count = 1;
        for (long d : shape) {
            count *= d;
        }
        if (count != length) {
            throw new OnnxImportException(
                "Tensor shape " + Arrays.toString(shape) + " of " + what + " holds " + count
                    + " elements, but " + length + " values were given");
        }
    }

    // Exact when the significant bits fit a double's 53-bit mantissa
    private static boolean exactInDouble(long v) {
        if (v == Long.MIN_VALUE) {
            return true;
        }
        long magnitude = Math.abs(v);
        return magnitude <= (1L << 53)
            || 64 - Long.numberOfLeadingZeros(magnitude) - Long.numberOfTrailingZeros(magnitude) <= 53;
    }

    private static TensorData requireData(Tensor tensor, String what) {
        if (tensor.data() == null) {
            throw new OnnxImportException("Tensor data is required for " + what);
        }
        return tensor.data();
    }

    private static OnnxImportException unsupported(Tensor tensor, String what) {
        return new OnnxImportException(
            "Unsupported " + tensor.elementType() + " tensor for " + what);
    }

    private static double[] widen(float[] values) {
        double[] out = new double[values.length];
        for (int k = 0; k < values.length; k++) {
            out[k] = values[k];
        }
        return out;
    }

    private static long[] truncate(double[] values) {
        long[] out = new long[values.length];
        for (int k = 0; k < values.length; k++) {
            out[k] = (long) values[k];
        }
        return out;
    }
}
