package io.surfworks.onnxgrill.onnx;

import io.surfworks.onnxgrill.graph.GraphNode.ConstantValue;
import io.surfworks.onnxgrill.graph.ScalarType;

/**
 * Normalization of rank-0 tensors to scalars.
 *
 * <p>ONNX exporters (PyTorch in particular) encode scalar values as rank-0
 * tensors. Argument and attribute conversion both go through this class so
 * the rule is applied in one place.
 */
public final class ZeroRankScalars {

    private ZeroRankScalars() {}

    public static boolean isScalar(int rank) {
        return rank == 0;
    }

    /**
     * Scalar type for a rank-0 tensor argument, keeping its declared element kind.
     */
    public static ScalarType scalarType(String name, ElementType elementType) {
        return new ScalarType(name, elementType.toScalarKind());
    }

    /**
     * Extracts the single element of a rank-0 tensor as a scalar constant.
     *
     * @throws OnnxImportException if the tensor has no data or an unsupported element type
     */
    public static ConstantValue scalarConstant(Tensor tensor) {
        TensorData data = tensor.data();
        if (data == null || data.length() == 0) {
            throw new OnnxImportException("Zero dim constant tensor has no data");
        }
        if (data instanceof TensorData.Float32Data f) {
            return new ConstantValue.Float32(f.values()[0]);
        } else if (data instanceof TensorData.Float64Data d) {
            return new ConstantValue.Float64(d.values()[0]);
        } else if (data instanceof TensorData.Int32Data i) {
            return new ConstantValue.Int32(i.values()[0]);
        } else if (data instanceof TensorData.Int64Data l) {
            return new ConstantValue.Int64(l.values()[0]);
        } else if (data instanceof TensorData.BoolData b) {
            return new ConstantValue.Bool(b.values()[0]);
        }
        throw new OnnxImportException("Unsupported zero dim constant tensor type: " + tensor.elementType());
    }
}
