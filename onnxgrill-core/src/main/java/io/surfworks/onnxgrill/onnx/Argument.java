package io.surfworks.onnxgrill.onnx;

import io.surfworks.onnxgrill.graph.ScalarType;
import io.surfworks.onnxgrill.graph.TensorType;
import io.surfworks.onnxgrill.graph.Type;

import java.util.Objects;

/**
 * A named node input or output. The name is both the wiring key inside the
 * graph and the symbol name in generated code.
 */
public record Argument(String name, ArgType type) {

    public Argument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Argument tensor(String name, int rank, ElementType elementType) {
        return new Argument(name, new ArgType.TensorArg(rank, elementType));
    }

    public static Argument scalar(String name, ElementType elementType) {
        return new Argument(name, new ArgType.ScalarArg(elementType));
    }

    /**
     * Converts a tensor argument to a float tensor type of the same name and rank.
     *
     * @throws OnnxImportException if the argument is not a tensor
     */
    public TensorType toTensorType() {
        if (type instanceof ArgType.TensorArg tensor) {
            return TensorType.ofFloat(name, tensor.rank());
        }
        throw new OnnxImportException(
            "Can't transform " + describe(type) + " argument '" + name + "' to tensor");
    }

    /**
     * Converts the argument to a target scalar or tensor type. Rank-0 tensors
     * are demoted to scalars by {@link ZeroRankScalars#scalarType}.
     *
     * @throws OnnxImportException if the argument is a shape
     */
    public Type toType() {
        if (type instanceof ArgType.TensorArg tensor) {
            if (ZeroRankScalars.isScalar(tensor.rank())) {
                return ZeroRankScalars.scalarType(name, tensor.elementType());
            }
            return TensorType.ofFloat(name, tensor.rank());
        }
        if (type instanceof ArgType.ScalarArg scalar) {
            return new ScalarType(name, scalar.elementType().toScalarKind());
        }
        throw new OnnxImportException("Can't transform shape argument '" + name + "' to tensor");
    }

    private static String describe(ArgType type) {
        if (type instanceof ArgType.ScalarArg) {
            return "scalar";
        }
        return "shape";
    }
}
