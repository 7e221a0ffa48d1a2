package io.surfworks.onnxgrill.onnx;

import java.util.Objects;

/**
 * Type of an ONNX argument as reported by the parser.
 */
public sealed interface ArgType permits ArgType.TensorArg, ArgType.ScalarArg, ArgType.ShapeArg {

    record TensorArg(int rank, ElementType elementType) implements ArgType {
        public TensorArg {
            Objects.requireNonNull(elementType, "elementType");
        }
    }

    record ScalarArg(ElementType elementType) implements ArgType {
        public ScalarArg {
            Objects.requireNonNull(elementType, "elementType");
        }
    }

    /**
     * The runtime shape of another tensor; never convertible to a tensor type.
     */
    record ShapeArg(int dims) implements ArgType {}
}
