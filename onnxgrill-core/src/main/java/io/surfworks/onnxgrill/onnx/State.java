package io.surfworks.onnxgrill.onnx;

import java.util.Objects;

/**
 * A learned parameter attached to a node out-of-band from its attributes.
 */
public record State(String name, Tensor tensor) {

    public State {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tensor, "tensor");
    }
}
