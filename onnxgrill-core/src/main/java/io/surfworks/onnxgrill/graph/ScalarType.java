package io.surfworks.onnxgrill.graph;

import java.util.Objects;

/**
 * A scalar argument: {@code double x}.
 */
public record ScalarType(String name, ScalarKind kind) implements Type {

    public ScalarType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }
}
