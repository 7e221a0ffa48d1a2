package io.surfworks.onnxgrill.graph;

import io.surfworks.onnxgrill.api.TensorKind;

import java.util.Arrays;
import java.util.Objects;

/**
 * A tensor argument.
 *
 * @param name  symbol name
 * @param rank  number of dimensions
 * @param kind  element family
 * @param shape static dimensions, or {@code null} when unknown
 */
public record TensorType(String name, int rank, TensorKind kind, long[] shape) implements Type {

    public TensorType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (rank < 0) {
            throw new IllegalArgumentException("Negative rank " + rank + " for tensor " + name);
        }
    }

    /**
     * Float tensor of unknown shape, the default for converted arguments.
     */
    public static TensorType ofFloat(String name, int rank) {
        return new TensorType(name, rank, TensorKind.FLOAT, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorType that)) return false;
        return rank == that.rank
            && name.equals(that.name)
            && kind == that.kind
            && Arrays.equals(shape, that.shape);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name, rank, kind) + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        return "TensorType[name=" + name + ", rank=" + rank + ", kind=" + kind
            + ", shape=" + Arrays.toString(shape) + "]";
    }
}
