package io.surfworks.onnxgrill.api;

/**
 * A stateful layer created once by a generated model's constructor
 * and applied on every forward pass.
 *
 * @param <T> backend tensor handle type
 */
@FunctionalInterface
public interface Layer<T> {

    T forward(T input);
}
