package io.surfworks.onnxgrill.api;

/**
 * Element family of a tensor, independent of its concrete precision.
 */
public enum TensorKind {
    FLOAT,
    INT,
    BOOL
}
