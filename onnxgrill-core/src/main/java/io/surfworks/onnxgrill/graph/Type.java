package io.surfworks.onnxgrill.graph;

/**
 * Fully typed argument descriptor of a target node.
 *
 * <p>The name doubles as the symbol name in generated code.
 */
public sealed interface Type permits TensorType, ScalarType {

    String name();
}
