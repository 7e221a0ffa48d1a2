package io.surfworks.onnxgrill.api.config;

/**
 * Fully connected layer configuration.
 *
 * @param dInput  input features
 * @param dOutput output features
 * @param bias    whether the layer adds a bias
 */
public record LinearConfig(int dInput, int dOutput, boolean bias) {}
