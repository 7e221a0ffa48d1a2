package io.surfworks.onnxgrill.api.config;

/**
 * Dropout configuration.
 *
 * @param prob probability of zeroing an element during training
 */
public record DropoutConfig(double prob) {}
