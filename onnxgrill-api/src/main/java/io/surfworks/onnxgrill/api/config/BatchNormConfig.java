package io.surfworks.onnxgrill.api.config;

/**
 * Batch normalization configuration.
 *
 * @param numFeatures number of channels normalized
 * @param epsilon     value added to the variance for numerical stability
 * @param momentum    running statistics momentum
 */
public record BatchNormConfig(int numFeatures, double epsilon, double momentum) {}
