package io.surfworks.onnxgrill.onnx;

import io.surfworks.onnxgrill.api.config.BatchNormConfig;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.DropoutConfig;
import io.surfworks.onnxgrill.api.config.LinearConfig;
import io.surfworks.onnxgrill.api.config.MaxPool2dConfig;

/**
 * Turns a node's raw attributes into validated, operator-specific configuration.
 *
 * <p>Implementations only read the node: attributes are looked up, parameter
 * states may be inspected for their shapes, but nothing is consumed.
 *
 * @see OnnxOpConfigs
 */
public interface OpConfigExtractor {

    /**
     * Dimensions collapsed by a flatten, both inclusive.
     */
    record FlattenConfig(int startDim, int endDim) {}

    FlattenConfig flattenConfig(Node node);

    int logSoftmaxConfig(Node node);

    int concatConfig(Node node);

    LinearConfig linearConfig(Node node);

    Conv2dConfig conv2dConfig(Node node);

    MaxPool2dConfig maxPool2dConfig(Node node);

    BatchNormConfig batchNormConfig(Node node);

    DropoutConfig dropoutConfig(Node node);
}
