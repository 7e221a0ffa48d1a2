package io.surfworks.onnxgrill.onnx;

import io.surfworks.onnxgrill.api.config.BatchNormConfig;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.LinearConfig;
import io.surfworks.onnxgrill.api.config.MaxPool2dConfig;
import io.surfworks.onnxgrill.api.config.PaddingConfig2d;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OnnxOpConfigsTest {

    private final OnnxOpConfigs configs = new OnnxOpConfigs();

    @Test
    void testFlattenNegativeAxis() {
        Node node = node(NodeType.FLATTEN, 3, Map.of("axis", new AttributeValue.Int64(-1)), List.of());

        assertEquals(new OpConfigExtractor.FlattenConfig(2, 2), configs.flattenConfig(node));
    }

    @Test
    void testLogSoftmaxDefaultsToLastAxis() {
        assertEquals(3, configs.logSoftmaxConfig(node(NodeType.LOG_SOFTMAX, 4, Map.of(), List.of())));
    }

    @Test
    void testConcatAxisIsRequired() {
        Node node = node(NodeType.CONCAT, 2, Map.of(), List.of());

        OnnxImportException e = assertThrows(OnnxImportException.class, () -> configs.concatConfig(node));
        assertTrue(e.getMessage().contains("'axis'"), e.getMessage());
    }

    @Test
    void testAxisOutOfRange() {
        Node node = node(NodeType.CONCAT, 2, Map.of("axis", new AttributeValue.Int64(5)), List.of());

        assertThrows(OnnxImportException.class, () -> configs.concatConfig(node));
    }

    @Test
    void testConvDefaultsFromWeight() {
        Node node = node(NodeType.CONV2D, 4, Map.of("group", new AttributeValue.Int64(2)),
            List.of(state(8, 3, 5, 5)));

        Conv2dConfig config = configs.conv2dConfig(node);

        assertArrayEquals(new int[]{6, 8}, config.channels());
        assertArrayEquals(new int[]{5, 5}, config.kernelSize());
        assertArrayEquals(new int[]{1, 1}, config.stride());
        assertArrayEquals(new int[]{1, 1}, config.dilation());
        assertEquals(2, config.groups());
        assertEquals(new PaddingConfig2d.Valid(), config.padding());
        assertEquals(false, config.bias());
    }

    @Test
    void testConvSymmetricPadding() {
        Node node = node(NodeType.CONV2D, 4, Map.of("pads", new AttributeValue.Int64s(new long[]{1, 2, 1, 2})),
            List.of(state(4, 1, 3, 3), state(4)));

        Conv2dConfig config = configs.conv2dConfig(node);

        assertEquals(new PaddingConfig2d.Explicit(1, 2), config.padding());
        assertEquals(true, config.bias());
    }

    @Test
    void testAsymmetricPaddingIsFatal() {
        Node node = node(NodeType.CONV2D, 4, Map.of("pads", new AttributeValue.Int64s(new long[]{0, 0, 1, 1})),
            List.of(state(4, 1, 3, 3)));

        OnnxImportException e = assertThrows(OnnxImportException.class, () -> configs.conv2dConfig(node));
        assertTrue(e.getMessage().contains("Asymmetric"), e.getMessage());
    }

    @Test
    void testAutoPadSame() {
        Node node = node(NodeType.MAX_POOL2D, 4, Map.of(
            "kernel_shape", new AttributeValue.Int64s(new long[]{3, 3}),
            "strides", new AttributeValue.Int64s(new long[]{2, 2}),
            "auto_pad", new AttributeValue.Str("SAME_UPPER")), List.of());

        MaxPool2dConfig config = configs.maxPool2dConfig(node);

        assertEquals(new MaxPool2dConfig(new int[]{3, 3}, new int[]{2, 2}, new PaddingConfig2d.Same()), config);
    }

    @Test
    void testMaxPoolRequiresKernel() {
        Node node = node(NodeType.MAX_POOL2D, 4, Map.of(), List.of());

        assertThrows(OnnxImportException.class, () -> configs.maxPool2dConfig(node));
    }

    @Test
    void testBatchNormDefaults() {
        Node node = node(NodeType.BATCH_NORMALIZATION, 4, Map.of("epsilon", new AttributeValue.Float32(1e-3f)),
            List.of(state(16), state(16), state(16), state(16)));

        BatchNormConfig config = configs.batchNormConfig(node);

        assertEquals(16, config.numFeatures());
        assertEquals((double) 1e-3f, config.epsilon());
        assertEquals(0.9, config.momentum());
    }

    @Test
    void testDropoutRatio() {
        assertEquals(0.5, configs.dropoutConfig(node(NodeType.DROPOUT, 2, Map.of(), List.of())).prob());
        assertEquals((double) 0.25f, configs.dropoutConfig(
            node(NodeType.DROPOUT, 2, Map.of("ratio", new AttributeValue.Float32(0.25f)), List.of())).prob());
    }

    @Test
    void testWrongAttributeKindIsFatal() {
        Node node = node(NodeType.FLATTEN, 2, Map.of("axis", new AttributeValue.Str("one")), List.of());

        assertThrows(OnnxImportException.class, () -> configs.flattenConfig(node));
    }

    @Test
    void testLinearFromWeightShape() {
        Node node = node(NodeType.LINEAR, 2, Map.of(), List.of(state(10, 4), state(4)));

        assertEquals(new LinearConfig(10, 4, true), configs.linearConfig(node));
    }

    private static State state(long... shape) {
        return new State("p", new Tensor(shape.length, ElementType.FLOAT32, shape, null));
    }

    private static Node node(NodeType type, int inputRank, Map<String, AttributeValue> attributes, List<State> states) {
        return new Node("n", type,
            List.of(Argument.tensor("x", inputRank, ElementType.FLOAT32)),
            List.of(Argument.tensor("y", inputRank, ElementType.FLOAT32)),
            attributes, states);
    }
}
