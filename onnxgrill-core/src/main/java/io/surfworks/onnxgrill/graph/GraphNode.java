package io.surfworks.onnxgrill.graph;

import io.surfworks.onnxgrill.api.config.BatchNormConfig;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.DropoutConfig;
import io.surfworks.onnxgrill.api.config.LinearConfig;
import io.surfworks.onnxgrill.api.config.MaxPool2dConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Target graph nodes, one variant per operator family.
 *
 * <p>Every variant carries fully typed argument descriptors. Layer variants
 * (those with learned parameters or configuration) also carry a field name,
 * which becomes the generated model's field holding the layer.
 */
public sealed interface GraphNode permits
        GraphNode.BinaryNode, GraphNode.UnaryNode, GraphNode.Conv2dNode, GraphNode.MaxPool2dNode,
        GraphNode.LinearNode, GraphNode.BatchNormNode, GraphNode.MatmulNode, GraphNode.ConcatNode,
        GraphNode.ConstantNode, GraphNode.ReshapeNode, GraphNode.DropoutNode, GraphNode.GlobalAvgPoolNode {

    List<Type> inputTypes();

    List<Type> outputTypes();

    /**
     * Field name of the layer this node instantiates, if any.
     */
    default Optional<String> field() {
        return Optional.empty();
    }

    /**
     * Learned parameters keyed by parameter name ({@code weight}, {@code bias}, ...),
     * in record order.
     */
    default Map<String, ParamData> parameters() {
        return Map.of();
    }

    // ==================== Element-wise ====================

    enum BinaryOp {
        ADD, SUB, MUL, DIV, EQUAL
    }

    /**
     * Element-wise binary operation; either side may be a tensor or a scalar.
     */
    record BinaryNode(BinaryOp op, Type lhs, Type rhs, Type output) implements GraphNode {

        public static BinaryNode add(Type lhs, Type rhs, Type output) {
            return new BinaryNode(BinaryOp.ADD, lhs, rhs, output);
        }

        public static BinaryNode sub(Type lhs, Type rhs, Type output) {
            return new BinaryNode(BinaryOp.SUB, lhs, rhs, output);
        }

        public static BinaryNode mul(Type lhs, Type rhs, Type output) {
            return new BinaryNode(BinaryOp.MUL, lhs, rhs, output);
        }

        public static BinaryNode div(Type lhs, Type rhs, Type output) {
            return new BinaryNode(BinaryOp.DIV, lhs, rhs, output);
        }

        public static BinaryNode equal(Type lhs, Type rhs, Type output) {
            return new BinaryNode(BinaryOp.EQUAL, lhs, rhs, output);
        }

        @Override
        public List<Type> inputTypes() { return List.of(lhs, rhs); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }
    }

    enum UnaryOp {
        RELU, SIGMOID, TRANSPOSE, CAST, FLATTEN, LOG_SOFTMAX
    }

    /**
     * Element-wise or shape-only unary operation.
     *
     * @param params {@code [startDim, endDim]} for FLATTEN, {@code [dim]} for LOG_SOFTMAX, empty otherwise
     */
    record UnaryNode(UnaryOp op, Type input, Type output, List<Integer> params) implements GraphNode {

        public UnaryNode {
            params = List.copyOf(params);
        }

        public static UnaryNode relu(Type input, Type output) {
            return new UnaryNode(UnaryOp.RELU, input, output, List.of());
        }

        public static UnaryNode sigmoid(Type input, Type output) {
            return new UnaryNode(UnaryOp.SIGMOID, input, output, List.of());
        }

        public static UnaryNode transpose(Type input, Type output) {
            return new UnaryNode(UnaryOp.TRANSPOSE, input, output, List.of());
        }

        public static UnaryNode cast(Type input, Type output) {
            return new UnaryNode(UnaryOp.CAST, input, output, List.of());
        }

        public static UnaryNode flatten(Type input, Type output, int startDim, int endDim) {
            return new UnaryNode(UnaryOp.FLATTEN, input, output, List.of(startDim, endDim));
        }

        public static UnaryNode logSoftmax(Type input, Type output, int dim) {
            return new UnaryNode(UnaryOp.LOG_SOFTMAX, input, output, List.of(dim));
        }

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }
    }

    // ==================== Layers ====================

    record Conv2dNode(
            String fieldName,
            TensorType input,
            TensorType output,
            ParamData weight,
            ParamData bias,
            Conv2dConfig config
    ) implements GraphNode {

        public Conv2dNode {
            Objects.requireNonNull(weight, "weight");
        }

        public Optional<ParamData> biasIfPresent() {
            return Optional.ofNullable(bias);
        }

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }

        @Override
        public Optional<String> field() { return Optional.of(fieldName); }

        @Override
        public Map<String, ParamData> parameters() {
            return weightAndBias(weight, bias);
        }
    }

    record LinearNode(
            String fieldName,
            TensorType input,
            TensorType output,
            ParamData weight,
            ParamData bias,
            LinearConfig config
    ) implements GraphNode {

        public LinearNode {
            Objects.requireNonNull(weight, "weight");
        }

        public Optional<ParamData> biasIfPresent() {
            return Optional.ofNullable(bias);
        }

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }

        @Override
        public Optional<String> field() { return Optional.of(fieldName); }

        @Override
        public Map<String, ParamData> parameters() {
            return weightAndBias(weight, bias);
        }
    }

    /**
     * @param dim number of spatial dimensions after the channel axis ({@code input.rank - 2})
     */
    record BatchNormNode(
            int dim,
            String fieldName,
            TensorType input,
            TensorType output,
            ParamData gamma,
            ParamData beta,
            ParamData runningMean,
            ParamData runningVar,
            BatchNormConfig config
    ) implements GraphNode {

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }

        @Override
        public Optional<String> field() { return Optional.of(fieldName); }

        @Override
        public Map<String, ParamData> parameters() {
            Map<String, ParamData> params = new LinkedHashMap<>();
            params.put("gamma", gamma);
            params.put("beta", beta);
            params.put("running_mean", runningMean);
            params.put("running_var", runningVar);
            return Collections.unmodifiableMap(params);
        }
    }

    record MaxPool2dNode(String fieldName, TensorType input, TensorType output, MaxPool2dConfig config)
            implements GraphNode {

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }

        @Override
        public Optional<String> field() { return Optional.of(fieldName); }
    }

    record DropoutNode(String fieldName, TensorType input, TensorType output, DropoutConfig config)
            implements GraphNode {

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }

        @Override
        public Optional<String> field() { return Optional.of(fieldName); }
    }

    record GlobalAvgPoolNode(String fieldName, TensorType input, TensorType output) implements GraphNode {

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }

        @Override
        public Optional<String> field() { return Optional.of(fieldName); }
    }

    // ==================== Tensor operations ====================

    record MatmulNode(TensorType lhs, TensorType rhs, TensorType output) implements GraphNode {

        @Override
        public List<Type> inputTypes() { return List.of(lhs, rhs); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }
    }

    record ConcatNode(List<TensorType> inputs, TensorType output, int dim) implements GraphNode {

        public ConcatNode {
            inputs = List.copyOf(inputs);
        }

        @Override
        public List<Type> inputTypes() { return new ArrayList<>(inputs); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }
    }

    /**
     * @param shape target dimensions, all non-negative
     */
    record ReshapeNode(TensorType input, TensorType output, long[] shape) implements GraphNode {

        @Override
        public List<Type> inputTypes() { return List.of(input); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }

        @Override
        public String toString() {
            return "ReshapeNode[input=" + input.name() + ", output=" + output.name()
                + ", shape=" + Arrays.toString(shape) + "]";
        }
    }

    /**
     * Value of a constant node: a scalar of one of the supported kinds, or a tensor.
     */
    sealed interface ConstantValue permits
            ConstantValue.Float32, ConstantValue.Float64, ConstantValue.Int32,
            ConstantValue.Int64, ConstantValue.Bool, ConstantValue.Tensor {

        record Float32(float value) implements ConstantValue {}

        record Float64(double value) implements ConstantValue {}

        record Int32(int value) implements ConstantValue {}

        record Int64(long value) implements ConstantValue {}

        record Bool(boolean value) implements ConstantValue {}

        record Tensor(TensorType type, ParamData data) implements ConstantValue {}
    }

    record ConstantNode(String name, ConstantValue value, Type output) implements GraphNode {

        @Override
        public List<Type> inputTypes() { return List.of(); }

        @Override
        public List<Type> outputTypes() { return List.of(output); }
    }

    private static Map<String, ParamData> weightAndBias(ParamData weight, ParamData bias) {
        Map<String, ParamData> params = new LinkedHashMap<>();
        params.put("weight", weight);
        if (bias != null) {
            params.put("bias", bias);
        }
        return Collections.unmodifiableMap(params);
    }
}
