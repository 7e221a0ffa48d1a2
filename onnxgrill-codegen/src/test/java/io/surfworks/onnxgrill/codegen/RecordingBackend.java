package io.surfworks.onnxgrill.codegen;

import io.surfworks.onnxgrill.api.Layer;
import io.surfworks.onnxgrill.api.ModelBackend;
import io.surfworks.onnxgrill.api.ParameterRecord;
import io.surfworks.onnxgrill.api.TensorKind;
import io.surfworks.onnxgrill.api.config.BatchNormConfig;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.DropoutConfig;
import io.surfworks.onnxgrill.api.config.LinearConfig;
import io.surfworks.onnxgrill.api.config.MaxPool2dConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Backend whose "tensors" are strings describing how they were computed, so
 * tests can check the data flow of generated models.
 */
public final class RecordingBackend implements ModelBackend<String> {

    /** Layers created, in construction order. */
    public final List<String> layers = new ArrayList<>();

    /** Configurations passed to layer factories, in construction order. */
    public final List<Object> configs = new ArrayList<>();

    /**
     * Parameter record answering every key with {@code param:<key>}.
     */
    public static ParameterRecord<String> record() {
        return new ParameterRecord<>() {
            @Override
            public String tensor(String key) {
                return "param:" + key;
            }

            @Override
            public boolean contains(String key) {
                return true;
            }
        };
    }

    private static String call(String op, Object... args) {
        StringBuilder sb = new StringBuilder(op).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(args[i]);
        }
        return sb.append(')').toString();
    }

    @Override public String add(String lhs, String rhs) { return call("add", lhs, rhs); }
    @Override public String addScalar(String lhs, double rhs) { return call("addScalar", lhs, rhs); }
    @Override public String sub(String lhs, String rhs) { return call("sub", lhs, rhs); }
    @Override public String subScalar(String lhs, double rhs) { return call("subScalar", lhs, rhs); }
    @Override public String mul(String lhs, String rhs) { return call("mul", lhs, rhs); }
    @Override public String mulScalar(String lhs, double rhs) { return call("mulScalar", lhs, rhs); }
    @Override public String div(String lhs, String rhs) { return call("div", lhs, rhs); }
    @Override public String divScalar(String lhs, double rhs) { return call("divScalar", lhs, rhs); }
    @Override public String equal(String lhs, String rhs) { return call("equal", lhs, rhs); }
    @Override public String equalScalar(String lhs, double rhs) { return call("equalScalar", lhs, rhs); }

    @Override public String neg(String input) { return call("neg", input); }
    @Override public String reciprocal(String input) { return call("reciprocal", input); }
    @Override public String relu(String input) { return call("relu", input); }
    @Override public String sigmoid(String input) { return call("sigmoid", input); }
    @Override public String transpose(String input) { return call("transpose", input); }
    @Override public String cast(String input, TensorKind kind) { return call("cast", input, kind); }

    @Override public String flatten(String input, int startDim, int endDim) { return call("flatten", input, startDim, endDim); }
    @Override public String reshape(String input, long[] shape) { return call("reshape", input, Arrays.toString(shape)); }
    @Override public String concat(List<String> inputs, int dim) { return call("concat", inputs, dim); }

    @Override public String matmul(String lhs, String rhs) { return call("matmul", lhs, rhs); }
    @Override public String logSoftmax(String input, int dim) { return call("logSoftmax", input, dim); }

    @Override
    public String tensor(float[] values, long[] shape) {
        return call("floats", Arrays.toString(values), Arrays.toString(shape));
    }

    @Override
    public String tensor(double[] values, long[] shape) {
        return call("doubles", Arrays.toString(values), Arrays.toString(shape));
    }

    @Override
    public String tensor(int[] values, long[] shape) {
        return call("ints", Arrays.toString(values), Arrays.toString(shape));
    }

    @Override
    public String tensor(long[] values, long[] shape) {
        return call("longs", Arrays.toString(values), Arrays.toString(shape));
    }

    @Override
    public Layer<String> linear(LinearConfig config, String weight, String bias) {
        layers.add(call("linear", weight, bias));
        configs.add(config);
        return input -> call("linear" + config.dInput() + "x" + config.dOutput(), input);
    }

    @Override
    public Layer<String> conv2d(Conv2dConfig config, String weight, String bias) {
        layers.add(call("conv2d", weight, bias));
        configs.add(config);
        return input -> call("conv2d", input);
    }

    @Override
    public Layer<String> batchNorm(int dim, BatchNormConfig config, String gamma, String beta,
                                   String runningMean, String runningVar) {
        layers.add(call("batchNorm", dim, gamma, beta, runningMean, runningVar));
        configs.add(config);
        return input -> call("batchNorm", input);
    }

    @Override
    public Layer<String> maxPool2d(MaxPool2dConfig config) {
        layers.add(call("maxPool2d"));
        configs.add(config);
        return input -> call("maxPool2d", input);
    }

    @Override
    public Layer<String> dropout(DropoutConfig config) {
        layers.add(call("dropout"));
        configs.add(config);
        return input -> call("dropout", input);
    }

    @Override
    public Layer<String> globalAvgPool() {
        layers.add(call("globalAvgPool"));
        return input -> call("globalAvgPool", input);
    }
}
