package io.surfworks.onnxgrill.api;

import io.surfworks.onnxgrill.api.config.BatchNormConfig;
import io.surfworks.onnxgrill.api.config.Conv2dConfig;
import io.surfworks.onnxgrill.api.config.DropoutConfig;
import io.surfworks.onnxgrill.api.config.LinearConfig;
import io.surfworks.onnxgrill.api.config.MaxPool2dConfig;

import java.util.List;

/**
 * Tensor operations that generated model code is written against.
 *
 * <p>Generated models never execute anything themselves; every statement of
 * a generated {@code forward} method is a call on this interface, so the same
 * generated class runs on any backend implementing it.
 *
 * <h2>Execution Model</h2>
 * <pre>
 * Build Time:
 *   model.onnx → parser → target graph → model.java + model.safetensors
 *
 * Runtime:
 *   new model&lt;&gt;(backend, record).forward(inputs) → outputs
 * </pre>
 *
 * @param <T> backend tensor handle type
 */
public interface ModelBackend<T> {

    // ==================== Element-wise binary ====================

    T add(T lhs, T rhs);

    T addScalar(T lhs, double rhs);

    T sub(T lhs, T rhs);

    T subScalar(T lhs, double rhs);

    T mul(T lhs, T rhs);

    T mulScalar(T lhs, double rhs);

    T div(T lhs, T rhs);

    T divScalar(T lhs, double rhs);

    T equal(T lhs, T rhs);

    T equalScalar(T lhs, double rhs);

    // ==================== Element-wise unary ====================

    T neg(T input);

    T reciprocal(T input);

    T relu(T input);

    T sigmoid(T input);

    /**
     * Swaps the last two dimensions.
     */
    T transpose(T input);

    T cast(T input, TensorKind kind);

    // ==================== Shape ====================

    /**
     * Flattens dimensions {@code startDim..endDim} (inclusive) into one.
     */
    T flatten(T input, int startDim, int endDim);

    T reshape(T input, long[] shape);

    T concat(List<T> inputs, int dim);

    // ==================== Linear algebra and activations ====================

    T matmul(T lhs, T rhs);

    T logSoftmax(T input, int dim);

    // ==================== Constants ====================

    T tensor(float[] values, long[] shape);

    T tensor(double[] values, long[] shape);

    T tensor(int[] values, long[] shape);

    T tensor(long[] values, long[] shape);

    // ==================== Layers ====================

    /**
     * @param bias the bias tensor, or {@code null} when the layer has none
     */
    Layer<T> linear(LinearConfig config, T weight, T bias);

    /**
     * @param bias the bias tensor, or {@code null} when the layer has none
     */
    Layer<T> conv2d(Conv2dConfig config, T weight, T bias);

    /**
     * @param dim number of spatial dimensions following the channel axis
     */
    Layer<T> batchNorm(int dim, BatchNormConfig config, T gamma, T beta, T runningMean, T runningVar);

    Layer<T> maxPool2d(MaxPool2dConfig config);

    Layer<T> dropout(DropoutConfig config);

    Layer<T> globalAvgPool();
}
