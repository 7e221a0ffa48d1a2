package io.surfworks.onnxgrill.api;

import java.util.List;

/**
 * Implemented by every generated model class.
 *
 * <p>The forward method itself is not part of this interface because its
 * arity and parameter types follow the imported graph's signature:
 * <pre>{@code
 * mnist<MyTensor> model = new mnist<>(backend, record);
 * MyTensor logits = model.forward(image);
 * }</pre>
 */
public interface GeneratedModel {

    /**
     * Returns provenance information about this model.
     */
    ModelMetadata metadata();

    /**
     * Returns the names of the forward inputs, in call order.
     */
    List<String> inputNames();

    /**
     * Returns the names of the forward outputs, in return order.
     */
    List<String> outputNames();
}
