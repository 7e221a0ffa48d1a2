package io.surfworks.onnxgrill.api;

/**
 * Source of learned parameters for a generated model.
 *
 * <p>Keys have the form {@code <layer>.<parameter>}, e.g. {@code linear1.weight}
 * or {@code batchnormalization1.running_var}. Implementations decode the record
 * file written at generation time into backend tensors.
 *
 * @param <T> backend tensor handle type
 */
public interface ParameterRecord<T> {

    /**
     * Returns the tensor stored under the given key.
     *
     * @throws IllegalArgumentException if the record has no such key
     */
    T tensor(String key);

    /**
     * Whether the record has a tensor under the given key.
     */
    boolean contains(String key);
}
