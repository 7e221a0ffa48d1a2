package io.surfworks.onnxgrill.codegen;

/**
 * Thrown when a model cannot be turned into source or its outputs cannot be written.
 */
public class CodegenException extends Exception {

    public CodegenException(String message) {
        super(message);
    }

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
