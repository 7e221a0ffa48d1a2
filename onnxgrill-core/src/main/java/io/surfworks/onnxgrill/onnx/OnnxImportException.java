package io.surfworks.onnxgrill.onnx;

/**
 * Fatal error while importing an ONNX graph.
 *
 * <p>Import is a one-shot build step, so there is no recoverable channel: an
 * unsupported element kind, a type mismatch at argument conversion or a
 * missing attribute or parameter aborts the whole translation. Messages
 * name the offending node, operator and field.
 */
public class OnnxImportException extends RuntimeException {

    public OnnxImportException(String message) {
        super(message);
    }

    public OnnxImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
