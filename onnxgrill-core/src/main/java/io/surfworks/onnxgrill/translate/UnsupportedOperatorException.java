package io.surfworks.onnxgrill.translate;

import io.surfworks.onnxgrill.onnx.NodeType;
import io.surfworks.onnxgrill.onnx.OnnxImportException;

/**
 * Thrown when a graph contains an operator the translator has no rule for.
 */
public class UnsupportedOperatorException extends OnnxImportException {

    private final NodeType nodeType;

    public UnsupportedOperatorException(NodeType nodeType, String nodeName) {
        super("Unsupported node conversion " + nodeType + " for node '" + nodeName + "'");
        this.nodeType = nodeType;
    }

    public NodeType nodeType() {
        return nodeType;
    }
}
