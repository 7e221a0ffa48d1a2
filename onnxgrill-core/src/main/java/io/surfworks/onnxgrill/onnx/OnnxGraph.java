package io.surfworks.onnxgrill.onnx;

import java.util.List;

/**
 * A parsed ONNX graph. Nodes are topologically ordered by the parser.
 */
public record OnnxGraph(List<Node> nodes, List<Argument> inputs, List<Argument> outputs) {

    public OnnxGraph {
        nodes = List.copyOf(nodes);
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }
}
