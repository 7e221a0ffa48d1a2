package io.surfworks.onnxgrill.onnx;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the parsed ONNX graph, with its attributes and learned parameters
 * fully populated by the parser.
 *
 * @param name       unique node name, used as the generated layer field name
 * @param nodeType   operator kind
 * @param inputs     ordered inputs
 * @param outputs    ordered outputs
 * @param attributes attribute map
 * @param states     learned parameters in operator-specific order
 */
public record Node(
        String name,
        NodeType nodeType,
        List<Argument> inputs,
        List<Argument> outputs,
        Map<String, AttributeValue> attributes,
        List<State> states
) {

    public Node {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(nodeType, "nodeType");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        states = List.copyOf(states);
    }

    /**
     * Returns the input at {@code index}.
     *
     * @throws OnnxImportException if the node has fewer inputs
     */
    public Argument input(int index) {
        if (index >= inputs.size()) {
            throw new OnnxImportException(
                nodeType + " node '" + name + "' is missing input " + index);
        }
        return inputs.get(index);
    }

    /**
     * Returns the output at {@code index}.
     *
     * @throws OnnxImportException if the node has fewer outputs
     */
    public Argument output(int index) {
        if (index >= outputs.size()) {
            throw new OnnxImportException(
                nodeType + " node '" + name + "' is missing output " + index);
        }
        return outputs.get(index);
    }

    public Optional<AttributeValue> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * Returns a required attribute.
     *
     * @throws OnnxImportException if the attribute is absent
     */
    public AttributeValue requireAttribute(String key) {
        AttributeValue value = attributes.get(key);
        if (value == null) {
            throw new OnnxImportException(
                nodeType + " node '" + name + "' is missing required attribute '" + key + "'");
        }
        return value;
    }
}
