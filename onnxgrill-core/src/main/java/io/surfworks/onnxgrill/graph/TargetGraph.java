package io.surfworks.onnxgrill.graph;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered container of target nodes plus the generated model's call signature.
 *
 * <p>Nodes are kept in registration order, which is the source order: every
 * generated statement may only reference names produced by earlier ones.
 * Layer fields may not reuse the generated class's own members. Other name
 * collisions and dangling references are not checked here; they surface when
 * the generated source is compiled.
 */
public final class TargetGraph {

    /** Members of every generated model class; layer fields may not reuse them. */
    private static final Set<String> RESERVED_FIELDS = Set.of("backend", "METADATA");

    private final List<GraphNode> nodes = new ArrayList<>();
    private List<String> inputNames;
    private List<String> outputNames;
    private List<Type> inputs;
    private List<Type> outputs;

    /**
     * Appends a node.
     *
     * @throws IllegalArgumentException if a referenced argument or field name is not a valid identifier
     * @throws IllegalStateException    if the call signature was already registered
     */
    public void register(GraphNode node) {
        if (inputNames != null) {
            throw new IllegalStateException("Cannot register nodes after inputs and outputs were registered");
        }
        for (Type type : node.inputTypes()) {
            requireIdentifier(type.name(), "input", node);
        }
        for (Type type : node.outputTypes()) {
            requireIdentifier(type.name(), "output", node);
        }
        node.field().ifPresent(field -> {
            requireIdentifier(field, "field", node);
            if (RESERVED_FIELDS.contains(field)) {
                throw new IllegalArgumentException(
                    "Field name '" + field + "' in " + node.getClass().getSimpleName()
                        + " clashes with a generated class member");
            }
        });
        nodes.add(node);
    }

    /**
     * Records the call signature. Must be called exactly once, after every node.
     *
     * <p>Input types are taken from the first node consuming each name, output
     * types from the last node producing it.
     *
     * @throws IllegalStateException if called twice, or a name is not referenced by any node
     */
    public void registerInputOutput(List<String> inputNames, List<String> outputNames) {
        registerInputOutput(inputNames, outputNames, Map.of());
    }

    /**
     * Records the call signature. Inputs that no node consumes take their type
     * from {@code declaredInputs}.
     *
     * @throws IllegalStateException if called twice, an input is neither consumed nor declared,
     *                               or an output is not produced by any node
     */
    public void registerInputOutput(List<String> inputNames, List<String> outputNames,
                                    Map<String, Type> declaredInputs) {
        if (this.inputNames != null) {
            throw new IllegalStateException("Inputs and outputs are already registered");
        }
        List<Type> resolvedInputs = new ArrayList<>(inputNames.size());
        for (String name : inputNames) {
            resolvedInputs.add(findInput(name, declaredInputs));
        }
        List<Type> resolvedOutputs = new ArrayList<>(outputNames.size());
        for (String name : outputNames) {
            resolvedOutputs.add(findOutput(name));
        }
        this.inputNames = List.copyOf(inputNames);
        this.outputNames = List.copyOf(outputNames);
        this.inputs = List.copyOf(resolvedInputs);
        this.outputs = List.copyOf(resolvedOutputs);
    }

    public List<GraphNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public boolean isComplete() {
        return inputNames != null;
    }

    public List<String> inputNames() {
        requireComplete();
        return inputNames;
    }

    public List<String> outputNames() {
        requireComplete();
        return outputNames;
    }

    public List<Type> inputs() {
        requireComplete();
        return inputs;
    }

    public List<Type> outputs() {
        requireComplete();
        return outputs;
    }

    /**
     * All learned parameters keyed {@code field.parameter}, in node order.
     */
    public Map<String, ParamData> parameters() {
        Map<String, ParamData> all = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            node.field().ifPresent(field ->
                node.parameters().forEach((key, data) -> all.put(field + "." + key, data)));
        }
        return Collections.unmodifiableMap(all);
    }

    private Type findInput(String name, Map<String, Type> declaredInputs) {
        for (GraphNode node : nodes) {
            for (Type type : node.inputTypes()) {
                if (type.name().equals(name)) {
                    return type;
                }
            }
        }
        Type declared = declaredInputs.get(name);
        if (declared != null) {
            requireIdentifier(declared.name(), "input", null);
            return declared;
        }
        throw new IllegalStateException("Declared input '" + name + "' is not consumed by any node");
    }

    private Type findOutput(String name) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            for (Type type : nodes.get(i).outputTypes()) {
                if (type.name().equals(name)) {
                    return type;
                }
            }
        }
        throw new IllegalStateException("Declared output '" + name + "' is not produced by any node");
    }

    private void requireComplete() {
        if (inputNames == null) {
            throw new IllegalStateException("Inputs and outputs have not been registered");
        }
    }

    private static void requireIdentifier(String name, String role, GraphNode node) {
        if (name == null || !SourceVersion.isIdentifier(name) || SourceVersion.isKeyword(name)) {
            throw new IllegalArgumentException(
                "Invalid " + role + " name '" + name + "'"
                    + (node == null ? "" : " in " + node.getClass().getSimpleName()));
        }
    }
}
