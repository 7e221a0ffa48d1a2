package io.surfworks.onnxgrill.translate;

import io.surfworks.onnxgrill.onnx.Node;
import io.surfworks.onnxgrill.onnx.OnnxImportException;
import io.surfworks.onnxgrill.onnx.State;
import io.surfworks.onnxgrill.onnx.Tensor;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * First-in-first-out view of a node's learned parameters.
 *
 * <p>Each operator drains its entries in a fixed order (weight then bias,
 * or gamma, beta, running mean, running variance). Missing entries and
 * entries left over after draining are both errors naming the node.
 */
final class ParameterQueue {

    private final Node node;
    private final Deque<State> states;

    ParameterQueue(Node node) {
        this.node = node;
        this.states = new ArrayDeque<>(node.states());
    }

    Tensor takeWeight() {
        return take("weight");
    }

    /**
     * Takes the bias if the operator's config says there is one.
     *
     * @return the bias, or {@code null} when {@code present} is false
     */
    Tensor takeBias(boolean present) {
        return present ? take("bias") : null;
    }

    Tensor take(String what) {
        State state = states.pollFirst();
        if (state == null) {
            throw new OnnxImportException(
                capitalize(what) + " is required for " + node.nodeType() + " node '" + node.name() + "'");
        }
        return state.tensor();
    }

    void requireDrained() {
        if (!states.isEmpty()) {
            throw new OnnxImportException(
                node.nodeType() + " node '" + node.name() + "' has " + states.size()
                    + " unexpected parameter entries, first is '" + states.peekFirst().name() + "'");
        }
    }

    private static String capitalize(String what) {
        return Character.toUpperCase(what.charAt(0)) + what.substring(1);
    }
}
