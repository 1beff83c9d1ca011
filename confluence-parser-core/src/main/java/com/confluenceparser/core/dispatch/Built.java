package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.node.Node;

import java.util.List;

/**
 * Result of building one element: the nodes it contributes and the diagnostics raised while
 * building it.
 *
 * <p>Most elements contribute exactly one node. Row groups such as {@code tbody} contribute
 * their rows directly, and column groups contribute nothing. The dispatcher records the
 * diagnostics at the position the element was entered, so an element's own diagnostics come
 * before those of its descendants.
 *
 * @param nodes contributed nodes in order
 * @param diagnostics problems found on this element itself
 */
public record Built(List<Node> nodes, List<Diagnostic> diagnostics) {

    public Built {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static Built of(Node node) {
        return new Built(List.of(node), List.of());
    }

    public static Built of(Node node, List<Diagnostic> diagnostics) {
        return new Built(List.of(node), diagnostics);
    }

    /**
     * Contributes several nodes in place of the element.
     *
     * @param nodes nodes to splice into the parent
     * @return result without diagnostics
     */
    public static Built unwrapped(List<Node> nodes) {
        return new Built(nodes, List.of());
    }

    /**
     * Contributes nothing.
     *
     * @return empty result
     */
    public static Built skip() {
        return new Built(List.of(), List.of());
    }
}
