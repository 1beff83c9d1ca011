package com.confluenceparser.core.node;

import java.util.List;

/**
 * Wrapper synthesized when markup has several top-level elements.
 *
 * @param children child nodes
 */
public record Fragment(List<Node> children) implements Node {

    public Fragment {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FRAGMENT;
    }
}
