package com.confluenceparser.core.node;

import java.util.List;

/**
 * Page layout from {@code ac:layout}. Children are {@link LayoutSection}s.
 *
 * @param children child nodes
 */
public record LayoutElement(List<Node> children) implements Node {

    public LayoutElement {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAYOUT;
    }
}
