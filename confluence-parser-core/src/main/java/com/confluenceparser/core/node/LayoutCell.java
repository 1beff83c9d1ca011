package com.confluenceparser.core.node;

import java.util.List;

/**
 * One column of a {@link LayoutSection}.
 *
 * @param children child nodes
 */
public record LayoutCell(List<Node> children) implements Node {

    public LayoutCell {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAYOUT_CELL;
    }
}
