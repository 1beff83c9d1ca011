package com.confluenceparser.core.node;

import java.util.List;

/**
 * A table row. Children are {@link TableCell}s.
 *
 * @param children child nodes
 */
public record TableRow(List<Node> children) implements Node {

    public TableRow {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE_ROW;
    }
}
