package com.confluenceparser.core.node;

import java.util.List;

/**
 * A table. Row groups ({@code tbody}, {@code thead}, {@code tfoot}) are flattened, so the
 * children are the rows themselves.
 *
 * @param width {@code data-table-width} attribute
 * @param layout {@code data-layout} attribute
 * @param localId {@code ac:local-id} attribute
 * @param displayMode {@code data-table-display-mode} attribute
 * @param children rows
 */
public record Table(
    String width,
    String layout,
    String localId,
    String displayMode,
    List<Node> children
) implements Node {

    public Table {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE;
    }
}
