package com.confluenceparser.core.node;

import java.util.List;

/**
 * A header ({@code th}) or data ({@code td}) cell.
 *
 * @param header true for {@code th}
 * @param rowspan row span, null if not given
 * @param colspan column span, null if not given
 * @param children cell content
 */
public record TableCell(boolean header, Integer rowspan, Integer colspan, List<Node> children) implements Node {

    public TableCell {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE_CELL;
    }
}
