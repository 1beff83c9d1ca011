package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * A paragraph, line break or horizontal rule.
 *
 * <p>The three share one record but differ in {@link #kind()}: a paragraph is a block with
 * children, a line break is inline, and a horizontal rule is a block with no text.
 *
 * @param breakType which break this is
 * @param children paragraph content, always empty for the other two
 */
public record TextBreakElement(BreakType breakType, List<Node> children) implements Node {

    public TextBreakElement {
        Objects.requireNonNull(breakType, "breakType must not be null");
        children = children == null ? List.of() : List.copyOf(children);
        if (breakType != BreakType.PARAGRAPH && !children.isEmpty()) {
            throw new IllegalArgumentException(breakType + " cannot have children");
        }
    }

    public static TextBreakElement paragraph(List<Node> children) {
        return new TextBreakElement(BreakType.PARAGRAPH, children);
    }

    public static TextBreakElement lineBreak() {
        return new TextBreakElement(BreakType.LINE_BREAK, List.of());
    }

    public static TextBreakElement horizontalRule() {
        return new TextBreakElement(BreakType.HORIZONTAL_RULE, List.of());
    }

    @Override
    public NodeKind kind() {
        return breakType.kind();
    }
}
