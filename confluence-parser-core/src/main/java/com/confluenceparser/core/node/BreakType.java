package com.confluenceparser.core.node;

/**
 * Kinds of {@link TextBreakElement}.
 */
public enum BreakType {
    /** {@code <p>}, a block that carries inline children */
    PARAGRAPH(NodeKind.PARAGRAPH),

    /** {@code <br>}, renders a single newline */
    LINE_BREAK(NodeKind.LINE_BREAK),

    /** {@code <hr>}, block-level with no text */
    HORIZONTAL_RULE(NodeKind.HORIZONTAL_RULE);

    private final NodeKind kind;

    BreakType(NodeKind kind) {
        this.kind = kind;
    }

    public NodeKind kind() {
        return kind;
    }
}
