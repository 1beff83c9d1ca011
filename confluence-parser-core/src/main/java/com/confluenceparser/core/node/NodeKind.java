package com.confluenceparser.core.node;

/**
 * Discriminant of the {@link Node} variants.
 *
 * <p>Whether a node is block-level is fixed per kind. Block-level nodes are separated from
 * their siblings by a blank line in extracted text; inline nodes run together.
 */
public enum NodeKind {
    TEXT(false),
    IMAGE(false),
    EMOTICON(false),
    TIME(false),
    PLACEHOLDER(false),
    TEXT_EFFECT(false),

    PARAGRAPH(true),
    LINE_BREAK(false),
    HORIZONTAL_RULE(true),

    HEADING(true),
    LIST(true),
    LIST_ITEM(true),
    DECISION_LIST(true),
    DECISION_LIST_ITEM(true),

    TABLE(true),
    TABLE_ROW(true),
    TABLE_CELL(false),

    LAYOUT(true),
    LAYOUT_SECTION(true),
    LAYOUT_CELL(true),

    LINK(false),
    RESOURCE_IDENTIFIER(false),

    PANEL(true),
    CODE(true),
    STATUS(false),
    EXPAND(true),
    DETAILS(true),
    TOC(true),
    JIRA(false),
    INCLUDE(true),
    EXCERPT_INCLUDE(true),
    TASKS_REPORT(true),
    ATTACHMENTS(true),
    VIEW_PDF(true),
    VIEW_FILE(true),
    PROFILE(true),
    ANCHOR(false),
    EXCERPT(true),

    /** Pass-through for unknown elements and neutral wrappers. */
    CONTAINER(false),

    /** Pass-through for macros without a registered rule. */
    UNKNOWN_MACRO(false),

    /** Synthesized wrapper for several top-level nodes. */
    FRAGMENT(true);

    private final boolean blockLevel;

    NodeKind(boolean blockLevel) {
        this.blockLevel = blockLevel;
    }

    public boolean isBlockLevel() {
        return blockLevel;
    }
}
