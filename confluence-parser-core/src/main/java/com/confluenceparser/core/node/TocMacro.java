package com.confluenceparser.core.node;

import java.util.List;

/**
 * Table of contents.
 *
 * @param style bullet style
 * @param minLevel lowest heading level included
 * @param maxLevel highest heading level included
 * @param include heading include pattern
 * @param exclude heading exclude pattern
 * @param outline whether outline numbering is used
 * @param type {@code list} or {@code flat}
 * @param printable whether the table is printed
 */
public record TocMacro(
    String style,
    Integer minLevel,
    Integer maxLevel,
    String include,
    String exclude,
    boolean outline,
    String type,
    boolean printable
) implements MacroNode {

    @Override
    public String macroName() {
        return "toc";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TOC;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
