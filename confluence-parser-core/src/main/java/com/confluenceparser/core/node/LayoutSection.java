package com.confluenceparser.core.node;

import java.util.List;

/**
 * A row of a page layout.
 *
 * @param sectionType column arrangement, null if absent or unknown
 * @param breakoutMode breakout mode, null if absent or unknown
 * @param breakoutWidth breakout width as written
 * @param children layout cells
 */
public record LayoutSection(
    LayoutSectionType sectionType,
    BreakoutMode breakoutMode,
    String breakoutWidth,
    List<Node> children
) implements Node {

    public LayoutSection {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAYOUT_SECTION;
    }
}
