package com.confluenceparser.core.node;

import java.util.List;

/**
 * Link target inside a page.
 *
 * @param anchorName anchor name
 */
public record AnchorMacro(String anchorName) implements MacroNode {

    @Override
    public String macroName() {
        return "anchor";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ANCHOR;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
