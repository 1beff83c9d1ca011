package com.confluenceparser.core.node;

import java.util.List;

/**
 * Collapsible section. Only the body appears in extracted text.
 *
 * @param title expander title
 * @param breakoutWidth breakout width as written
 * @param children body
 */
public record ExpandMacro(String title, String breakoutWidth, List<Node> children) implements MacroNode {

    public ExpandMacro {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public String macroName() {
        return "expand";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPAND;
    }
}
