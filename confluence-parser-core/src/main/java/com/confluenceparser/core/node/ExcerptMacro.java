package com.confluenceparser.core.node;

import java.util.List;

/**
 * Marks the excerpt of a page.
 *
 * @param name excerpt name
 * @param hidden whether the excerpt is hidden on its own page
 * @param children excerpt body
 */
public record ExcerptMacro(String name, boolean hidden, List<Node> children) implements MacroNode {

    public ExcerptMacro {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public String macroName() {
        return "excerpt";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCERPT;
    }
}
