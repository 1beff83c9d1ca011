package com.confluenceparser.core.node;

import java.util.List;

/**
 * Includes another page.
 *
 * @param contentTitle included page title
 * @param spaceKey space of the included page
 */
public record IncludeMacro(String contentTitle, String spaceKey) implements MacroNode {

    @Override
    public String macroName() {
        return "include";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INCLUDE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
