package com.confluenceparser.core.node;

import java.util.List;

/**
 * User profile card.
 *
 * @param accountId profiled user
 */
public record ProfileMacro(String accountId) implements MacroNode {

    @Override
    public String macroName() {
        return "profile";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROFILE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
