package com.confluenceparser.core.node;

import java.util.List;

/**
 * A status lozenge.
 *
 * @param title lozenge text
 * @param colour lozenge colour ({@code Green}, {@code Red}, ...)
 * @param subtle whether the subtle style is used
 */
public record StatusMacro(String title, String colour, boolean subtle) implements MacroNode {

    @Override
    public String macroName() {
        return "status";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STATUS;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
