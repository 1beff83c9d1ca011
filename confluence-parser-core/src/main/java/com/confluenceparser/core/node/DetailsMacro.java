package com.confluenceparser.core.node;

import java.util.List;

/**
 * Page properties block. Only the body appears in extracted text.
 *
 * @param title block title, may be null
 * @param id properties id used by report macros
 * @param hidden whether the block is hidden on the page
 * @param children body, usually a table
 */
public record DetailsMacro(String title, String id, boolean hidden, List<Node> children) implements MacroNode {

    public DetailsMacro {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public String macroName() {
        return "details";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DETAILS;
    }
}
