package com.confluenceparser.core.node;

import java.util.List;

/**
 * Embedded file viewer for office documents.
 *
 * @param filename attached file
 * @param versionAtSave attachment version
 * @param height viewer height as written
 */
public record ViewFileMacro(String filename, Integer versionAtSave, String height) implements MacroNode {

    @Override
    public String macroName() {
        return "view-file";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VIEW_FILE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
