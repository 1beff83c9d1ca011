package com.confluenceparser.core.node;

import java.util.List;

/**
 * Embedded PDF viewer.
 *
 * @param filename attached PDF
 * @param versionAtSave attachment version
 */
public record ViewPdfMacro(String filename, Integer versionAtSave) implements MacroNode {

    @Override
    public String macroName() {
        return "viewpdf";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VIEW_PDF;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
