package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * A code block. The code is kept verbatim and never parsed as markup.
 *
 * @param language language for highlighting
 * @param title block title
 * @param lineNumbers whether line numbers are shown
 * @param theme highlighting theme
 * @param collapse whether the block starts collapsed
 * @param breakoutMode breakout mode, null if absent
 * @param breakoutWidth breakout width as written
 * @param code raw code
 */
public record CodeMacro(
    String language,
    String title,
    boolean lineNumbers,
    String theme,
    boolean collapse,
    BreakoutMode breakoutMode,
    String breakoutWidth,
    String code
) implements MacroNode {

    public CodeMacro {
        Objects.requireNonNull(code, "code must not be null");
    }

    public static CodeMacro of(String language, String code) {
        return new CodeMacro(language, null, false, null, false, null, null, code);
    }

    @Override
    public String macroName() {
        return "code";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CODE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
