package com.confluenceparser.core.node;

/**
 * A node built from an {@code ac:structured-macro} with a registered name.
 *
 * <p>Unregistered macros never produce a {@code MacroNode}; they degrade to an
 * {@link UnknownMacroElement} holding their body.
 */
public sealed interface MacroNode extends Node permits
    PanelMacro, CodeMacro, StatusMacro, ExpandMacro, DetailsMacro, TocMacro,
    JiraMacro, IncludeMacro, ExcerptIncludeMacro, TasksReportMacro, AttachmentsMacro,
    ViewPdfMacro, ViewFileMacro, ProfileMacro, AnchorMacro, ExcerptMacro {

    /**
     * Returns the macro name as written in {@code ac:name}.
     *
     * @return macro name
     */
    String macroName();
}
