package com.confluenceparser.core.node;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A panel and its flavours ({@code info}, {@code note}, {@code tip}, {@code warning}, ...).
 *
 * @param macroName macro name as written, e.g. {@code tip}
 * @param panelType panel flavour
 * @param title panel title
 * @param bgColor background colour
 * @param borderStyle border style
 * @param borderColor border colour
 * @param titleBgColor title background colour
 * @param titleColor title colour
 * @param panelIcon custom icon shortname
 * @param panelIconId custom icon id
 * @param panelIconText custom icon text, used as the label when present
 * @param children panel body
 */
public record PanelMacro(
    String macroName,
    PanelType panelType,
    String title,
    String bgColor,
    String borderStyle,
    String borderColor,
    String titleBgColor,
    String titleColor,
    String panelIcon,
    String panelIconId,
    String panelIconText,
    List<Node> children
) implements MacroNode {

    public PanelMacro {
        Objects.requireNonNull(macroName, "macroName must not be null");
        Objects.requireNonNull(panelType, "panelType must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates an unstyled panel.
     *
     * @param panelType panel flavour
     * @param children panel body
     * @return panel named after its type
     */
    public static PanelMacro of(PanelType panelType, List<Node> children) {
        return new PanelMacro(panelType.name().toLowerCase(Locale.ROOT), panelType,
            null, null, null, null, null, null, null, null, null, children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PANEL;
    }
}
