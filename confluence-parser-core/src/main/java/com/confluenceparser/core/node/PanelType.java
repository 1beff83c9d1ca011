package com.confluenceparser.core.node;

/**
 * Flavours of {@link PanelMacro}, each with its text label.
 */
public enum PanelType {
    PANEL("📋 PANEL"),
    NOTE("📝 NOTE"),
    SUCCESS("✅ SUCCESS"),
    WARNING("⚠️ WARNING"),
    ERROR("❌ ERROR"),
    INFO("ℹ️ INFO");

    private final String label;

    PanelType(String label) {
        this.label = label;
    }

    /**
     * Returns the label that prefixes the panel body in extracted text.
     *
     * @return icon and name
     */
    public String label() {
        return label;
    }
}
