package com.confluenceparser.core.diagnostics;

/**
 * Categories of recoverable problems recorded while building the content tree.
 *
 * <p>Each code owns the stable prefix of its diagnostic string.
 */
public enum DiagnosticCode {
    /** A tag with no dispatch rule. The element was kept as a container. */
    UNKNOWN_ELEMENT("unknown_element"),

    /** A structured macro whose name is not registered. Its rich-text body was kept. */
    UNKNOWN_MACRO("unknown_macro"),

    /** A required attribute or parameter was absent. The field was left empty. */
    MISSING_ATTRIBUTE("missing_attribute"),

    /** A value could not be converted to its field type. The field was left empty. */
    INVALID_VALUE("invalid_value");

    private final String prefix;

    DiagnosticCode(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Returns the prefix used in the formatted diagnostic string.
     *
     * @return prefix such as {@code unknown_element}
     */
    public String prefix() {
        return prefix;
    }
}
