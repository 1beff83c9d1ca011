package com.confluenceparser.core.diagnostics;

import java.util.Objects;

/**
 * A single recoverable problem found while parsing.
 *
 * <p>Diagnostics are data: the tree is still built, with a degraded node or an empty field
 * at the place the problem occurred. The formatted string is {@code <prefix>:<detail>}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Diagnostic d = Diagnostic.missingAttribute("ri:attachment", "ri:filename");
 * d.format(); // "missing_attribute:ri:attachment[ri:filename]"
 * }</pre>
 *
 * @param code diagnostic category
 * @param detail category-specific detail (tag, macro name, {@code tag[attr]} or {@code field=value})
 */
public record Diagnostic(DiagnosticCode code, String detail) {

    public Diagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
    }

    public static Diagnostic unknownElement(String tagName) {
        return new Diagnostic(DiagnosticCode.UNKNOWN_ELEMENT, tagName);
    }

    public static Diagnostic unknownMacro(String macroName) {
        return new Diagnostic(DiagnosticCode.UNKNOWN_MACRO, macroName);
    }

    public static Diagnostic missingAttribute(String tagName, String attributeName) {
        return new Diagnostic(DiagnosticCode.MISSING_ATTRIBUTE, tagName + "[" + attributeName + "]");
    }

    public static Diagnostic invalidValue(String field, String value) {
        return new Diagnostic(DiagnosticCode.INVALID_VALUE, field + "=" + value);
    }

    /**
     * Returns the stable string form, e.g. {@code unknown_macro:gallery}.
     *
     * @return formatted diagnostic
     */
    public String format() {
        return code.prefix() + ":" + detail;
    }

    @Override
    public String toString() {
        return format();
    }
}
