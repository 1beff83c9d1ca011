package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.diagnostics.Diagnostic;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Field conversions that report bad values as {@code invalid_value} diagnostics instead of
 * failing.
 */
public final class ValueParsers {

    private ValueParsers() {
        // Utility class - no instantiation
    }

    /**
     * Parses an integer field.
     *
     * @param value raw value, may be null
     * @param field field name used in the diagnostic
     * @param issues receives a diagnostic for malformed values
     * @return parsed value, or null if absent or malformed
     */
    public static Integer parseInteger(String value, String field, List<Diagnostic> issues) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            issues.add(Diagnostic.invalidValue(field, value));
            return null;
        }
    }

    /**
     * Parses a {@code true}/{@code false} field, ignoring case.
     *
     * @param value raw value, may be null
     * @param field field name used in the diagnostic
     * @param defaultValue value used when absent or malformed
     * @param issues receives a diagnostic for malformed values
     * @return parsed value
     */
    public static boolean parseBoolean(String value, String field, boolean defaultValue, List<Diagnostic> issues) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        issues.add(Diagnostic.invalidValue(field, value));
        return defaultValue;
    }

    /**
     * Resolves an enumerated field.
     *
     * @param value raw value, may be null
     * @param field field name used in the diagnostic
     * @param resolver maps a raw value to a constant
     * @param issues receives a diagnostic for unknown values
     * @param <E> field type
     * @return resolved constant, or null if absent or unknown
     */
    public static <E> E parseEnum(String value, String field, Function<String, Optional<E>> resolver,
                                  List<Diagnostic> issues) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Optional<E> resolved = resolver.apply(value);
        if (resolved.isEmpty()) {
            issues.add(Diagnostic.invalidValue(field, value));
        }
        return resolved.orElse(null);
    }

    /**
     * Returns an attribute value that must be present.
     *
     * @param value raw value, may be null
     * @param tagName element name used in the diagnostic
     * @param attributeName attribute name used in the diagnostic
     * @param issues receives a diagnostic when the value is missing
     * @return the value, or null if missing
     */
    public static String required(String value, String tagName, String attributeName, List<Diagnostic> issues) {
        if (value == null || value.isBlank()) {
            issues.add(Diagnostic.missingAttribute(tagName, attributeName));
            return null;
        }
        return value;
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
