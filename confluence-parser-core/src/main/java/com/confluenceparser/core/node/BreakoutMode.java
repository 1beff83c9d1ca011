package com.confluenceparser.core.node;

import java.util.Optional;

/**
 * Horizontal breakout of layout sections and code blocks.
 */
public enum BreakoutMode {
    DEFAULT("default"),
    WIDE("wide"),
    FULL_WIDTH("full-width");

    private final String value;

    BreakoutMode(String value) {
        this.value = value;
    }

    /**
     * Returns the value as written in markup.
     *
     * @return markup value
     */
    public String value() {
        return value;
    }

    /**
     * Resolves a markup value, ignoring case.
     *
     * @param value markup value, may be null
     * @return matching constant, or empty if unknown
     */
    public static Optional<BreakoutMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (BreakoutMode candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
