package com.confluenceparser.core.node;

import java.util.Optional;

/**
 * Column arrangements of a {@link LayoutSection}.
 */
public enum LayoutSectionType {
    SINGLE("single"),
    FIXED_WIDTH("fixed-width"),
    TWO_EQUAL("two_equal"),
    TWO_LEFT_SIDEBAR("two_left_sidebar"),
    TWO_RIGHT_SIDEBAR("two_right_sidebar"),
    THREE_EQUAL("three_equal"),
    THREE_WITH_SIDEBARS("three_with_sidebars"),
    THREE_LEFT_SIDEBARS("three_left_sidebars"),
    THREE_RIGHT_SIDEBARS("three_right_sidebars"),
    FOUR_EQUAL("four_equal"),
    FIVE_EQUAL("five_equal");

    private final String value;

    LayoutSectionType(String value) {
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
    public static Optional<LayoutSectionType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (LayoutSectionType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
