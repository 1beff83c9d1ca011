package com.confluenceparser.core.node;

import java.util.Optional;

/**
 * State of a {@link DecisionListItem}.
 */
public enum DecisionState {
    DECIDED("DECIDED"),
    PENDING("PENDING");

    private final String value;

    DecisionState(String value) {
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
    public static Optional<DecisionState> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (DecisionState candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
