package com.confluenceparser.core.node;

import java.util.Optional;

/**
 * Completion state of a task list item.
 */
public enum TaskStatus {
    COMPLETE("complete"),
    INCOMPLETE("incomplete");

    private final String value;

    TaskStatus(String value) {
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
    public static Optional<TaskStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (TaskStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
