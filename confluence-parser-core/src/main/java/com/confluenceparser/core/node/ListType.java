package com.confluenceparser.core.node;

/**
 * Kinds of {@link ListElement}.
 */
public enum ListType {
    UNORDERED,
    ORDERED,
    TASK
}
