package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * A bulleted, numbered or task list.
 *
 * @param listType list flavour
 * @param start first number of an ordered list, at least 1, null for the default of 1
 * @param children list items, plus any stray content
 */
public record ListElement(ListType listType, Integer start, List<Node> children) implements Node {

    public ListElement {
        Objects.requireNonNull(listType, "listType must not be null");
        if (start != null && start < 1) {
            throw new IllegalArgumentException("List start must be at least 1: " + start);
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }
}
