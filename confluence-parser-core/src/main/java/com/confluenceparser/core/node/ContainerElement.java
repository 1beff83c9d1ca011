package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * Neutral wrapper that keeps the content of elements without a dedicated variant.
 *
 * <p>Unknown tags and neutral wrappers such as {@code div} end up here, so their text is
 * never lost.
 *
 * @param tagName qualified tag name of the wrapped element
 * @param children wrapped content
 */
public record ContainerElement(String tagName, List<Node> children) implements Node {

    public ContainerElement {
        Objects.requireNonNull(tagName, "tagName must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONTAINER;
    }
}
