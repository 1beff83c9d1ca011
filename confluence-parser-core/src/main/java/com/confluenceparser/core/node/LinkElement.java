package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * A hyperlink from {@code a} or {@code ac:link}.
 *
 * <p>For {@code ac:link} the target is described by a {@link ResourceIdentifier} child; the
 * link body follows it.
 *
 * @param linkType target kind
 * @param href URL for {@code a} links, null otherwise
 * @param anchor anchor name, if any
 * @param cardAppearance smart-link appearance ({@code inline}, {@code block}, ...)
 * @param children resource identifiers and link body
 */
public record LinkElement(
    LinkType linkType,
    String href,
    String anchor,
    String cardAppearance,
    List<Node> children
) implements Node {

    public LinkElement {
        Objects.requireNonNull(linkType, "linkType must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Returns the first resource identifier child.
     *
     * @return target resource, or null for plain links
     */
    public ResourceIdentifier resource() {
        for (Node child : children) {
            if (child instanceof ResourceIdentifier resource) {
                return resource;
            }
        }
        return null;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LINK;
    }
}
