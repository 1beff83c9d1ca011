package com.confluenceparser.core.node;

import java.util.List;

/**
 * A heading, {@code h1} through {@code h6}.
 *
 * @param level heading level between 1 and 6
 * @param children heading content
 */
public record HeadingElement(int level, List<Node> children) implements Node {

    public HeadingElement {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6: " + level);
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HEADING;
    }
}
