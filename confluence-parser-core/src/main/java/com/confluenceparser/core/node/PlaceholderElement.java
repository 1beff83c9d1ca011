package com.confluenceparser.core.node;

import java.util.List;

/**
 * Editor placeholder text from {@code ac:placeholder}.
 *
 * @param type placeholder type attribute
 * @param text instructional text
 */
public record PlaceholderElement(String type, String text) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.PLACEHOLDER;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
