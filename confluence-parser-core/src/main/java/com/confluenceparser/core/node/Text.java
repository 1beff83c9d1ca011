package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * A run of character data.
 *
 * @param text the text, never null
 */
public record Text(String text) implements Node {

    public Text {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
