package com.confluenceparser.core.node;

import java.util.List;
import java.util.Objects;

/**
 * Formatted inline content such as bold or monospace text.
 *
 * @param effect formatting applied
 * @param children formatted content
 */
public record TextEffectElement(TextEffect effect, List<Node> children) implements Node {

    public TextEffectElement {
        Objects.requireNonNull(effect, "effect must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT_EFFECT;
    }
}
