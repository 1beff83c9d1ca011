package com.confluenceparser.core.node;

import java.util.List;

/**
 * A date from a {@code time} element.
 *
 * @param datetime the {@code datetime} attribute as written, e.g. {@code 2024-01-15}
 */
public record Time(String datetime) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.TIME;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
