package com.confluenceparser.core.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of {@link Node#findEach}: one ordered bucket per requested type.
 *
 * @param types requested types in request order
 * @param buckets matching nodes per type, in document order
 */
public record NodeBuckets(List<Class<? extends Node>> types, List<List<Node>> buckets) {

    public NodeBuckets {
        Objects.requireNonNull(types, "types must not be null");
        Objects.requireNonNull(buckets, "buckets must not be null");
        if (types.size() != buckets.size()) {
            throw new IllegalArgumentException("One bucket per type is required");
        }
        types = List.copyOf(types);
        buckets = buckets.stream().map(List::copyOf).toList();
    }

    /**
     * Sorts the nodes of a traversal into buckets.
     *
     * @param nodes nodes in document order
     * @param types requested types
     * @return filled buckets
     */
    public static NodeBuckets collect(Iterable<Node> nodes, List<Class<? extends Node>> types) {
        List<List<Node>> buckets = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            buckets.add(new ArrayList<>());
        }
        for (Node node : nodes) {
            for (int i = 0; i < types.size(); i++) {
                if (types.get(i).isInstance(node)) {
                    buckets.get(i).add(node);
                }
            }
        }
        return new NodeBuckets(types, buckets);
    }

    public int size() {
        return buckets.size();
    }

    public List<Node> bucket(int index) {
        return buckets.get(index);
    }

    /**
     * Returns the bucket of a requested type, typed.
     *
     * @param type a type passed to {@code findEach}
     * @param <T> node type
     * @return matching nodes
     * @throws IllegalArgumentException if the type was not requested
     */
    public <T extends Node> List<T> bucket(Class<T> type) {
        int index = types.indexOf(type);
        if (index < 0) {
            throw new IllegalArgumentException("Type was not requested: " + type.getSimpleName());
        }
        return buckets.get(index).stream().map(type::cast).toList();
    }

    /**
     * Concatenates all buckets in request order.
     *
     * @return flattened nodes
     */
    public List<Node> flatten() {
        List<Node> all = new ArrayList<>();
        buckets.forEach(all::addAll);
        return List.copyOf(all);
    }
}
