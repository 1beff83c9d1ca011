package com.confluenceparser.core.node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pre-order depth-first traversal of a subtree.
 *
 * <p>Traversal is lazy and iterative, so deeply nested trees do not grow the call stack. Each
 * call to {@link #iterator()} or {@link #stream()} starts again from the root.
 */
public final class NodeWalk implements Iterable<Node> {

    private final Node root;

    NodeWalk(Node root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Returns a traversal over nothing.
     *
     * @return empty iterable
     */
    public static Iterable<Node> empty() {
        return List.of();
    }

    @Override
    public Iterator<Node> iterator() {
        return new PreOrderIterator(root);
    }

    public Stream<Node> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<Node> toList() {
        return stream().toList();
    }

    private static final class PreOrderIterator implements Iterator<Node> {

        private final Deque<Node> pending = new ArrayDeque<>();

        PreOrderIterator(Node root) {
            pending.push(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Node next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            Node current = pending.pop();
            List<Node> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
            return current;
        }
    }
}
