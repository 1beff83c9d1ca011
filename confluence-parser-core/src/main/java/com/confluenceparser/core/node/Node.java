package com.confluenceparser.core.node;

import com.confluenceparser.core.render.TextRenderer;

import java.util.List;

/**
 * A node of the parsed content tree.
 *
 * <p>Every variant is an immutable record. The set of variants is closed, and {@link #kind()}
 * identifies the variant so that consumers can switch over it exhaustively.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Node root = document.root();
 *
 * for (Node node : root.walk()) {
 *     System.out.println(node.kind() + ": " + node.toText());
 * }
 *
 * List<CodeMacro> code = root.findAll(CodeMacro.class);
 * NodeBuckets buckets = root.findEach(HeadingElement.class, LinkElement.class);
 * }</pre>
 */
public sealed interface Node permits
    Text, Image, Emoticon, Time, PlaceholderElement,
    TextEffectElement, TextBreakElement, HeadingElement,
    ListElement, ListItem, DecisionList, DecisionListItem,
    Table, TableRow, TableCell,
    LayoutElement, LayoutSection, LayoutCell,
    LinkElement, ResourceIdentifier,
    ContainerElement, UnknownMacroElement, Fragment, MacroNode {

    /**
     * Returns the variant discriminant.
     *
     * @return node kind
     */
    NodeKind kind();

    /**
     * Returns the ordered child nodes.
     *
     * @return unmodifiable children, empty for leaves
     */
    List<Node> children();

    /**
     * Returns whether this node is block-level.
     *
     * @return true for paragraphs, headings, lists, tables, layouts and block macros
     */
    default boolean isBlockLevel() {
        return kind().isBlockLevel();
    }

    /**
     * Returns the canonical plain-text rendering of this subtree.
     *
     * @return extracted text
     */
    default String toText() {
        return TextRenderer.render(this);
    }

    /**
     * Returns a lazy pre-order depth-first traversal starting at this node.
     *
     * @return restartable traversal
     */
    default NodeWalk walk() {
        return new NodeWalk(this);
    }

    /**
     * Returns every node of the subtree in pre-order.
     *
     * @return all nodes including this one
     */
    default List<Node> findAll() {
        return walk().toList();
    }

    /**
     * Returns the nodes of the subtree that are instances of the given type, in pre-order.
     *
     * @param type variant or interface to match
     * @param <T> matched type
     * @return matching nodes
     */
    default <T extends Node> List<T> findAll(Class<T> type) {
        return walk().stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }

    /**
     * Collects the subtree into one bucket per requested type.
     *
     * <p>A node matching several requested types appears in each of their buckets.
     *
     * @param types types to collect, one bucket each
     * @return buckets in request order
     */
    default NodeBuckets findEach(Class<? extends Node>... types) {
        return NodeBuckets.collect(walk(), List.of(types));
    }
}
