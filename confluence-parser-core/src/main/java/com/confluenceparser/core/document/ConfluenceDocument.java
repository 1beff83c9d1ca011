package com.confluenceparser.core.document;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.diagnostics.Diagnostics;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.NodeBuckets;
import com.confluenceparser.core.node.NodeWalk;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of parsing one piece of markup: the content tree and the diagnostics recorded while
 * building it.
 *
 * <p>The root is absent for markup without content, a single node for markup with one
 * top-level element, and a {@link com.confluenceparser.core.node.Fragment} otherwise. Whole
 * document queries behave like the same queries on the root, or return empty results.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConfluenceDocument document = ConfluenceParser.lenient().parse(markup);
 *
 * String text = document.text();
 * List<String> problems = document.diagnosticMessages();
 * List<LinkElement> links = document.findAll(LinkElement.class);
 * }</pre>
 *
 * @param root root node, null when there is no content
 * @param diagnostics diagnostics in recording order
 */
public record ConfluenceDocument(Node root, List<Diagnostic> diagnostics) {

    /** Metadata key of the diagnostic strings. */
    public static final String DIAGNOSTICS_KEY = "diagnostics";

    public ConfluenceDocument {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Creates a document without content or diagnostics.
     *
     * @return empty document
     */
    public static ConfluenceDocument empty() {
        return new ConfluenceDocument(null, List.of());
    }

    public Optional<Node> rootNode() {
        return Optional.ofNullable(root);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns the diagnostics as strings such as {@code unknown_macro:gallery}.
     *
     * @return formatted diagnostics in recording order
     */
    public List<String> diagnosticMessages() {
        return Diagnostics.format(diagnostics);
    }

    /**
     * Returns document metadata. The {@value #DIAGNOSTICS_KEY} entry holds the formatted
     * diagnostics.
     *
     * @return unmodifiable metadata
     */
    public Map<String, Object> metadata() {
        return Map.of(DIAGNOSTICS_KEY, diagnosticMessages());
    }

    /**
     * Returns the plain text of the whole document.
     *
     * @return root text, or an empty string without a root
     */
    public String text() {
        return root == null ? "" : root.toText();
    }

    public Iterable<Node> walk() {
        return root == null ? NodeWalk.empty() : root.walk();
    }

    public List<Node> findAll() {
        return root == null ? List.of() : root.findAll();
    }

    public <T extends Node> List<T> findAll(Class<T> type) {
        return root == null ? List.of() : root.findAll(type);
    }

    @SafeVarargs
    public final NodeBuckets findEach(Class<? extends Node>... types) {
        return NodeBuckets.collect(walk(), List.of(types));
    }
}
