package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.diagnostics.Diagnostics;
import com.confluenceparser.core.markup.MarkupElement;
import com.confluenceparser.core.markup.MarkupNode;
import com.confluenceparser.core.markup.MarkupText;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * State of one parse call, passed to every {@link ElementRule}.
 *
 * <p>Holds the call's {@link Diagnostics} collector and the whitespace mode. Rules use it to
 * dispatch child elements and to turn mixed content into nodes.
 *
 * <p><b>Whitespace:</b> outside preformatted content, whitespace runs in text collapse to a
 * single space. Whitespace-only runs are dropped at the start and end of a parent and next to
 * block-level siblings. {@link #structure(MarkupElement)} drops all of them.
 */
public final class DispatchContext {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ElementDispatcher dispatcher;
    private final Diagnostics diagnostics;
    private final boolean preserveWhitespace;

    DispatchContext(ElementDispatcher dispatcher, Diagnostics diagnostics, boolean preserveWhitespace) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.preserveWhitespace = preserveWhitespace;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    /**
     * Returns a context that keeps text exactly as written, for {@code pre} content.
     *
     * @return whitespace-preserving context sharing this call's diagnostics
     */
    public DispatchContext preservingWhitespace() {
        return preserveWhitespace ? this : new DispatchContext(dispatcher, diagnostics, true);
    }

    /**
     * Dispatches one element.
     *
     * @param element element to build
     * @return nodes contributed by the element
     */
    public List<Node> dispatch(MarkupElement element) {
        return dispatcher.dispatch(element, this);
    }

    /**
     * Dispatches several elements in order.
     *
     * @param elements elements to build
     * @return contributed nodes, concatenated
     */
    public List<Node> dispatchAll(List<MarkupElement> elements) {
        List<Node> nodes = new ArrayList<>();
        for (MarkupElement element : elements) {
            nodes.addAll(dispatch(element));
        }
        return nodes;
    }

    /**
     * Builds the mixed content of an element: text runs and child elements.
     *
     * @param parent element whose children to build
     * @return child nodes
     */
    public List<Node> content(MarkupElement parent) {
        return content(parent.children());
    }

    /**
     * Builds mixed content.
     *
     * @param children markup nodes in source order
     * @return child nodes
     */
    public List<Node> content(List<MarkupNode> children) {
        List<Node> nodes = new ArrayList<>();
        List<Boolean> blank = new ArrayList<>();

        for (MarkupNode child : children) {
            if (child instanceof MarkupText text) {
                String value = text(text);
                if (!value.isEmpty()) {
                    nodes.add(new Text(value));
                    blank.add(!preserveWhitespace && value.isBlank());
                }
            } else if (child instanceof MarkupElement element) {
                for (Node node : dispatch(element)) {
                    nodes.add(node);
                    blank.add(false);
                }
            }
        }

        List<Node> kept = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            if (blank.get(i)) {
                boolean first = i == 0;
                boolean last = i == nodes.size() - 1;
                if (first || last || nodes.get(i - 1).isBlockLevel() || nodes.get(i + 1).isBlockLevel()) {
                    continue;
                }
            }
            kept.add(nodes.get(i));
        }
        return kept;
    }

    /**
     * Builds the content of a structural element such as a table, row or list, where
     * whitespace between children is layout and never content.
     *
     * @param parent structural element
     * @return child nodes without whitespace-only text
     */
    public List<Node> structure(MarkupElement parent) {
        List<Node> nodes = new ArrayList<>();
        for (MarkupNode child : parent.children()) {
            if (child instanceof MarkupText text) {
                if (!text.isBlank()) {
                    nodes.add(new Text(text(text)));
                }
            } else if (child instanceof MarkupElement element) {
                nodes.addAll(dispatch(element));
            }
        }
        return nodes;
    }

    /**
     * Builds the top-level forest. Whitespace-only text is dropped and other text is kept
     * as trimmed {@link Text} nodes.
     *
     * @param forest tokenizer output
     * @return top-level nodes
     */
    public List<Node> topLevel(List<MarkupNode> forest) {
        List<Node> nodes = new ArrayList<>();
        for (MarkupNode child : forest) {
            if (child instanceof MarkupText text) {
                if (!text.isBlank()) {
                    nodes.add(new Text(text(text).strip()));
                }
            } else if (child instanceof MarkupElement element) {
                nodes.addAll(dispatch(element));
            }
        }
        return nodes;
    }

    /**
     * Normalizes a text run for the current whitespace mode. CDATA is always kept as written.
     *
     * @param text text run
     * @return normalized text
     */
    public String text(MarkupText text) {
        if (preserveWhitespace || text.cdata()) {
            return text.text();
        }
        return WHITESPACE.matcher(text.text()).replaceAll(" ");
    }
}
