package com.confluenceparser.core.parser;

import com.confluenceparser.core.config.ParserSettings;
import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.diagnostics.Diagnostics;
import com.confluenceparser.core.dispatch.ElementDispatcher;
import com.confluenceparser.core.document.ConfluenceDocument;
import com.confluenceparser.core.error.DiagnosticsException;
import com.confluenceparser.core.error.MarkupTokenizationException;
import com.confluenceparser.core.markup.JsoupMarkupTokenizer;
import com.confluenceparser.core.markup.MarkupNode;
import com.confluenceparser.core.markup.MarkupTokenizer;
import com.confluenceparser.core.node.Fragment;
import com.confluenceparser.core.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Parses Confluence storage-format markup into a {@link ConfluenceDocument}.
 *
 * <p>A parse call tokenizes the markup, builds the tree bottom-up and collects diagnostics for
 * anything it could only partially understand. With strict settings (the default) any
 * diagnostic ends the call with a {@link DiagnosticsException}; lenient parsers return the
 * document with its diagnostics attached.
 *
 * <p>Parsers hold no per-call state and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConfluenceParser parser = ConfluenceParser.lenient();
 * ConfluenceDocument document = parser.parse("<p>Hello <strong>World</strong></p>");
 * document.text(); // "Hello World"
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ConfluenceParser {

    private static final Logger log = LoggerFactory.getLogger(ConfluenceParser.class);

    private final ParserSettings settings;
    private final MarkupTokenizer tokenizer;
    private final ElementDispatcher dispatcher;

    public ConfluenceParser() {
        this(ParserSettings.defaults());
    }

    public ConfluenceParser(ParserSettings settings) {
        this(settings, new JsoupMarkupTokenizer());
    }

    public ConfluenceParser(ParserSettings settings, MarkupTokenizer tokenizer) {
        this(settings, tokenizer, ElementDispatcher.standard());
    }

    public ConfluenceParser(ParserSettings settings, MarkupTokenizer tokenizer, ElementDispatcher dispatcher) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * Creates a parser that fails on any diagnostic.
     *
     * @return strict parser
     */
    public static ConfluenceParser strict() {
        return new ConfluenceParser(ParserSettings.defaults());
    }

    /**
     * Creates a parser that returns documents with diagnostics attached.
     *
     * @return lenient parser
     */
    public static ConfluenceParser lenient() {
        return new ConfluenceParser(ParserSettings.lenient());
    }

    public ParserSettings settings() {
        return settings;
    }

    /**
     * Parses markup.
     *
     * @param markup storage-format markup
     * @return parsed document
     * @throws MarkupTokenizationException if the markup is null or cannot be tokenized
     * @throws DiagnosticsException if the parser is strict and diagnostics were recorded
     */
    public ConfluenceDocument parse(String markup) {
        if (markup == null) {
            throw new MarkupTokenizationException("Markup must not be null");
        }

        List<MarkupNode> forest = tokenize(markup);

        Diagnostics diagnostics = new Diagnostics();
        List<Node> nodes = dispatcher.newContext(diagnostics).topLevel(forest);
        Node root = switch (nodes.size()) {
            case 0 -> null;
            case 1 -> nodes.get(0);
            default -> new Fragment(nodes);
        };

        List<Diagnostic> recorded = diagnostics.snapshot();
        log.debug("Parsed {} characters into {} top-level nodes with {} diagnostics",
            markup.length(), nodes.size(), recorded.size());

        if (!recorded.isEmpty()) {
            if (settings.isStrict()) {
                throw new DiagnosticsException(recorded);
            }
            log.warn("Parsed document with {} diagnostics: {}", recorded.size(), Diagnostics.format(recorded));
        }
        return new ConfluenceDocument(root, recorded);
    }

    private List<MarkupNode> tokenize(String markup) {
        try {
            return tokenizer.tokenize(markup);
        } catch (MarkupTokenizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MarkupTokenizationException("Failed to tokenize markup: " + e.getMessage(), e);
        }
    }
}
