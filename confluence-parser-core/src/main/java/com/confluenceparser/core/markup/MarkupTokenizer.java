package com.confluenceparser.core.markup;

import com.confluenceparser.core.error.MarkupTokenizationException;

import java.util.List;

/**
 * Turns raw storage-format markup into a forest of {@link MarkupNode}s.
 *
 * <p>Implementations are expected to be forgiving: unclosed tags, undeclared namespace
 * prefixes and stray end tags should still yield a forest. Only input that cannot be read at
 * all ends in an exception.
 *
 * @see JsoupMarkupTokenizer
 */
@FunctionalInterface
public interface MarkupTokenizer {

    /**
     * Tokenizes markup into its top-level nodes.
     *
     * @param markup raw markup, never null
     * @return top-level nodes in source order
     * @throws MarkupTokenizationException if the input cannot be tokenized
     */
    List<MarkupNode> tokenize(String markup);
}
