package com.confluenceparser.core.markup;

/**
 * One node of the neutral element forest produced by a {@link MarkupTokenizer}.
 *
 * <p>The forest is the only thing the dispatcher sees of the raw markup. It is either an
 * element with a qualified name, attributes and ordered children, or a run of character data.
 */
public sealed interface MarkupNode permits MarkupElement, MarkupText {
}
