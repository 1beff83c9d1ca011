package com.confluenceparser.core.markup;

import java.util.Objects;

/**
 * A run of character data between elements.
 *
 * @param text decoded text, never null
 * @param cdata whether the run came from a CDATA section
 */
public record MarkupText(String text, boolean cdata) implements MarkupNode {

    public MarkupText {
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Creates a plain (non-CDATA) text run.
     *
     * @param text decoded text
     * @return text run
     */
    public static MarkupText of(String text) {
        return new MarkupText(text, false);
    }

    /**
     * Returns whether this run holds nothing but whitespace.
     *
     * @return true if blank
     */
    public boolean isBlank() {
        return text.isBlank();
    }
}
