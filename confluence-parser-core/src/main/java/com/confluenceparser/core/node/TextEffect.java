package com.confluenceparser.core.node;

/**
 * Inline formatting applied by a {@link TextEffectElement}.
 */
public enum TextEffect {
    /** {@code <strong>}, {@code <b>} */
    STRONG,

    /** {@code <em>}, {@code <i>} */
    EMPHASIS,

    /** {@code <u>} */
    UNDERLINE,

    /** {@code <s>}, {@code <del>} */
    STRIKETHROUGH,

    /** {@code <code>}, {@code <pre>} */
    MONOSPACE,

    /** {@code <sub>} */
    SUBSCRIPT,

    /** {@code <sup>} */
    SUPERSCRIPT,

    /** {@code <blockquote>} */
    BLOCKQUOTE,

    /** {@code <span>} and inline comment markers */
    SPAN
}
