package com.confluenceparser.core.node;

/**
 * What a {@link LinkElement} points at.
 */
public enum LinkType {
    /** Absolute URL from an {@code <a href>} or {@code ri:url} */
    EXTERNAL,

    /** {@code mailto:} address */
    MAILTO,

    /** Confluence space */
    SPACE,

    /** Confluence page, also the default for a link without a resource */
    PAGE,

    /** Blog post */
    BLOG_POST,

    /** User mention */
    USER,

    /** Attachment of a page */
    ATTACHMENT,

    /** Anchor on the same page */
    ANCHOR
}
