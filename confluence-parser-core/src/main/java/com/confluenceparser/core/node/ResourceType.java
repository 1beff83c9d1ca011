package com.confluenceparser.core.node;

import java.util.Optional;

/**
 * Kinds of {@code ri:} resource identifiers, keyed by their local tag name.
 */
public enum ResourceType {
    PAGE("page", LinkType.PAGE),
    BLOG_POST("blog-post", LinkType.BLOG_POST),
    ATTACHMENT("attachment", LinkType.ATTACHMENT),
    URL("url", LinkType.EXTERNAL),
    SHORTCUT("shortcut", LinkType.EXTERNAL),
    USER("user", LinkType.USER),
    SPACE("space", LinkType.SPACE),
    CONTENT_ENTITY("content-entity", LinkType.PAGE);

    private final String tagName;
    private final LinkType linkType;

    ResourceType(String tagName, LinkType linkType) {
        this.tagName = tagName;
        this.linkType = linkType;
    }

    /**
     * Returns the local tag name, e.g. {@code blog-post} for {@code ri:blog-post}.
     *
     * @return local tag name
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Returns the link type of an {@code ac:link} whose first resource has this type.
     *
     * @return link type
     */
    public LinkType linkType() {
        return linkType;
    }

    public static Optional<ResourceType> fromTagName(String localName) {
        for (ResourceType type : values()) {
            if (type.tagName.equals(localName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
