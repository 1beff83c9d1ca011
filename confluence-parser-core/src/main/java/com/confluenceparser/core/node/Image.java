package com.confluenceparser.core.node;

import java.util.List;

/**
 * An embedded image from {@code ac:image} or {@code img}.
 *
 * <p>The source is either an attachment ({@code filename}) or a URL ({@code src}). Caption
 * content becomes the children.
 *
 * @param src URL of the image, null for attachments
 * @param filename attachment file name, null for URLs
 * @param alt alternative text
 * @param title title attribute
 * @param width display width in pixels
 * @param height display height in pixels
 * @param alignment alignment ({@code center}, {@code left}, ...)
 * @param layout layout hint ({@code wide}, {@code full-width}, ...)
 * @param children caption nodes
 */
public record Image(
    String src,
    String filename,
    String alt,
    String title,
    Integer width,
    Integer height,
    String alignment,
    String layout,
    List<Node> children
) implements Node {

    public Image {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMAGE;
    }
}
