package com.confluenceparser.core.node;

import java.util.List;

/**
 * Includes the excerpt of another page or blog post.
 *
 * @param contentTitle source title
 * @param spaceKey source space
 * @param postingDay posting day when the source is a blog post
 * @param noPanel whether the excerpt is shown without a panel
 */
public record ExcerptIncludeMacro(
    String contentTitle,
    String spaceKey,
    String postingDay,
    boolean noPanel
) implements MacroNode {

    @Override
    public String macroName() {
        return "excerpt-include";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCERPT_INCLUDE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
