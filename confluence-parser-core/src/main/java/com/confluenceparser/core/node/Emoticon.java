package com.confluenceparser.core.node;

import java.util.List;

/**
 * An emoticon from {@code ac:emoticon}.
 *
 * @param name legacy emoticon name such as {@code smile}
 * @param emojiShortname shortname such as {@code :smile:}
 * @param emojiId emoji code point id
 * @param emojiFallback fallback text, usually the emoji itself
 */
public record Emoticon(String name, String emojiShortname, String emojiId, String emojiFallback) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.EMOTICON;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
