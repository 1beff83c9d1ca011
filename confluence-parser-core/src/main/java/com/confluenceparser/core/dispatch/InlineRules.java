package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.node.Emoticon;
import com.confluenceparser.core.node.PlaceholderElement;
import com.confluenceparser.core.node.TextBreakElement;
import com.confluenceparser.core.node.TextEffect;
import com.confluenceparser.core.node.TextEffectElement;
import com.confluenceparser.core.node.Time;

import java.util.Map;

/**
 * Rules for inline formatting, breaks and small inline leaves.
 */
final class InlineRules {

    private InlineRules() {
        // Utility class - no instantiation
    }

    static void register(Map<TagKey, ElementRule> rules) {
        effect(rules, TextEffect.STRONG, "strong", "b");
        effect(rules, TextEffect.EMPHASIS, "em", "i");
        effect(rules, TextEffect.UNDERLINE, "u");
        effect(rules, TextEffect.STRIKETHROUGH, "s", "del", "strike");
        effect(rules, TextEffect.MONOSPACE, "code");
        effect(rules, TextEffect.SUBSCRIPT, "sub");
        effect(rules, TextEffect.SUPERSCRIPT, "sup");
        effect(rules, TextEffect.BLOCKQUOTE, "blockquote");
        effect(rules, TextEffect.SPAN, "span", "ac:inline-comment-marker");
        rules.put(TagKey.of("pre"), (e, ctx) -> Built.of(
            new TextEffectElement(TextEffect.MONOSPACE, ctx.preservingWhitespace().content(e))));

        rules.put(TagKey.of("br"), (e, ctx) -> Built.of(TextBreakElement.lineBreak()));
        rules.put(TagKey.of("hr"), (e, ctx) -> Built.of(TextBreakElement.horizontalRule()));

        rules.put(TagKey.of("ac:emoticon"), (e, ctx) -> Built.of(new Emoticon(
            e.attr("ac:name"),
            e.attr("ac:emoji-shortname"),
            e.attr("ac:emoji-id"),
            e.attr("ac:emoji-fallback")
        )));
        ElementRule time = (e, ctx) -> Built.of(new Time(e.firstAttr("datetime", "ac:datetime")));
        rules.put(TagKey.of("time"), time);
        rules.put(TagKey.of("ac:time"), time);
        rules.put(TagKey.of("ac:placeholder"), (e, ctx) -> Built.of(
            new PlaceholderElement(e.attr("ac:type"), ValueParsers.trimToNull(e.textContent()))));
    }

    private static void effect(Map<TagKey, ElementRule> rules, TextEffect effect, String... tagNames) {
        ElementRule rule = (e, ctx) -> Built.of(new TextEffectElement(effect, ctx.content(e)));
        for (String tagName : tagNames) {
            rules.put(TagKey.of(tagName), rule);
        }
    }
}
