package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.markup.MarkupElement;
import com.confluenceparser.core.markup.MarkupNode;
import com.confluenceparser.core.markup.MarkupText;
import com.confluenceparser.core.node.Image;
import com.confluenceparser.core.node.LinkElement;
import com.confluenceparser.core.node.LinkType;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.ResourceIdentifier;
import com.confluenceparser.core.node.ResourceType;
import com.confluenceparser.core.node.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rules for links, images and {@code ri:} resource identifiers.
 */
final class ReferenceRules {

    private ReferenceRules() {
        // Utility class - no instantiation
    }

    static void register(Map<TagKey, ElementRule> rules) {
        rules.put(TagKey.of("a"), ReferenceRules::anchorLink);
        rules.put(TagKey.of("ac:link"), ReferenceRules::confluenceLink);
        rules.put(TagKey.of("img"), ReferenceRules::htmlImage);
        rules.put(TagKey.of("ac:image"), ReferenceRules::confluenceImage);

        for (ResourceType type : ResourceType.values()) {
            rules.put(new TagKey("ri", type.tagName()), (e, ctx) -> resource(e, type));
        }
    }

    // ==================== Links ====================

    private static Built anchorLink(MarkupElement element, DispatchContext ctx) {
        List<Node> children = ctx.content(element);
        String href = element.attr("href");

        LinkType type = LinkType.EXTERNAL;
        String anchor = null;
        if (href != null && href.regionMatches(true, 0, "mailto:", 0, 7)) {
            type = LinkType.MAILTO;
        } else if (href != null && href.startsWith("#")) {
            type = LinkType.ANCHOR;
            anchor = href.substring(1);
        }
        return Built.of(new LinkElement(type, href, anchor, element.attr("data-card-appearance"), children));
    }

    private static Built confluenceLink(MarkupElement element, DispatchContext ctx) {
        List<Node> children = new ArrayList<>();
        ResourceIdentifier target = null;

        for (MarkupNode child : element.children()) {
            if (child instanceof MarkupText text) {
                if (!text.isBlank()) {
                    children.add(new Text(ctx.text(text)));
                }
                continue;
            }
            MarkupElement part = (MarkupElement) child;
            switch (part.name()) {
                case "ac:plain-text-link-body" -> {
                    String body = part.textContent();
                    if (!body.isEmpty()) {
                        children.add(new Text(body));
                    }
                }
                case "ac:link-body" -> children.addAll(ctx.content(part));
                default -> {
                    for (Node node : ctx.dispatch(part)) {
                        if (target == null && node instanceof ResourceIdentifier resource) {
                            target = resource;
                        }
                        children.add(node);
                    }
                }
            }
        }

        String anchor = element.attr("ac:anchor");
        LinkType type;
        if (target != null) {
            type = target.type().linkType();
        } else if (anchor != null) {
            type = LinkType.ANCHOR;
        } else {
            type = LinkType.PAGE;
        }
        String href = target != null && target.type() == ResourceType.URL ? target.value() : null;
        return Built.of(new LinkElement(type, href, anchor, element.attr("ac:card-appearance"), children));
    }

    // ==================== Images ====================

    private static Built htmlImage(MarkupElement element, DispatchContext ctx) {
        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new Image(
            element.attr("src"),
            null,
            element.attr("alt"),
            element.attr("title"),
            ValueParsers.parseInteger(element.attr("width"), "width", issues),
            ValueParsers.parseInteger(element.attr("height"), "height", issues),
            element.attr("align"),
            null,
            List.of()
        ), issues);
    }

    private static Built confluenceImage(MarkupElement element, DispatchContext ctx) {
        String filename = null;
        String src = null;
        for (MarkupElement source : element.childElements()) {
            if (!"ri".equals(source.namespace())) {
                continue;
            }
            for (Node node : ctx.dispatch(source)) {
                if (node instanceof ResourceIdentifier resource) {
                    if (resource.type() == ResourceType.ATTACHMENT) {
                        filename = resource.filename();
                    } else if (resource.type() == ResourceType.URL) {
                        src = resource.value();
                    }
                }
            }
        }
        List<Node> caption = element.firstChild("ac:caption").map(ctx::content).orElse(List.of());

        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new Image(
            src,
            filename,
            element.attr("ac:alt"),
            element.attr("ac:title"),
            ValueParsers.parseInteger(element.attr("ac:width"), "ac:width", issues),
            ValueParsers.parseInteger(element.attr("ac:height"), "ac:height", issues),
            element.attr("ac:align"),
            element.attr("ac:layout"),
            caption
        ), issues);
    }

    // ==================== Resource identifiers ====================

    private static Built resource(MarkupElement e, ResourceType type) {
        List<Diagnostic> issues = new ArrayList<>();
        String tag = e.name();
        Integer version = ValueParsers.parseInteger(e.attr("ri:version-at-save"), "ri:version-at-save", issues);

        ResourceIdentifier resource = switch (type) {
            case PAGE -> ResourceIdentifier.page(
                e.attr("ri:space-key"),
                ValueParsers.required(e.attr("ri:content-title"), tag, "ri:content-title", issues),
                version);
            case BLOG_POST -> ResourceIdentifier.blogPost(
                e.attr("ri:space-key"),
                ValueParsers.required(e.attr("ri:content-title"), tag, "ri:content-title", issues),
                e.attr("ri:posting-day"));
            case ATTACHMENT -> ResourceIdentifier.attachment(
                ValueParsers.required(e.attr("ri:filename"), tag, "ri:filename", issues),
                version,
                e.attr("ri:content-id"));
            case URL -> ResourceIdentifier.url(
                ValueParsers.required(e.attr("ri:value"), tag, "ri:value", issues));
            case USER -> ResourceIdentifier.user(
                e.attr("ri:account-id"), e.attr("ri:userkey"), e.attr("ri:local-id"));
            case SPACE -> ResourceIdentifier.space(
                ValueParsers.required(e.attr("ri:space-key"), tag, "ri:space-key", issues));
            case SHORTCUT -> ResourceIdentifier.shortcut(
                ValueParsers.required(e.attr("ri:key"), tag, "ri:key", issues),
                ValueParsers.required(e.attr("ri:parameter"), tag, "ri:parameter", issues));
            case CONTENT_ENTITY -> ResourceIdentifier.contentEntity(
                ValueParsers.required(e.attr("ri:content-id"), tag, "ri:content-id", issues));
        };
        return Built.of(resource, issues);
    }
}
