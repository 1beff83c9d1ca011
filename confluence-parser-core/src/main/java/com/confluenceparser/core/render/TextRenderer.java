package com.confluenceparser.core.render;

import com.confluenceparser.core.node.AnchorMacro;
import com.confluenceparser.core.node.AttachmentsMacro;
import com.confluenceparser.core.node.CodeMacro;
import com.confluenceparser.core.node.DecisionListItem;
import com.confluenceparser.core.node.DecisionState;
import com.confluenceparser.core.node.Emoticon;
import com.confluenceparser.core.node.ExcerptIncludeMacro;
import com.confluenceparser.core.node.Image;
import com.confluenceparser.core.node.IncludeMacro;
import com.confluenceparser.core.node.JiraMacro;
import com.confluenceparser.core.node.LinkElement;
import com.confluenceparser.core.node.ListElement;
import com.confluenceparser.core.node.ListItem;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.PanelMacro;
import com.confluenceparser.core.node.PlaceholderElement;
import com.confluenceparser.core.node.ProfileMacro;
import com.confluenceparser.core.node.ResourceIdentifier;
import com.confluenceparser.core.node.StatusMacro;
import com.confluenceparser.core.node.TableCell;
import com.confluenceparser.core.node.TaskStatus;
import com.confluenceparser.core.node.TasksReportMacro;
import com.confluenceparser.core.node.Text;
import com.confluenceparser.core.node.Time;
import com.confluenceparser.core.node.ViewFileMacro;
import com.confluenceparser.core.node.ViewPdfMacro;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonical plain-text rendering of a content tree.
 *
 * <p>One exhaustive switch over {@link com.confluenceparser.core.node.NodeKind} decides how each
 * variant renders. Containers join their children with these rules:
 * <ul>
 *   <li>inline pieces are appended as they are</li>
 *   <li>a block-level child is separated from its neighbours by a blank line, with surrounding
 *       whitespace trimmed</li>
 *   <li>block-level containers strip their own result</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String text = TextRenderer.render(document.root());
 * // same as document.root().toText()
 * }</pre>
 */
public final class TextRenderer {

    private static final String BLOCK_SEPARATOR = "\n\n";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n[ \\t]*(\\n[ \\t]*)+");

    private TextRenderer() {
        // Utility class - no instantiation
    }

    /**
     * Renders a node and its subtree.
     *
     * @param node node to render
     * @return extracted text, never null
     */
    public static String render(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        return switch (node.kind()) {
            case TEXT -> ((Text) node).text();
            case IMAGE -> image((Image) node);
            case EMOTICON -> emoticon((Emoticon) node);
            case TIME -> time((Time) node);
            case PLACEHOLDER -> placeholder((PlaceholderElement) node);
            case TEXT_EFFECT, TABLE_CELL, CONTAINER, UNKNOWN_MACRO -> join(node.children());
            case PARAGRAPH, HEADING, LIST_ITEM, LAYOUT, LAYOUT_SECTION, LAYOUT_CELL, FRAGMENT,
                 EXPAND, DETAILS -> join(node.children()).strip();
            case LINE_BREAK -> "\n";
            case HORIZONTAL_RULE -> "";
            case LIST -> list((ListElement) node);
            case DECISION_LIST -> decisionList(node.children());
            case DECISION_LIST_ITEM -> decisionItem((DecisionListItem) node);
            case TABLE -> table(node.children());
            case TABLE_ROW -> tableRow(node.children());
            case LINK -> link((LinkElement) node);
            case RESOURCE_IDENTIFIER -> resource((ResourceIdentifier) node);
            case PANEL -> panel((PanelMacro) node);
            case CODE -> ((CodeMacro) node).code();
            case STATUS -> status((StatusMacro) node);
            case TOC -> "📑 Table of Contents";
            case JIRA -> jira((JiraMacro) node);
            case INCLUDE -> include((IncludeMacro) node);
            case EXCERPT_INCLUDE -> excerptInclude((ExcerptIncludeMacro) node);
            case TASKS_REPORT -> labelled("📊 Tasks Report", ((TasksReportMacro) node).spaces());
            case ATTACHMENTS -> labelled("📎 Attachments", ((AttachmentsMacro) node).patterns());
            case VIEW_PDF -> orElse(((ViewPdfMacro) node).filename(), "📄 PDF: ", "📄 PDF Viewer");
            case VIEW_FILE -> orElse(((ViewFileMacro) node).filename(), "📁 File: ", "📁 File Viewer");
            case PROFILE -> orElse(((ProfileMacro) node).accountId(), "👤 Profile: ", "👤 User Profile");
            case ANCHOR -> labelled("⚓ Anchor", ((AnchorMacro) node).anchorName());
            case EXCERPT -> orElse(flatten(join(node.children())), "📄 Excerpt: ", "📄 Excerpt");
        };
    }

    /**
     * Joins rendered children, separating block-level pieces by a blank line.
     *
     * @param children nodes to render in order
     * @return joined text, not stripped
     */
    public static String join(List<Node> children) {
        StringBuilder out = new StringBuilder();
        boolean previousBlock = false;

        for (Node child : children) {
            String piece = render(child);
            boolean block = child.isBlockLevel();

            if (block || previousBlock) {
                if (piece.isBlank()) {
                    previousBlock = previousBlock || block;
                    continue;
                }
                if (out.length() > 0) {
                    trimTrailing(out);
                    if (out.length() > 0) {
                        out.append(BLOCK_SEPARATOR);
                    }
                    piece = piece.stripLeading();
                }
            } else if (piece.isEmpty()) {
                continue;
            }

            out.append(piece);
            previousBlock = block;
        }
        return out.toString();
    }

    /**
     * Collapses all whitespace, including newlines, to single spaces and strips the result.
     *
     * @param text text to flatten
     * @return single-line text
     */
    public static String flatten(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    // ==================== Lists ====================

    private static String list(ListElement list) {
        List<String> lines = new ArrayList<>();
        long number = list.start() == null ? 1 : list.start();

        for (Node child : list.children()) {
            if (child instanceof ListItem item) {
                String marker = switch (list.listType()) {
                    case UNORDERED -> "• ";
                    case ORDERED -> number++ + ". ";
                    case TASK -> item.status() == TaskStatus.COMPLETE ? "✓ " : "○ ";
                };
                lines.add((marker + indentContinuation(render(item))).stripTrailing());
            } else {
                String text = render(child).strip();
                if (!text.isEmpty()) {
                    lines.add(text);
                }
            }
        }
        return String.join("\n", lines);
    }

    private static String indentContinuation(String itemText) {
        return BLANK_LINES.matcher(itemText).replaceAll("\n").replace("\n", "\n  ");
    }

    private static String decisionList(List<Node> children) {
        List<String> lines = new ArrayList<>();
        for (Node child : children) {
            String text = render(child).strip();
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        return lines.isEmpty() ? "📋 Decision List" : String.join("\n", lines);
    }

    private static String decisionItem(DecisionListItem item) {
        String icon = item.state() == DecisionState.DECIDED ? "✅" : "⏳";
        String text = join(item.children()).strip();
        return text.isEmpty() ? icon : icon + " " + text;
    }

    // ==================== Tables ====================

    private static String table(List<Node> rows) {
        List<String> lines = new ArrayList<>();
        for (Node row : rows) {
            String text = render(row).strip();
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        return String.join("\n", lines);
    }

    private static String tableRow(List<Node> cells) {
        List<String> parts = new ArrayList<>();
        for (Node cell : cells) {
            String text = flatten(render(cell));
            if (cell instanceof TableCell || !text.isEmpty()) {
                parts.add(text);
            }
        }
        return String.join(" | ", parts);
    }

    // ==================== Links and media ====================

    private static String link(LinkElement link) {
        List<String> parts = new ArrayList<>();
        List<Node> body = new ArrayList<>();
        for (Node child : link.children()) {
            if (child instanceof ResourceIdentifier) {
                String text = render(child);
                if (!text.isBlank()) {
                    parts.add(text);
                }
            } else {
                body.add(child);
            }
        }

        String bodyText = join(body).strip();
        if (!bodyText.isEmpty()) {
            parts.add(bodyText);
        }
        if (parts.isEmpty()) {
            return link.href() == null ? "" : link.href();
        }
        return String.join(" ", parts);
    }

    private static String resource(ResourceIdentifier resource) {
        return switch (resource.type()) {
            case PAGE -> "📄 Page";
            case BLOG_POST -> labelled("📝 Blog", resource.postingDay());
            case ATTACHMENT -> labelled("📎 Attachment", resource.filename());
            case URL -> labelled("🔗 URL", resource.value());
            case USER -> labelled("👤 User", firstNonBlank(resource.accountId(), resource.userkey()));
            case SPACE -> labelled("🏠 Space", resource.spaceKey());
            case SHORTCUT -> labelled("🔗 Shortcut", shortcut(resource));
            case CONTENT_ENTITY -> labelled("📄 Content", resource.contentId());
        };
    }

    private static String shortcut(ResourceIdentifier resource) {
        if (isBlank(resource.key())) {
            return null;
        }
        return isBlank(resource.parameter()) ? resource.key() : resource.key() + "@" + resource.parameter();
    }

    private static String image(Image image) {
        String name = firstNonBlank(image.alt(), image.filename(), image.src());
        String caption = flatten(join(image.children()));
        return "🖼️ Image: " + (name == null ? "Unknown" : name)
            + (caption.isEmpty() ? "" : " (" + caption + ")");
    }

    private static String emoticon(Emoticon emoticon) {
        String text = firstNonBlank(emoticon.emojiFallback(), emoticon.emojiShortname());
        if (text != null) {
            return text;
        }
        return isBlank(emoticon.name()) ? "" : ":" + emoticon.name() + ":";
    }

    private static String time(Time time) {
        return isBlank(time.datetime()) ? "📅 Date" : "📅 " + time.datetime();
    }

    private static String placeholder(PlaceholderElement placeholder) {
        return labelled("Placeholder", placeholder.text() == null ? null : placeholder.text().strip());
    }

    // ==================== Macros ====================

    private static String panel(PanelMacro panel) {
        String body = flatten(join(panel.children()));
        if (!isBlank(panel.panelIconText())) {
            return body.isEmpty() ? panel.panelIconText() : panel.panelIconText() + " " + body;
        }
        String label = panel.panelType().label();
        return body.isEmpty() ? label : label + ": " + body;
    }

    private static String status(StatusMacro status) {
        String title = isBlank(status.title()) ? "Status" : status.title();
        String colour = isBlank(status.colour()) ? "" : " (" + status.colour() + ")";
        return "🏷️ Status: " + title + colour;
    }

    private static String jira(JiraMacro jira) {
        if (isBlank(jira.key())) {
            return "🎫 JIRA Issue";
        }
        if (isBlank(jira.server()) || "System Jira".equals(jira.server())) {
            return "🎫 " + jira.key();
        }
        return "🎫 " + jira.key() + " (" + jira.server() + ")";
    }

    private static String include(IncludeMacro include) {
        return orElse(include.contentTitle(), "📄 Include: ", "📄 Include Page");
    }

    private static String excerptInclude(ExcerptIncludeMacro excerpt) {
        if (isBlank(excerpt.contentTitle())) {
            return "📝 Excerpt Include";
        }
        String day = isBlank(excerpt.postingDay()) ? "" : " (" + excerpt.postingDay() + ")";
        return "📝 Excerpt: " + excerpt.contentTitle() + day;
    }

    // ==================== Helpers ====================

    private static String labelled(String label, String value) {
        return isBlank(value) ? label : label + ": " + value;
    }

    private static String orElse(String value, String prefix, String fallback) {
        return isBlank(value) ? fallback : prefix + value;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void trimTrailing(StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && Character.isWhitespace(sb.charAt(end - 1))) {
            end--;
        }
        sb.setLength(end);
    }
}
