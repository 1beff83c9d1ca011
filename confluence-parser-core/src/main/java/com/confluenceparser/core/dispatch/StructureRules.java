package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.markup.MarkupElement;
import com.confluenceparser.core.node.BreakoutMode;
import com.confluenceparser.core.node.ContainerElement;
import com.confluenceparser.core.node.DecisionList;
import com.confluenceparser.core.node.DecisionListItem;
import com.confluenceparser.core.node.DecisionState;
import com.confluenceparser.core.node.HeadingElement;
import com.confluenceparser.core.node.LayoutCell;
import com.confluenceparser.core.node.LayoutElement;
import com.confluenceparser.core.node.LayoutSection;
import com.confluenceparser.core.node.LayoutSectionType;
import com.confluenceparser.core.node.ListElement;
import com.confluenceparser.core.node.ListItem;
import com.confluenceparser.core.node.ListType;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.Table;
import com.confluenceparser.core.node.TableCell;
import com.confluenceparser.core.node.TableRow;
import com.confluenceparser.core.node.TaskStatus;
import com.confluenceparser.core.node.TextBreakElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rules for block structure: paragraphs, headings, lists, tables, layouts, task lists and
 * decision lists.
 */
final class StructureRules {

    private static final Set<String> DECISION_TYPES = Set.of("decision-list", "decision-item");

    private StructureRules() {
        // Utility class - no instantiation
    }

    static void register(Map<TagKey, ElementRule> rules) {
        for (int level = 1; level <= 6; level++) {
            int headingLevel = level;
            rules.put(TagKey.of("h" + level),
                (e, ctx) -> Built.of(new HeadingElement(headingLevel, ctx.content(e))));
        }
        rules.put(TagKey.of("p"), (e, ctx) -> Built.of(TextBreakElement.paragraph(ctx.content(e))));
        rules.put(TagKey.of("div"), (e, ctx) -> Built.of(new ContainerElement(e.name(), ctx.content(e))));

        // Lists
        rules.put(TagKey.of("ul"),
            (e, ctx) -> Built.of(new ListElement(ListType.UNORDERED, null, ctx.structure(e))));
        rules.put(TagKey.of("ol"), StructureRules::orderedList);
        rules.put(TagKey.of("li"), (e, ctx) -> Built.of(ListItem.of(ctx.content(e))));
        rules.put(TagKey.of("ac:task-list"),
            (e, ctx) -> Built.of(new ListElement(ListType.TASK, null, ctx.structure(e))));
        rules.put(TagKey.of("ac:task"), StructureRules::task);

        // Tables
        rules.put(TagKey.of("table"), StructureRules::table);
        ElementRule rowGroup = (e, ctx) -> Built.unwrapped(ctx.structure(e));
        rules.put(TagKey.of("tbody"), rowGroup);
        rules.put(TagKey.of("thead"), rowGroup);
        rules.put(TagKey.of("tfoot"), rowGroup);
        rules.put(TagKey.of("colgroup"), (e, ctx) -> Built.skip());
        rules.put(TagKey.of("col"), (e, ctx) -> Built.skip());
        rules.put(TagKey.of("tr"), (e, ctx) -> Built.of(new TableRow(ctx.structure(e))));
        rules.put(TagKey.of("th"), (e, ctx) -> cell(e, ctx, true));
        rules.put(TagKey.of("td"), (e, ctx) -> cell(e, ctx, false));

        // Layouts
        rules.put(TagKey.of("ac:layout"), (e, ctx) -> Built.of(new LayoutElement(ctx.structure(e))));
        rules.put(TagKey.of("ac:layout-section"), StructureRules::layoutSection);
        rules.put(TagKey.of("ac:layout-cell"), (e, ctx) -> Built.of(new LayoutCell(ctx.content(e))));

        // Editor extensions
        rules.put(TagKey.of("ac:adf-extension"), StructureRules::adfExtension);
        rules.put(TagKey.of("ac:adf-node"), StructureRules::adfNode);
        rules.put(TagKey.of("ac:adf-fallback"),
            (e, ctx) -> Built.of(new ContainerElement(e.name(), ctx.content(e))));
    }

    // ==================== Lists ====================

    private static Built orderedList(MarkupElement element, DispatchContext ctx) {
        List<Node> items = ctx.structure(element);
        List<Diagnostic> issues = new ArrayList<>();
        Integer start = ValueParsers.parseInteger(element.attr("start"), "start", issues);
        if (start != null && start < 1) {
            issues.add(Diagnostic.invalidValue("start", element.attr("start")));
            start = null;
        }
        return Built.of(new ListElement(ListType.ORDERED, start, items), issues);
    }

    private static Built task(MarkupElement element, DispatchContext ctx) {
        List<Node> body = element.firstChild("ac:task-body").map(ctx::content).orElse(List.of());

        List<Diagnostic> issues = new ArrayList<>();
        TaskStatus status = ValueParsers.parseEnum(
            childText(element, "ac:task-status"), "ac:task-status", TaskStatus::fromValue, issues);

        return Built.of(new ListItem(
            childText(element, "ac:task-id"),
            childText(element, "ac:task-uuid"),
            element.attr("ac:local-id"),
            status,
            body
        ), issues);
    }

    // ==================== Tables ====================

    private static Built table(MarkupElement element, DispatchContext ctx) {
        List<Node> rows = ctx.structure(element);
        return Built.of(new Table(
            element.attr("data-table-width"),
            element.attr("data-layout"),
            element.attr("ac:local-id"),
            element.attr("data-table-display-mode"),
            rows
        ));
    }

    private static Built cell(MarkupElement element, DispatchContext ctx, boolean header) {
        List<Node> children = ctx.content(element);
        List<Diagnostic> issues = new ArrayList<>();
        Integer rowspan = ValueParsers.parseInteger(element.attr("rowspan"), "rowspan", issues);
        Integer colspan = ValueParsers.parseInteger(element.attr("colspan"), "colspan", issues);
        return Built.of(new TableCell(header, rowspan, colspan, children), issues);
    }

    // ==================== Layouts ====================

    private static Built layoutSection(MarkupElement element, DispatchContext ctx) {
        List<Node> cells = ctx.structure(element);
        List<Diagnostic> issues = new ArrayList<>();
        LayoutSectionType type = ValueParsers.parseEnum(
            element.attr("ac:type"), "ac:type", LayoutSectionType::fromValue, issues);
        BreakoutMode breakoutMode = ValueParsers.parseEnum(
            element.attr("ac:breakout-mode"), "ac:breakout-mode", BreakoutMode::fromValue, issues);
        return Built.of(new LayoutSection(type, breakoutMode, element.attr("ac:breakout-width"), cells), issues);
    }

    // ==================== Decisions ====================

    private static Built adfExtension(MarkupElement element, DispatchContext ctx) {
        Optional<MarkupElement> node = element.firstChild("ac:adf-node");
        if (node.isPresent() && DECISION_TYPES.contains(node.get().attr("type"))) {
            return Built.unwrapped(ctx.dispatch(node.get()));
        }

        Optional<MarkupElement> fallback = element.firstChild("ac:adf-fallback");
        if (fallback.isPresent()) {
            return Built.unwrapped(ctx.dispatch(fallback.get()));
        }
        return Built.unwrapped(ctx.structure(element));
    }

    private static Built adfNode(MarkupElement element, DispatchContext ctx) {
        String type = element.attr("type");
        String localId = adfAttribute(element, "local-id");
        if (localId == null) {
            localId = element.attr("local-id");
        }

        if ("decision-list".equals(type)) {
            return Built.of(new DecisionList(localId, ctx.dispatchAll(element.childElements("ac:adf-node"))));
        }

        List<Node> content = element.firstChild("ac:adf-content").map(ctx::content).orElse(List.of());
        if ("decision-item".equals(type)) {
            List<Diagnostic> issues = new ArrayList<>();
            DecisionState state = ValueParsers.parseEnum(
                adfAttribute(element, "state"), "state", DecisionState::fromValue, issues);
            return Built.of(new DecisionListItem(localId, state, content), issues);
        }

        List<Node> children = new ArrayList<>(ctx.dispatchAll(element.childElements("ac:adf-node")));
        children.addAll(content);
        return Built.of(new ContainerElement(element.name(), children),
            List.of(Diagnostic.unknownElement(element.name() + "[type=" + type + "]")));
    }

    private static String adfAttribute(MarkupElement node, String key) {
        for (MarkupElement attribute : node.childElements("ac:adf-attribute")) {
            if (key.equals(attribute.attr("key"))) {
                return ValueParsers.trimToNull(attribute.textContent());
            }
        }
        return null;
    }

    private static String childText(MarkupElement element, String childName) {
        return element.firstChild(childName)
            .map(child -> ValueParsers.trimToNull(child.textContent()))
            .orElse(null);
    }
}
