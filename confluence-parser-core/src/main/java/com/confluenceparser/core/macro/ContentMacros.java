package com.confluenceparser.core.macro;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.dispatch.Built;
import com.confluenceparser.core.dispatch.DispatchContext;
import com.confluenceparser.core.dispatch.ValueParsers;
import com.confluenceparser.core.node.AnchorMacro;
import com.confluenceparser.core.node.BreakoutMode;
import com.confluenceparser.core.node.CodeMacro;
import com.confluenceparser.core.node.DetailsMacro;
import com.confluenceparser.core.node.ExcerptMacro;
import com.confluenceparser.core.node.ExpandMacro;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.PanelMacro;
import com.confluenceparser.core.node.PanelType;
import com.confluenceparser.core.node.StatusMacro;
import com.confluenceparser.core.node.TocMacro;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Macros that carry or decorate page content: panels, code, status, expand, details, toc,
 * anchor and excerpt.
 */
final class ContentMacros {

    private ContentMacros() {
        // Utility class - no instantiation
    }

    static void register(Map<String, MacroRule> rules) {
        panel(rules, "panel", PanelType.PANEL);
        panel(rules, "info", PanelType.INFO);
        panel(rules, "note", PanelType.NOTE);
        panel(rules, "tip", PanelType.SUCCESS);
        panel(rules, "success", PanelType.SUCCESS);
        panel(rules, "warning", PanelType.WARNING);
        panel(rules, "error", PanelType.ERROR);

        rules.put("code", ContentMacros::code);
        rules.put("status", ContentMacros::status);
        rules.put("expand", ContentMacros::expand);
        rules.put("details", ContentMacros::details);
        rules.put("toc", ContentMacros::toc);
        rules.put("anchor", (m, ctx) -> Built.of(new AnchorMacro(m.parameter(MacroElement.DEFAULT_PARAMETER))));
        rules.put("excerpt", ContentMacros::excerpt);
    }

    private static void panel(Map<String, MacroRule> rules, String name, PanelType type) {
        rules.put(name, (m, ctx) -> {
            List<Node> body = m.body(ctx);
            return Built.of(new PanelMacro(
                m.name(),
                type,
                m.parameter("title"),
                m.parameter("bgColor"),
                m.parameter("borderStyle"),
                m.parameter("borderColor"),
                m.parameter("titleBGColor"),
                m.parameter("titleColor"),
                m.parameter("panelIcon"),
                m.parameter("panelIconId"),
                m.parameter("panelIconText"),
                body
            ));
        });
    }

    private static Built code(MacroElement m, DispatchContext ctx) {
        List<Diagnostic> issues = new ArrayList<>();
        String code = m.plainTextBody();
        String language = m.parameter("language");
        if (language == null) {
            language = m.parameter(MacroElement.DEFAULT_PARAMETER);
        }

        return Built.of(new CodeMacro(
            language,
            m.parameter("title"),
            m.booleanParameter("linenumbers", false, issues),
            m.parameter("theme"),
            m.booleanParameter("collapse", false, issues),
            ValueParsers.parseEnum(m.parameter("breakoutMode"), "breakoutMode", BreakoutMode::fromValue, issues),
            m.parameter("breakoutWidth"),
            code == null ? "" : code
        ), issues);
    }

    private static Built status(MacroElement m, DispatchContext ctx) {
        List<Diagnostic> issues = new ArrayList<>();
        String colour = m.parameter("colour");
        if (colour == null) {
            colour = m.parameter("color");
        }
        return Built.of(new StatusMacro(m.parameter("title"), colour,
            m.booleanParameter("subtle", false, issues)), issues);
    }

    private static Built expand(MacroElement m, DispatchContext ctx) {
        List<Node> body = m.body(ctx);
        return Built.of(new ExpandMacro(m.parameter("title"), m.parameter("breakoutWidth"), body));
    }

    private static Built details(MacroElement m, DispatchContext ctx) {
        List<Node> body = m.body(ctx);
        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new DetailsMacro(m.parameter("title"), m.parameter("id"),
            m.booleanParameter("hidden", false, issues), body), issues);
    }

    private static Built toc(MacroElement m, DispatchContext ctx) {
        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new TocMacro(
            m.parameter("style"),
            m.integerParameter("minLevel", issues),
            m.integerParameter("maxLevel", issues),
            m.parameter("include"),
            m.parameter("exclude"),
            m.booleanParameter("outline", false, issues),
            m.parameter("type"),
            m.booleanParameter("printable", true, issues)
        ), issues);
    }

    private static Built excerpt(MacroElement m, DispatchContext ctx) {
        List<Node> body = m.body(ctx);
        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new ExcerptMacro(m.parameter("name"),
            m.booleanParameter("hidden", false, issues), body), issues);
    }
}
