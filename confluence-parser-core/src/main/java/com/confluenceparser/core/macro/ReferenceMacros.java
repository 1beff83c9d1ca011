package com.confluenceparser.core.macro;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.dispatch.Built;
import com.confluenceparser.core.dispatch.DispatchContext;
import com.confluenceparser.core.node.AttachmentsMacro;
import com.confluenceparser.core.node.ExcerptIncludeMacro;
import com.confluenceparser.core.node.IncludeMacro;
import com.confluenceparser.core.node.JiraMacro;
import com.confluenceparser.core.node.ProfileMacro;
import com.confluenceparser.core.node.ResourceIdentifier;
import com.confluenceparser.core.node.TasksReportMacro;
import com.confluenceparser.core.node.ViewFileMacro;
import com.confluenceparser.core.node.ViewPdfMacro;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Macros that point at other content: Jira issues, included pages, attachments, users and
 * task reports.
 */
final class ReferenceMacros {

    private ReferenceMacros() {
        // Utility class - no instantiation
    }

    static void register(Map<String, MacroRule> rules) {
        rules.put("jira", ReferenceMacros::jira);
        rules.put("include", ReferenceMacros::include);
        rules.put("excerpt-include", ReferenceMacros::excerptInclude);
        rules.put("tasks-report-macro", ReferenceMacros::tasksReport);
        rules.put("attachments", ReferenceMacros::attachments);
        rules.put("viewpdf", ReferenceMacros::viewPdf);
        rules.put("view-file", ReferenceMacros::viewFile);
        rules.put("profile", ReferenceMacros::profile);
    }

    private static Built jira(MacroElement m, DispatchContext ctx) {
        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new JiraMacro(
            m.parameter("key"),
            m.parameter("server"),
            m.parameter("serverId"),
            m.parameter("jqlQuery"),
            m.parameter("columns"),
            m.integerParameter("maximumIssues", issues)
        ), issues);
    }

    private static Built include(MacroElement m, DispatchContext ctx) {
        ResourceIdentifier page = m.resource(MacroElement.DEFAULT_PARAMETER, ctx, "ri:page");
        return page == null
            ? Built.of(new IncludeMacro(null, null))
            : Built.of(new IncludeMacro(page.contentTitle(), page.spaceKey()));
    }

    private static Built excerptInclude(MacroElement m, DispatchContext ctx) {
        ResourceIdentifier source = m.resource(MacroElement.DEFAULT_PARAMETER, ctx, "ri:page", "ri:blog-post");
        List<Diagnostic> issues = new ArrayList<>();
        boolean noPanel = m.booleanParameter("nopanel", false, issues);
        return Built.of(new ExcerptIncludeMacro(
            source == null ? null : source.contentTitle(),
            source == null ? null : source.spaceKey(),
            source == null ? null : source.postingDay(),
            noPanel
        ), issues);
    }

    private static Built tasksReport(MacroElement m, DispatchContext ctx) {
        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new TasksReportMacro(
            m.parameter("spaces"),
            m.parameter("labels"),
            m.parameter("status"),
            m.integerParameter("pageSize", issues)
        ), issues);
    }

    private static Built attachments(MacroElement m, DispatchContext ctx) {
        List<Diagnostic> issues = new ArrayList<>();
        return Built.of(new AttachmentsMacro(
            m.parameter("patterns"),
            m.parameter("sortBy"),
            m.parameter("sortOrder"),
            m.booleanParameter("old", false, issues),
            m.booleanParameter("upload", false, issues)
        ), issues);
    }

    private static Built viewPdf(MacroElement m, DispatchContext ctx) {
        ResourceIdentifier file = m.resource("name", ctx, "ri:attachment");
        return file == null
            ? Built.of(new ViewPdfMacro(null, null))
            : Built.of(new ViewPdfMacro(file.filename(), file.versionAtSave()));
    }

    private static Built viewFile(MacroElement m, DispatchContext ctx) {
        ResourceIdentifier file = m.resource("name", ctx, "ri:attachment");
        return Built.of(new ViewFileMacro(
            file == null ? null : file.filename(),
            file == null ? null : file.versionAtSave(),
            m.parameter("height")
        ));
    }

    private static Built profile(MacroElement m, DispatchContext ctx) {
        ResourceIdentifier user = m.resource("user", ctx, "ri:user");
        String accountId = user == null ? null : user.accountId();
        if (accountId == null && user != null) {
            accountId = user.userkey();
        }
        return Built.of(new ProfileMacro(accountId));
    }
}
