package com.confluenceparser.core.node;

import java.util.List;

/**
 * Report of tasks across spaces.
 *
 * @param spaces comma-separated space keys
 * @param labels comma-separated labels
 * @param status task status filter
 * @param pageSize number of tasks per page
 */
public record TasksReportMacro(String spaces, String labels, String status, Integer pageSize) implements MacroNode {

    @Override
    public String macroName() {
        return "tasks-report-macro";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TASKS_REPORT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
