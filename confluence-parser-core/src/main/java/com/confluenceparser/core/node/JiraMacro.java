package com.confluenceparser.core.node;

import java.util.List;

/**
 * A Jira issue or issue query.
 *
 * @param key issue key
 * @param server server name
 * @param serverId server id
 * @param jqlQuery JQL query for issue lists
 * @param columns displayed columns
 * @param maximumIssues maximum number of issues
 */
public record JiraMacro(
    String key,
    String server,
    String serverId,
    String jqlQuery,
    String columns,
    Integer maximumIssues
) implements MacroNode {

    public static JiraMacro of(String key, String server) {
        return new JiraMacro(key, server, null, null, null, null);
    }

    @Override
    public String macroName() {
        return "jira";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.JIRA;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
