package com.confluenceparser.core.node;

import java.util.List;

/**
 * List of page attachments.
 *
 * @param patterns comma-separated file name patterns
 * @param sortBy sort field
 * @param sortOrder sort direction
 * @param old whether old versions are shown
 * @param upload whether uploading is allowed
 */
public record AttachmentsMacro(
    String patterns,
    String sortBy,
    String sortOrder,
    boolean old,
    boolean upload
) implements MacroNode {

    @Override
    public String macroName() {
        return "attachments";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTACHMENTS;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
