package com.confluenceparser.core.node;

import java.util.List;

/**
 * An item of a {@link ListElement}.
 *
 * <p>Task fields are only set for items of a task list.
 *
 * @param taskId task id
 * @param taskUuid task uuid
 * @param localId editor local id
 * @param status completion state, null if absent
 * @param children item content
 */
public record ListItem(
    String taskId,
    String taskUuid,
    String localId,
    TaskStatus status,
    List<Node> children
) implements Node {

    public ListItem {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a plain list item.
     *
     * @param children item content
     * @return list item without task fields
     */
    public static ListItem of(List<Node> children) {
        return new ListItem(null, null, null, null, children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST_ITEM;
    }
}
