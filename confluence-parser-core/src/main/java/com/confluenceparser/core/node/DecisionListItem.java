package com.confluenceparser.core.node;

import java.util.List;

/**
 * One decision of a {@link DecisionList}.
 *
 * @param localId editor local id
 * @param state decision state, null is treated as pending
 * @param children decision text
 */
public record DecisionListItem(String localId, DecisionState state, List<Node> children) implements Node {

    public DecisionListItem {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECISION_LIST_ITEM;
    }
}
