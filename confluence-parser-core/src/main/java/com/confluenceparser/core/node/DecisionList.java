package com.confluenceparser.core.node;

import java.util.List;

/**
 * A list of decisions.
 *
 * @param localId editor local id
 * @param children decision items
 */
public record DecisionList(String localId, List<Node> children) implements Node {

    public DecisionList {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECISION_LIST;
    }
}
