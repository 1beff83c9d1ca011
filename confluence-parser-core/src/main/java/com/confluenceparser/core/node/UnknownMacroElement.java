package com.confluenceparser.core.node;

import java.util.List;
import java.util.Map;

/**
 * Pass-through for a macro without a registered rule, or without a name at all.
 *
 * <p>Keeps what the source element said about the macro so callers can still inspect it, and
 * renders its body like a neutral container.
 *
 * @param name macro name as written, null if the element had none
 * @param macroId {@code ac:macro-id}, may be null
 * @param parameters parameter text keyed by {@code ac:name}, the default parameter under {@code ""}
 * @param children body
 */
public record UnknownMacroElement(String name, String macroId, Map<String, String> parameters,
                                  List<Node> children) implements Node {

    public UnknownMacroElement {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNKNOWN_MACRO;
    }
}
