package com.confluenceparser.core.macro;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.dispatch.DispatchContext;
import com.confluenceparser.core.dispatch.ValueParsers;
import com.confluenceparser.core.markup.MarkupElement;
import com.confluenceparser.core.markup.MarkupNode;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.ResourceIdentifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view over an {@code ac:structured-macro} element.
 *
 * <p>Parameters are keyed by their {@code ac:name}; an unnamed parameter is the default
 * parameter and is keyed by an empty string. The rich-text body is dispatched like any other
 * content, the plain-text body is returned as written.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MacroElement macro = new MacroElement(element);
 * String language = macro.parameter("language");
 * String code = macro.plainTextBody();
 * }</pre>
 */
public final class MacroElement {

    static final String DEFAULT_PARAMETER = "";

    private final MarkupElement element;
    private final Map<String, MarkupElement> parameters;

    public MacroElement(MarkupElement element) {
        this.element = Objects.requireNonNull(element, "element must not be null");
        Map<String, MarkupElement> byName = new LinkedHashMap<>();
        for (MarkupElement parameter : element.childElements("ac:parameter")) {
            String name = parameter.attr("ac:name");
            byName.putIfAbsent(name == null ? DEFAULT_PARAMETER : name, parameter);
        }
        this.parameters = byName;
    }

    public MarkupElement element() {
        return element;
    }

    /**
     * Returns the macro name.
     *
     * @return trimmed {@code ac:name}, or null if missing
     */
    public String name() {
        return ValueParsers.trimToNull(element.attr("ac:name"));
    }

    public String macroId() {
        return element.attr("ac:macro-id");
    }

    public Set<String> parameterNames() {
        return parameters.keySet();
    }

    /**
     * Returns the text of every parameter, empty parameters as an empty string.
     *
     * @return parameter text keyed by name, in source order
     */
    public Map<String, String> parameterValues() {
        Map<String, String> values = new LinkedHashMap<>();
        for (String name : parameters.keySet()) {
            String value = parameter(name);
            values.put(name, value == null ? "" : value);
        }
        return values;
    }

    /**
     * Returns the trimmed text of a parameter.
     *
     * @param name parameter name, empty for the default parameter
     * @return value, or null if absent or empty
     */
    public String parameter(String name) {
        MarkupElement parameter = parameters.get(name);
        return parameter == null ? null : ValueParsers.trimToNull(parameter.textContent());
    }

    public Integer integerParameter(String name, List<Diagnostic> issues) {
        return ValueParsers.parseInteger(parameter(name), name, issues);
    }

    public boolean booleanParameter(String name, boolean defaultValue, List<Diagnostic> issues) {
        return ValueParsers.parseBoolean(parameter(name), name, defaultValue, issues);
    }

    /**
     * Finds a resource identifier nested anywhere inside a parameter, e.g. the {@code ri:page}
     * inside the {@code ac:link} of an include macro, and builds it.
     *
     * @param name parameter name
     * @param context dispatch context used to build the identifier
     * @param tagNames accepted {@code ri:} tags
     * @return built identifier, or null if the parameter holds none
     */
    public ResourceIdentifier resource(String name, DispatchContext context, String... tagNames) {
        MarkupElement parameter = parameters.get(name);
        if (parameter == null) {
            return null;
        }
        MarkupElement found = findDescendant(parameter, Set.of(tagNames));
        if (found == null) {
            return null;
        }
        for (Node node : context.dispatch(found)) {
            if (node instanceof ResourceIdentifier resource) {
                return resource;
            }
        }
        return null;
    }

    public Optional<MarkupElement> richTextBody() {
        return element.firstChild("ac:rich-text-body");
    }

    /**
     * Returns the plain-text body exactly as written.
     *
     * @return body text, or null if the macro has no plain-text body
     */
    public String plainTextBody() {
        return element.firstChild("ac:plain-text-body").map(MarkupElement::textContent).orElse(null);
    }

    /**
     * Builds the rich-text body.
     *
     * @param context dispatch context
     * @return body nodes, empty if there is no rich-text body
     */
    public List<Node> body(DispatchContext context) {
        return richTextBody().map(context::content).orElse(List.of());
    }

    private static MarkupElement findDescendant(MarkupElement root, Set<String> tagNames) {
        for (MarkupNode child : root.children()) {
            if (child instanceof MarkupElement element) {
                if (tagNames.contains(element.name())) {
                    return element;
                }
                MarkupElement nested = findDescendant(element, tagNames);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }
}
