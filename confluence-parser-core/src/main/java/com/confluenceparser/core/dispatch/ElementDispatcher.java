package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.diagnostics.Diagnostics;
import com.confluenceparser.core.macro.MacroRegistry;
import com.confluenceparser.core.markup.MarkupElement;
import com.confluenceparser.core.node.ContainerElement;
import com.confluenceparser.core.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive-descent builder from markup elements to content nodes.
 *
 * <p>A static table keyed on {@link TagKey} selects the {@link ElementRule} for each element.
 * {@code ac:structured-macro} (and the legacy {@code ac:macro}) is handed to the
 * {@link MacroRegistry}. An element without a rule is kept as a {@link ContainerElement} of its
 * children and recorded as {@code unknown_element:<tag>}.
 *
 * <p>Instances are immutable and can be shared between threads. All per-call state lives in the
 * {@link DispatchContext} returned by {@link #newContext(Diagnostics)}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ElementDispatcher dispatcher = ElementDispatcher.standard();
 * Diagnostics diagnostics = new Diagnostics();
 * List<Node> nodes = dispatcher.newContext(diagnostics).topLevel(forest);
 * }</pre>
 */
public final class ElementDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ElementDispatcher.class);

    private final Map<TagKey, ElementRule> rules;

    public ElementDispatcher(MacroRegistry macros) {
        Objects.requireNonNull(macros, "macros must not be null");

        Map<TagKey, ElementRule> table = new HashMap<>();
        StructureRules.register(table);
        InlineRules.register(table);
        ReferenceRules.register(table);

        ElementRule macroRule = macros::build;
        table.put(TagKey.of("ac:structured-macro"), macroRule);
        table.put(TagKey.of("ac:macro"), macroRule);

        this.rules = Map.copyOf(table);
        log.debug("Element dispatcher initialized with {} rules", rules.size());
    }

    /**
     * Creates a dispatcher with the standard macro registry.
     *
     * @return dispatcher
     */
    public static ElementDispatcher standard() {
        return new ElementDispatcher(MacroRegistry.standard());
    }

    /**
     * Starts a parse call.
     *
     * @param diagnostics collector for this call
     * @return fresh context
     */
    public DispatchContext newContext(Diagnostics diagnostics) {
        return new DispatchContext(this, diagnostics, false);
    }

    /**
     * Returns whether a tag has a dedicated rule.
     *
     * @param qualifiedName tag name such as {@code ac:layout}
     * @return true if the tag is known
     */
    public boolean supports(String qualifiedName) {
        return rules.containsKey(TagKey.of(qualifiedName));
    }

    List<Node> dispatch(MarkupElement element, DispatchContext context) {
        // An element's own diagnostics go before those of its descendants.
        int position = context.diagnostics().size();
        ElementRule rule = rules.get(TagKey.of(element));
        Built built = rule != null ? rule.build(element, context) : unknown(element, context);
        context.diagnostics().recordAt(position, built.diagnostics());
        return built.nodes();
    }

    private static Built unknown(MarkupElement element, DispatchContext context) {
        log.debug("No rule for <{}>, keeping its content", element.name());
        List<Node> children = context.content(element);
        return Built.of(new ContainerElement(element.name(), children),
            List.of(Diagnostic.unknownElement(element.name())));
    }
}
