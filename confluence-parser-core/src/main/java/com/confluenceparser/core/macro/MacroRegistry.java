package com.confluenceparser.core.macro;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.dispatch.Built;
import com.confluenceparser.core.dispatch.DispatchContext;
import com.confluenceparser.core.markup.MarkupElement;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.Text;
import com.confluenceparser.core.node.UnknownMacroElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Closed mapping from macro name to {@link MacroRule}.
 *
 * <p>A macro without a name is recorded as {@code missing_attribute:<tag>[ac:name]}, and a
 * name without a rule as {@code unknown_macro:<name>}. In both cases the body is kept inside an
 * {@link UnknownMacroElement}, together with the macro's name and parameters, so no text is lost.
 *
 * <p><b>Registered macros:</b> {@code panel}, {@code info}, {@code note}, {@code tip},
 * {@code success}, {@code warning}, {@code error}, {@code code}, {@code status},
 * {@code expand}, {@code details}, {@code toc}, {@code anchor}, {@code excerpt},
 * {@code jira}, {@code include}, {@code excerpt-include}, {@code tasks-report-macro},
 * {@code attachments}, {@code viewpdf}, {@code view-file}, {@code profile}.
 */
public final class MacroRegistry {

    private static final Logger log = LoggerFactory.getLogger(MacroRegistry.class);

    private final Map<String, MacroRule> rules;

    private MacroRegistry(Map<String, MacroRule> rules) {
        this.rules = Map.copyOf(rules);
    }

    /**
     * Creates the registry of all supported macros.
     *
     * @return standard registry
     */
    public static MacroRegistry standard() {
        Map<String, MacroRule> rules = new HashMap<>();
        ContentMacros.register(rules);
        ReferenceMacros.register(rules);
        return new MacroRegistry(rules);
    }

    public boolean supports(String macroName) {
        return macroName != null && rules.containsKey(macroName.toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return new TreeSet<>(rules.keySet());
    }

    /**
     * Builds a structured macro element.
     *
     * @param element {@code ac:structured-macro} or {@code ac:macro} element
     * @param context dispatch context
     * @return macro node, or a container holding the body
     */
    public Built build(MarkupElement element, DispatchContext context) {
        MacroElement macro = new MacroElement(element);
        String name = macro.name();

        if (name == null) {
            return Built.of(fallback(macro, context),
                List.of(Diagnostic.missingAttribute(element.name(), "ac:name")));
        }

        MacroRule rule = rules.get(name.toLowerCase(Locale.ROOT));
        if (rule == null) {
            log.debug("Unknown macro '{}', keeping its body", name);
            return Built.of(fallback(macro, context), List.of(Diagnostic.unknownMacro(name)));
        }
        return rule.build(macro, context);
    }

    private static UnknownMacroElement fallback(MacroElement macro, DispatchContext context) {
        List<Node> body;
        if (macro.richTextBody().isPresent()) {
            body = macro.body(context);
        } else {
            String plain = macro.plainTextBody();
            body = plain == null || plain.isEmpty() ? List.of() : List.of(new Text(plain));
        }
        return new UnknownMacroElement(macro.name(), macro.macroId(), macro.parameterValues(), body);
    }
}
