package com.confluenceparser.core.macro;

import com.confluenceparser.core.dispatch.Built;
import com.confluenceparser.core.dispatch.DispatchContext;

/**
 * Builds the node for one registered macro name.
 */
@FunctionalInterface
public interface MacroRule {

    /**
     * Builds a macro.
     *
     * @param macro view over the macro element
     * @param context dispatch context of the current parse
     * @return the macro node and any parameter diagnostics
     */
    Built build(MacroElement macro, DispatchContext context);
}
