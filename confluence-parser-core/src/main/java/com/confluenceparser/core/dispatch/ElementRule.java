package com.confluenceparser.core.dispatch;

import com.confluenceparser.core.markup.MarkupElement;

/**
 * Builds the node for one kind of element.
 *
 * <p>Rules dispatch the element's children through the context first and build their own
 * record last. Problems with the element's own fields are returned in the {@link Built} value
 * rather than recorded directly.
 */
@FunctionalInterface
public interface ElementRule {

    /**
     * Builds an element.
     *
     * @param element element to build
     * @param context dispatch context of the current parse
     * @return contributed nodes and diagnostics
     */
    Built build(MarkupElement element, DispatchContext context);
}
