package com.confluenceparser.core.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Append-only collector for the diagnostics of one parse call.
 *
 * <p>A fresh instance is created for every call and threaded through the dispatch context, so
 * a parser can be shared between threads. Instances themselves are not thread-safe.
 */
public final class Diagnostics {

    private final List<Diagnostic> recorded = new ArrayList<>();

    /**
     * Appends one diagnostic.
     *
     * @param diagnostic diagnostic to record
     */
    public void record(Diagnostic diagnostic) {
        recorded.add(Objects.requireNonNull(diagnostic, "diagnostic must not be null"));
    }

    /**
     * Inserts several diagnostics at a position recorded earlier with {@link #size()}, keeping
     * everything recorded since then after them.
     *
     * @param position index to insert at
     * @param diagnostics diagnostics to insert in iteration order
     */
    public void recordAt(int position, Collection<Diagnostic> diagnostics) {
        if (position < 0 || position > recorded.size()) {
            throw new IndexOutOfBoundsException("position " + position + " outside 0.." + recorded.size());
        }
        diagnostics.forEach(d -> Objects.requireNonNull(d, "diagnostic must not be null"));
        recorded.addAll(position, diagnostics);
    }

    public boolean isEmpty() {
        return recorded.isEmpty();
    }

    public int size() {
        return recorded.size();
    }

    /**
     * Returns an immutable copy of everything recorded so far, in recording order.
     *
     * @return frozen diagnostics
     */
    public List<Diagnostic> snapshot() {
        return List.copyOf(recorded);
    }

    /**
     * Formats a list of diagnostics as strings.
     *
     * @param diagnostics diagnostics to format
     * @return formatted strings in the same order
     */
    public static List<String> format(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::format).toList();
    }
}
