package com.confluenceparser.core.error;

import com.confluenceparser.core.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by a strict parser when any diagnostic was recorded.
 *
 * <p>The message summarizes the diagnostics, e.g.
 * {@code 2 diagnostic(s) recorded while parsing: unknown_element:foo, unknown_macro:bar}.
 */
public class DiagnosticsException extends ContentParseException {

    public DiagnosticsException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics), diagnostics, null);
    }

    static String summarize(List<Diagnostic> diagnostics) {
        return diagnostics.size() + " diagnostic(s) recorded while parsing: "
            + diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining(", "));
    }
}
