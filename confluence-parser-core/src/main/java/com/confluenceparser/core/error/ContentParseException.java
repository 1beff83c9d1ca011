package com.confluenceparser.core.error;

import com.confluenceparser.core.diagnostics.Diagnostic;

import java.util.List;

/**
 * Base class of the failures that can escape a parse call.
 *
 * <p>Unknown elements and bad field values never raise this on their own. They are recorded as
 * {@link Diagnostic}s. Only an input that cannot be tokenized, or a strict parser meeting
 * diagnostics, ends a call with an exception.
 */
public abstract class ContentParseException extends RuntimeException {

    private final transient List<Diagnostic> diagnostics;

    protected ContentParseException(String message, List<Diagnostic> diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the diagnostics known when the call failed.
     *
     * @return diagnostics in recording order, possibly empty
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
