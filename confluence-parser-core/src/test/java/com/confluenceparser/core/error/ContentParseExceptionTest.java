package com.confluenceparser.core.error;

import com.confluenceparser.core.diagnostics.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ContentParseException} subclasses.
 */
class ContentParseExceptionTest {

    @Test
    void diagnosticsException_summarizesDiagnostics() {
        DiagnosticsException exception = new DiagnosticsException(List.of(
            Diagnostic.unknownElement("foo"), Diagnostic.unknownMacro("bar")));

        assertThat(exception)
            .hasMessage("2 diagnostic(s) recorded while parsing: unknown_element:foo, unknown_macro:bar")
            .isInstanceOf(ContentParseException.class);
        assertThat(exception.getDiagnostics()).hasSize(2);
    }

    @Test
    void tokenizationException_keepsCauseAndHasNoDiagnostics() {
        IllegalStateException cause = new IllegalStateException("boom");
        MarkupTokenizationException exception = new MarkupTokenizationException("Failed", cause);

        assertThat(exception).hasCause(cause);
        assertThat(exception.getDiagnostics()).isEmpty();
    }
}
