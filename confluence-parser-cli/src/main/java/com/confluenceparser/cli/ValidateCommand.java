package com.confluenceparser.cli;

import com.confluenceparser.core.config.ParserSettings;
import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.document.ConfluenceDocument;
import com.confluenceparser.core.error.DiagnosticsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

/**
 * Command to validate a document: a strict parse that lists every diagnostic.
 */
@Command(
    name = "validate",
    description = "Parse strictly and list every diagnostic",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends AbstractParseCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Override
    protected ParserSettings settings() {
        return ParserSettings.defaults();
    }

    @Override
    protected int run(ConfluenceDocument document, PrintWriter out) {
        log.info("Validated {}", file);
        out.println("OK: " + file + " has no diagnostics");
        return EXIT_OK;
    }

    @Override
    protected int onDiagnostics(DiagnosticsException e, PrintWriter out) {
        out.println("INVALID: " + file + " has " + e.getDiagnostics().size() + " diagnostic(s)");
        for (Diagnostic diagnostic : e.getDiagnostics()) {
            out.println("  " + diagnostic.format());
        }
        out.flush();
        return EXIT_DIAGNOSTICS;
    }
}
