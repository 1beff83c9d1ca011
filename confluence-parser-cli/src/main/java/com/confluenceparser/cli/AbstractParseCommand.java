package com.confluenceparser.cli;

import com.confluenceparser.core.config.ConfigLoader;
import com.confluenceparser.core.config.ParserSettings;
import com.confluenceparser.core.document.ConfluenceDocument;
import com.confluenceparser.core.error.ContentParseException;
import com.confluenceparser.core.error.DiagnosticsException;
import com.confluenceparser.core.parser.ConfluenceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base class for commands that parse one storage-format file.
 *
 * <p>Handles reading the file, building the parser from the options and mapping failures to
 * exit codes:
 * <ul>
 *   <li>{@code 0} - success</li>
 *   <li>{@code 1} - a strict parse recorded diagnostics</li>
 *   <li>{@code 2} - the file could not be read or tokenized</li>
 * </ul>
 */
public abstract class AbstractParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractParseCommand.class);

    protected static final int EXIT_OK = 0;
    protected static final int EXIT_DIAGNOSTICS = 1;
    protected static final int EXIT_ERROR = 2;

    @Spec
    protected CommandSpec spec;

    @Parameters(index = "0", description = "Storage-format file to parse")
    protected Path file;

    @Option(names = {"-c", "--config"}, description = "Parser configuration file (YAML)")
    protected Path configFile;

    @Option(names = "--strict", description = "Fail when any diagnostic is recorded")
    protected boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            String markup = Files.readString(file, StandardCharsets.UTF_8);
            ConfluenceDocument document = new ConfluenceParser(settings()).parse(markup);
            int exitCode = run(document, out);
            out.flush();
            return exitCode;
        } catch (DiagnosticsException e) {
            return onDiagnostics(e, out);
        } catch (ContentParseException e) {
            log.error("Failed to parse {}: {}", file, e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            return EXIT_ERROR;
        }
    }

    /**
     * Returns the parser settings: the configuration file if given, lenient otherwise, and
     * strict when {@code --strict} is set.
     *
     * @return parser settings
     */
    protected ParserSettings settings() {
        if (strict) {
            return ParserSettings.defaults();
        }
        return configFile != null ? ConfigLoader.load(configFile).parser() : ParserSettings.lenient();
    }

    /**
     * Reports a strict parse that recorded diagnostics.
     *
     * @param e the failure
     * @param out command output
     * @return exit code
     */
    protected int onDiagnostics(DiagnosticsException e, PrintWriter out) {
        PrintWriter err = spec.commandLine().getErr();
        err.println(e.getMessage());
        err.flush();
        return EXIT_DIAGNOSTICS;
    }

    /**
     * Runs the command on a parsed document.
     *
     * @param document parsed document
     * @param out command output
     * @return exit code
     * @throws IOException if output cannot be produced
     */
    protected abstract int run(ConfluenceDocument document, PrintWriter out) throws IOException;
}
