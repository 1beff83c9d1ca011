package com.confluenceparser;

import com.confluenceparser.cli.FindCommand;
import com.confluenceparser.cli.InspectCommand;
import com.confluenceparser.cli.TextCommand;
import com.confluenceparser.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

import java.io.PrintWriter;

/**
 * Main CLI entry point for the Confluence content parser.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code text} - Print the plain text of a document</li>
 *   <li>{@code inspect} - Print node statistics and diagnostics</li>
 *   <li>{@code find} - Print the nodes of given kinds</li>
 *   <li>{@code validate} - Parse strictly and report diagnostics</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Extract text
 * confluence-parser text page.xml
 *
 * # Count nodes as JSON
 * confluence-parser inspect page.xml --json
 *
 * # List all links and code blocks
 * confluence-parser find page.xml --kind LINK --kind CODE
 *
 * # Fail on anything the parser does not understand
 * confluence-parser validate page.xml
 * }</pre>
 */
@Command(
    name = "confluence-parser",
    mixinStandardHelpOptions = true,
    version = "Confluence Content Parser 1.0.0-SNAPSHOT",
    description = "Parses Confluence storage-format markup into a typed content tree",
    subcommands = {
        TextCommand.class,
        InspectCommand.class,
        FindCommand.class,
        ValidateCommand.class
    }
)
public class ConfluenceParserCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConfluenceParserCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("Confluence Content Parser");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'confluence-parser --help' to see available commands");
        out.println("Use 'confluence-parser <command> --help' for command-specific help");
        out.flush();
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line. Logging is set up from the global options before
     * the selected subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        ConfluenceParserCLI cli = new ConfluenceParserCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
