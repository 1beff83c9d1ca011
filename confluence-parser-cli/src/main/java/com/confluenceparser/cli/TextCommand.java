package com.confluenceparser.cli;

import com.confluenceparser.core.document.ConfluenceDocument;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

/**
 * Command to print the plain text of a document.
 */
@Command(
    name = "text",
    description = "Print the plain text of a storage-format document",
    mixinStandardHelpOptions = true
)
public class TextCommand extends AbstractParseCommand {

    @Override
    protected int run(ConfluenceDocument document, PrintWriter out) {
        out.println(document.text());
        return EXIT_OK;
    }
}
