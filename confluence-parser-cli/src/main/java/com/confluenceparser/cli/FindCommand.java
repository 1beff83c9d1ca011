package com.confluenceparser.cli;

import com.confluenceparser.core.document.ConfluenceDocument;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.NodeKind;
import com.confluenceparser.core.render.TextRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.List;

/**
 * Command to print the nodes of the requested kinds, one per line, in document order.
 */
@Command(
    name = "find",
    description = "Print the text of every node of the given kinds",
    mixinStandardHelpOptions = true
)
public class FindCommand extends AbstractParseCommand {

    @Option(names = {"-k", "--kind"}, required = true, arity = "1..*",
        description = "Node kinds to find: ${COMPLETION-CANDIDATES}")
    private List<NodeKind> kinds;

    @Override
    protected int run(ConfluenceDocument document, PrintWriter out) {
        int matches = 0;
        for (Node node : document.walk()) {
            if (kinds.contains(node.kind())) {
                out.println("[" + node.kind() + "] " + TextRenderer.flatten(node.toText()));
                matches++;
            }
        }
        out.println(matches + " match(es)");
        return EXIT_OK;
    }
}
