package com.confluenceparser.cli;

import com.confluenceparser.core.document.ConfluenceDocument;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.NodeKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command to print node statistics and diagnostics of a document.
 */
@Command(
    name = "inspect",
    description = "Print node counts per kind and the diagnostics of a document",
    mixinStandardHelpOptions = true
)
public class InspectCommand extends AbstractParseCommand {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    /**
     * Statistics of one document.
     *
     * @param rootKind kind of the root node, null for an empty document
     * @param totalNodes number of nodes in the tree
     * @param kinds node count per kind, in kind order
     * @param textLength length of the extracted text
     * @param diagnostics formatted diagnostics
     */
    public record Report(
        String rootKind,
        int totalNodes,
        Map<String, Integer> kinds,
        int textLength,
        List<String> diagnostics
    ) {}

    @Override
    protected int run(ConfluenceDocument document, PrintWriter out) throws IOException {
        Report report = report(document);

        if (json) {
            out.println(JSON_MAPPER.writeValueAsString(report));
            return EXIT_OK;
        }

        out.println("Root: " + (report.rootKind() == null ? "(empty)" : report.rootKind()));
        out.println("Nodes: " + report.totalNodes());
        report.kinds().forEach((kind, count) -> out.printf("  %-20s %d%n", kind, count));
        out.println("Text length: " + report.textLength());
        out.println("Diagnostics: " + report.diagnostics().size());
        report.diagnostics().forEach(d -> out.println("  " + d));
        return EXIT_OK;
    }

    static Report report(ConfluenceDocument document) {
        Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        int total = 0;
        for (Node node : document.walk()) {
            counts.merge(node.kind(), 1, Integer::sum);
            total++;
        }

        Map<String, Integer> kinds = new LinkedHashMap<>();
        counts.forEach((kind, count) -> kinds.put(kind.name(), count));

        return new Report(
            document.rootNode().map(root -> root.kind().name()).orElse(null),
            total,
            kinds,
            document.text().length(),
            document.diagnosticMessages()
        );
    }
}
