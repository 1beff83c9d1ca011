package com.confluenceparser.core.document;

import com.confluenceparser.core.diagnostics.Diagnostic;
import com.confluenceparser.core.node.Fragment;
import com.confluenceparser.core.node.HeadingElement;
import com.confluenceparser.core.node.LinkElement;
import com.confluenceparser.core.node.LinkType;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.NodeBuckets;
import com.confluenceparser.core.node.Text;
import com.confluenceparser.core.node.TextBreakElement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfluenceDocument}.
 */
class ConfluenceDocumentTest {

    private static Node sampleRoot() {
        return new Fragment(List.of(
            new HeadingElement(2, List.of(new Text("Links"))),
            TextBreakElement.paragraph(List.of(
                new LinkElement(LinkType.EXTERNAL, "https://example.com", null, null, List.of(new Text("Example")))
            ))
        ));
    }

    @Test
    void queries_delegateToRoot() {
        ConfluenceDocument document = new ConfluenceDocument(sampleRoot(), List.of());

        assertThat(document.text()).isEqualTo("Links\n\nExample");
        assertThat(document.findAll()).hasSize(6);
        assertThat(document.findAll(LinkElement.class)).singleElement()
            .extracting(LinkElement::href).isEqualTo("https://example.com");
        assertThat(document.rootNode()).isPresent();
    }

    @Test
    void findEach_collectsBucketsFromRoot() {
        ConfluenceDocument document = new ConfluenceDocument(sampleRoot(), List.of());

        NodeBuckets buckets = document.findEach(HeadingElement.class, Text.class);

        assertThat(buckets.bucket(HeadingElement.class)).hasSize(1);
        assertThat(buckets.bucket(Text.class)).extracting(Text::text).containsExactly("Links", "Example");
    }

    @Test
    void empty_answersAllQueriesWithEmptyResults() {
        ConfluenceDocument document = ConfluenceDocument.empty();
        List<Node> walked = new ArrayList<>();
        document.walk().forEach(walked::add);

        assertThat(document.root()).isNull();
        assertThat(document.rootNode()).isEmpty();
        assertThat(document.text()).isEmpty();
        assertThat(walked).isEmpty();
        assertThat(document.findAll()).isEmpty();
        assertThat(document.findAll(Text.class)).isEmpty();
        assertThat(document.findEach(Text.class).bucket(0)).isEmpty();
        assertThat(document.hasDiagnostics()).isFalse();
    }

    @Test
    void metadata_exposesFormattedDiagnostics() {
        ConfluenceDocument document = new ConfluenceDocument(null, List.of(
            Diagnostic.unknownElement("custom-tag"), Diagnostic.unknownMacro("gallery")));

        assertThat(document.hasDiagnostics()).isTrue();
        assertThat(document.diagnosticMessages())
            .containsExactly("unknown_element:custom-tag", "unknown_macro:gallery");
        assertThat(document.metadata())
            .containsEntry(ConfluenceDocument.DIAGNOSTICS_KEY, List.of("unknown_element:custom-tag", "unknown_macro:gallery"));
    }

    @Test
    void constructor_copiesDiagnostics() {
        List<Diagnostic> source = new ArrayList<>(List.of(Diagnostic.unknownElement("a")));
        ConfluenceDocument document = new ConfluenceDocument(null, source);
        source.add(Diagnostic.unknownElement("b"));

        assertThat(document.diagnostics()).hasSize(1);
        assertThat(new ConfluenceDocument(null, null).diagnostics()).isEmpty();
    }
}
