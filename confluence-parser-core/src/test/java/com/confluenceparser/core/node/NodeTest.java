package com.confluenceparser.core.node;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Node}, {@link NodeWalk} and {@link NodeBuckets}.
 */
class NodeTest {

    private static Node sampleTree() {
        return new Fragment(List.of(
            new HeadingElement(1, List.of(new Text("Title"))),
            TextBreakElement.paragraph(List.of(
                new Text("See "),
                new LinkElement(LinkType.PAGE, null, null, null, List.of(
                    ResourceIdentifier.page("DOC", "Target", null),
                    new Text("target"))),
                new Text(".")
            )),
            CodeMacro.of("java", "int x = 1;")
        ));
    }

    @Test
    void walk_visitsNodesInPreOrder() {
        List<NodeKind> kinds = new ArrayList<>();
        for (Node node : sampleTree().walk()) {
            kinds.add(node.kind());
        }

        assertThat(kinds).containsExactly(
            NodeKind.FRAGMENT,
            NodeKind.HEADING, NodeKind.TEXT,
            NodeKind.PARAGRAPH, NodeKind.TEXT, NodeKind.LINK, NodeKind.RESOURCE_IDENTIFIER,
            NodeKind.TEXT, NodeKind.TEXT,
            NodeKind.CODE
        );
    }

    @Test
    void walk_isRestartable() {
        NodeWalk walk = sampleTree().walk();

        assertThat(walk.toList()).hasSize(10);
        assertThat(walk.stream().count()).isEqualTo(10);
    }

    @Test
    void walk_deeplyNestedTree_doesNotOverflow() {
        Node node = new Text("leaf");
        for (int i = 0; i < 10_000; i++) {
            node = new ContainerElement("div", List.of(node));
        }

        assertThat(node.walk().stream().count()).isEqualTo(10_001);
    }

    @Test
    void findAll_byType_returnsMatchesInDocumentOrder() {
        List<Text> texts = sampleTree().findAll(Text.class);

        assertThat(texts).extracting(Text::text).containsExactly("Title", "See ", "target", ".");
    }

    @Test
    void findAll_byInterface_matchesAllMacros() {
        Node tree = new Fragment(List.of(
            new StatusMacro("Done", "Green", false),
            TextBreakElement.paragraph(List.of(new AnchorMacro("top")))
        ));

        assertThat(tree.findAll(MacroNode.class))
            .extracting(MacroNode::macroName)
            .containsExactly("status", "anchor");
    }

    @Test
    void findAll_withoutType_includesRoot() {
        Node tree = sampleTree();

        assertThat(tree.findAll()).first().isSameAs(tree);
    }

    @Test
    void findEach_returnsOneBucketPerType() {
        NodeBuckets buckets = sampleTree().findEach(HeadingElement.class, LinkElement.class, Table.class);

        assertThat(buckets.size()).isEqualTo(3);
        assertThat(buckets.bucket(HeadingElement.class)).singleElement()
            .extracting(HeadingElement::level).isEqualTo(1);
        assertThat(buckets.bucket(1)).hasSize(1);
        assertThat(buckets.bucket(Table.class)).isEmpty();
        assertThat(buckets.flatten()).extracting(Node::kind)
            .containsExactly(NodeKind.HEADING, NodeKind.LINK);
    }

    @Test
    void findEach_overlappingTypes_placeNodeInEachBucket() {
        NodeBuckets buckets = sampleTree().findEach(Node.class, Text.class);

        assertThat(buckets.bucket(0)).hasSize(10);
        assertThat(buckets.bucket(1)).hasSize(4);
    }

    @Test
    void bucket_unrequestedType_throws() {
        NodeBuckets buckets = sampleTree().findEach(Text.class);

        assertThatThrownBy(() -> buckets.bucket(Table.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Table");
    }

    @Test
    void children_areImmutableCopies() {
        List<Node> source = new ArrayList<>(List.of(new Text("a")));
        Node paragraph = TextBreakElement.paragraph(source);
        source.add(new Text("b"));

        assertThat(paragraph.children()).hasSize(1);
        assertThatThrownBy(() -> paragraph.children().add(new Text("c")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void records_withEqualContent_areEqual() {
        assertThat(sampleTree()).isEqualTo(sampleTree());
        assertThat(sampleTree().hashCode()).isEqualTo(sampleTree().hashCode());
    }

    @Test
    void heading_levelOutOfRange_throws() {
        assertThatThrownBy(() -> new HeadingElement(7, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HeadingElement(0, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void list_startBelowOne_throws() {
        assertThatThrownBy(() -> new ListElement(ListType.ORDERED, 0, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void breaks_differInKindAndBlockLevel() {
        assertThat(TextBreakElement.paragraph(List.of()).kind()).isEqualTo(NodeKind.PARAGRAPH);
        assertThat(TextBreakElement.lineBreak().isBlockLevel()).isFalse();
        assertThat(TextBreakElement.horizontalRule().isBlockLevel()).isTrue();
        assertThatThrownBy(() -> new TextBreakElement(BreakType.LINE_BREAK, List.of(new Text("x"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blockLevel_followsKind() {
        assertThat(new Text("x").isBlockLevel()).isFalse();
        assertThat(new StatusMacro("x", null, false).isBlockLevel()).isFalse();
        assertThat(PanelMacro.of(PanelType.INFO, List.of()).isBlockLevel()).isTrue();
        assertThat(new ListElement(ListType.UNORDERED, null, List.of()).isBlockLevel()).isTrue();
    }

    @Test
    void enums_resolveMarkupValuesIgnoringCase() {
        assertThat(TaskStatus.fromValue(" Complete ")).contains(TaskStatus.COMPLETE);
        assertThat(TaskStatus.fromValue("done")).isEmpty();
        assertThat(TaskStatus.fromValue(null)).isEmpty();
        assertThat(ResourceType.fromTagName("blog-post")).contains(ResourceType.BLOG_POST);
        assertThat(ResourceType.fromTagName("unknown")).isEmpty();
    }
}
