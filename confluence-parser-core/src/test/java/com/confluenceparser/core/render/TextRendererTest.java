package com.confluenceparser.core.render;

import com.confluenceparser.core.node.AnchorMacro;
import com.confluenceparser.core.node.AttachmentsMacro;
import com.confluenceparser.core.node.CodeMacro;
import com.confluenceparser.core.node.DecisionList;
import com.confluenceparser.core.node.DecisionListItem;
import com.confluenceparser.core.node.DecisionState;
import com.confluenceparser.core.node.DetailsMacro;
import com.confluenceparser.core.node.Emoticon;
import com.confluenceparser.core.node.ExcerptIncludeMacro;
import com.confluenceparser.core.node.ExcerptMacro;
import com.confluenceparser.core.node.ExpandMacro;
import com.confluenceparser.core.node.Fragment;
import com.confluenceparser.core.node.HeadingElement;
import com.confluenceparser.core.node.Image;
import com.confluenceparser.core.node.IncludeMacro;
import com.confluenceparser.core.node.JiraMacro;
import com.confluenceparser.core.node.LinkElement;
import com.confluenceparser.core.node.LinkType;
import com.confluenceparser.core.node.ListElement;
import com.confluenceparser.core.node.ListItem;
import com.confluenceparser.core.node.ListType;
import com.confluenceparser.core.node.Node;
import com.confluenceparser.core.node.PanelMacro;
import com.confluenceparser.core.node.PanelType;
import com.confluenceparser.core.node.PlaceholderElement;
import com.confluenceparser.core.node.ProfileMacro;
import com.confluenceparser.core.node.ResourceIdentifier;
import com.confluenceparser.core.node.StatusMacro;
import com.confluenceparser.core.node.Table;
import com.confluenceparser.core.node.TableCell;
import com.confluenceparser.core.node.TableRow;
import com.confluenceparser.core.node.TaskStatus;
import com.confluenceparser.core.node.TasksReportMacro;
import com.confluenceparser.core.node.Text;
import com.confluenceparser.core.node.TextBreakElement;
import com.confluenceparser.core.node.TextEffect;
import com.confluenceparser.core.node.TextEffectElement;
import com.confluenceparser.core.node.Time;
import com.confluenceparser.core.node.TocMacro;
import com.confluenceparser.core.node.UnknownMacroElement;
import com.confluenceparser.core.node.ViewFileMacro;
import com.confluenceparser.core.node.ViewPdfMacro;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TextRenderer}.
 */
class TextRendererTest {

    private static Node paragraph(String text) {
        return TextBreakElement.paragraph(List.of(new Text(text)));
    }

    private static TableCell cell(String text) {
        return new TableCell(false, null, null, List.of(new Text(text)));
    }

    @Nested
    class Containers {

        @Test
        void join_inlineChildren_concatenatesWithoutSeparators() {
            Node p = TextBreakElement.paragraph(List.of(
                new Text("Hello "),
                new TextEffectElement(TextEffect.STRONG, List.of(new Text("World"))),
                new Text("!")
            ));

            assertThat(p.toText()).isEqualTo("Hello World!");
        }

        @Test
        void join_blockChildren_separatesWithBlankLine() {
            Node fragment = new Fragment(List.of(
                new HeadingElement(1, List.of(new Text("Title"))),
                paragraph("  Body text  ")
            ));

            assertThat(fragment.toText()).isEqualTo("Title\n\nBody text");
        }

        @Test
        void join_inlineAfterBlock_startsNewBlock() {
            Node fragment = new Fragment(List.of(paragraph("First"), new Text(" trailing")));

            assertThat(fragment.toText()).isEqualTo("First\n\ntrailing");
        }

        @Test
        void lineBreak_rendersSingleNewline() {
            Node p = TextBreakElement.paragraph(List.of(
                new Text("Line one"), TextBreakElement.lineBreak(), new Text("Line two")));

            assertThat(p.toText()).isEqualTo("Line one\nLine two");
        }

        @Test
        void horizontalRule_contributesNoText() {
            Node fragment = new Fragment(List.of(
                paragraph("A"), TextBreakElement.horizontalRule(), paragraph("B")));

            assertThat(TextBreakElement.horizontalRule().toText()).isEmpty();
            assertThat(fragment.toText()).isEqualTo("A\n\nB");
        }

        @Test
        void emptyParagraph_rendersEmpty() {
            assertThat(TextBreakElement.paragraph(List.of()).toText()).isEmpty();
        }
    }

    @Nested
    class Lists {

        @Test
        void unorderedList_prefixesBullets() {
            Node list = new ListElement(ListType.UNORDERED, null, List.of(
                ListItem.of(List.of(new Text("One"))),
                ListItem.of(List.of(new Text("Two")))
            ));

            assertThat(list.toText()).isEqualTo("• One\n• Two");
        }

        @Test
        void orderedList_numbersFromStart() {
            Node list = new ListElement(ListType.ORDERED, 3, List.of(
                ListItem.of(List.of(new Text("Item three"))),
                ListItem.of(List.of(new Text("Item four")))
            ));

            assertThat(list.toText()).isEqualTo("3. Item three\n4. Item four");
        }

        @Test
        void orderedList_withoutStart_numbersFromOne() {
            Node list = new ListElement(ListType.ORDERED, null, List.of(
                ListItem.of(List.of(new Text("Item one")))));

            assertThat(list.toText()).isEqualTo("1. Item one");
        }

        @Test
        void orderedList_atIntegerLimit_keepsCounting() {
            Node list = new ListElement(ListType.ORDERED, Integer.MAX_VALUE, List.of(
                ListItem.of(List.of(new Text("last"))),
                ListItem.of(List.of(new Text("beyond")))));

            assertThat(list.toText()).isEqualTo("2147483647. last\n2147483648. beyond");
        }

        @Test
        void taskList_marksCompletion() {
            Node list = new ListElement(ListType.TASK, null, List.of(
                new ListItem("1", null, null, TaskStatus.COMPLETE, List.of(new Text("Complete task"))),
                new ListItem("2", null, null, TaskStatus.INCOMPLETE, List.of(new Text("Incomplete task"))),
                new ListItem("3", null, null, null, List.of(new Text("Unknown task")))
            ));

            assertThat(list.toText()).isEqualTo("✓ Complete task\n○ Incomplete task\n○ Unknown task");
        }

        @Test
        void nestedList_indentsUnderParentItem() {
            Node nested = new ListElement(ListType.UNORDERED, null, List.of(
                ListItem.of(List.of(new Text("Child")))));
            Node list = new ListElement(ListType.UNORDERED, null, List.of(
                ListItem.of(List.of(new Text("Parent"), nested)),
                ListItem.of(List.of(new Text("Sibling")))
            ));

            assertThat(list.toText()).isEqualTo("• Parent\n  • Child\n• Sibling");
        }

        @Test
        void decisionList_rendersStateIcons() {
            Node list = new DecisionList("d1", List.of(
                new DecisionListItem("i1", DecisionState.DECIDED, List.of(new Text("Use Java"))),
                new DecisionListItem("i2", DecisionState.PENDING, List.of(new Text("Pick a name")))
            ));

            assertThat(list.toText()).isEqualTo("✅ Use Java\n⏳ Pick a name");
        }

        @Test
        void decisionItem_withoutStateOrText_rendersPendingIcon() {
            assertThat(new DecisionListItem(null, null, List.of()).toText()).isEqualTo("⏳");
            assertThat(new DecisionListItem(null, DecisionState.DECIDED, List.of()).toText()).isEqualTo("✅");
        }

        @Test
        void emptyDecisionList_rendersLabel() {
            assertThat(new DecisionList(null, List.of()).toText()).isEqualTo("📋 Decision List");
        }
    }

    @Nested
    class Tables {

        @Test
        void table_joinsCellsWithPipesAndRowsWithNewlines() {
            Node table = new Table(null, null, null, null, List.of(
                new TableRow(List.of(
                    new TableCell(true, null, null, List.of(new Text("Name"))),
                    new TableCell(true, null, null, List.of(new Text("Age"))))),
                new TableRow(List.of(cell("Alice"), cell("30")))
            ));

            assertThat(table.toText()).isEqualTo("Name | Age\nAlice | 30");
        }

        @Test
        void tableCell_withBlocks_isFlattenedToOneLine() {
            Node row = new TableRow(List.of(
                new TableCell(false, null, null, List.of(paragraph("First"), paragraph("Second"))),
                cell("Other")
            ));

            assertThat(row.toText()).isEqualTo("First Second | Other");
        }

        @Test
        void emptyCells_keepTheirPosition() {
            Node row = new TableRow(List.of(cell("A"), new TableCell(false, null, null, List.of()), cell("C")));

            assertThat(row.toText()).isEqualTo("A |  | C");
        }

        @Test
        void emptyTable_rendersEmpty() {
            assertThat(new Table(null, null, null, null, List.of()).toText()).isEmpty();
            assertThat(new TableRow(List.of()).toText()).isEmpty();
        }
    }

    @Nested
    class Links {

        @Test
        void pageLink_combinesResourceAndBody() {
            Node link = new LinkElement(LinkType.PAGE, null, null, null, List.of(
                ResourceIdentifier.page("DOC", "Target", null),
                new Text("Link Text")
            ));

            assertThat(link.toText()).isEqualTo("📄 Page Link Text");
        }

        @Test
        void externalLink_rendersBody() {
            Node link = new LinkElement(LinkType.EXTERNAL, "https://example.com", null, null,
                List.of(new Text("Example")));

            assertThat(link.toText()).isEqualTo("Example");
        }

        @Test
        void emptyLink_fallsBackToHref() {
            assertThat(new LinkElement(LinkType.EXTERNAL, "https://example.com", null, null, List.of()).toText())
                .isEqualTo("https://example.com");
            assertThat(new LinkElement(LinkType.PAGE, null, null, null, List.of(new Text("  "))).toText())
                .isEmpty();
        }

        @Test
        void resourceIdentifiers_renderByType() {
            assertThat(ResourceIdentifier.page("DOC", "Title", null).toText()).isEqualTo("📄 Page");
            assertThat(ResourceIdentifier.blogPost("DOC", "News", "2024/01/15").toText()).isEqualTo("📝 Blog: 2024/01/15");
            assertThat(ResourceIdentifier.blogPost("DOC", "News", null).toText()).isEqualTo("📝 Blog");
            assertThat(ResourceIdentifier.attachment("file.pdf", null, null).toText()).isEqualTo("📎 Attachment: file.pdf");
            assertThat(ResourceIdentifier.url("https://x.io").toText()).isEqualTo("🔗 URL: https://x.io");
            assertThat(ResourceIdentifier.user("acc-1", null, null).toText()).isEqualTo("👤 User: acc-1");
            assertThat(ResourceIdentifier.user(null, "key-1", null).toText()).isEqualTo("👤 User: key-1");
            assertThat(ResourceIdentifier.user(null, null, null).toText()).isEqualTo("👤 User");
            assertThat(ResourceIdentifier.space("DOC").toText()).isEqualTo("🏠 Space: DOC");
            assertThat(ResourceIdentifier.shortcut("jira", "PROJ-1").toText()).isEqualTo("🔗 Shortcut: jira@PROJ-1");
            assertThat(ResourceIdentifier.contentEntity("123").toText()).isEqualTo("📄 Content: 123");
            assertThat(ResourceIdentifier.contentEntity(null).toText()).isEqualTo("📄 Content");
        }

        @Test
        void image_prefersAltThenFilename() {
            Image withAlt = new Image(null, "diagram.png", "Diagram", null, null, null, null, null, List.of());
            Image withFile = new Image(null, "diagram.png", null, null, null, null, null, null, List.of());
            Image unknown = new Image(null, null, null, null, null, null, null, null, List.of());
            Image captioned = new Image(null, "a.png", null, null, null, null, null, null,
                List.of(new Text("Figure 1")));

            assertThat(withAlt.toText()).isEqualTo("🖼️ Image: Diagram");
            assertThat(withFile.toText()).isEqualTo("🖼️ Image: diagram.png");
            assertThat(unknown.toText()).isEqualTo("🖼️ Image: Unknown");
            assertThat(captioned.toText()).isEqualTo("🖼️ Image: a.png (Figure 1)");
        }
    }

    @Nested
    class Leaves {

        @Test
        void emoticon_prefersFallbackThenShortnameThenName() {
            assertThat(new Emoticon("smile", ":smile:", null, "🙂").toText()).isEqualTo("🙂");
            assertThat(new Emoticon("smile", ":smile:", null, null).toText()).isEqualTo(":smile:");
            assertThat(new Emoticon("smile", null, null, null).toText()).isEqualTo(":smile:");
            assertThat(new Emoticon(null, null, null, null).toText()).isEmpty();
        }

        @Test
        void time_rendersDateOrLabel() {
            assertThat(new Time("2024-01-15").toText()).isEqualTo("📅 2024-01-15");
            assertThat(new Time(null).toText()).isEqualTo("📅 Date");
        }

        @Test
        void placeholder_includesInstruction() {
            assertThat(new PlaceholderElement(null, "Type here").toText()).isEqualTo("Placeholder: Type here");
            assertThat(new PlaceholderElement(null, null).toText()).isEqualTo("Placeholder");
        }
    }

    @Nested
    class Macros {

        @Test
        void panel_prefixesLabelAndFlattensBody() {
            Node panel = PanelMacro.of(PanelType.INFO, List.of(paragraph("Important"), paragraph("information")));

            assertThat(panel.toText()).isEqualTo("ℹ️ INFO: Important information");
        }

        @Test
        void panel_labelsPerType() {
            assertThat(PanelMacro.of(PanelType.NOTE, List.of(paragraph("x"))).toText()).isEqualTo("📝 NOTE: x");
            assertThat(PanelMacro.of(PanelType.SUCCESS, List.of(paragraph("x"))).toText()).isEqualTo("✅ SUCCESS: x");
            assertThat(PanelMacro.of(PanelType.WARNING, List.of(paragraph("x"))).toText()).isEqualTo("⚠️ WARNING: x");
            assertThat(PanelMacro.of(PanelType.ERROR, List.of(paragraph("x"))).toText()).isEqualTo("❌ ERROR: x");
            assertThat(PanelMacro.of(PanelType.PANEL, List.of(paragraph("x"))).toText()).isEqualTo("📋 PANEL: x");
        }

        @Test
        void emptyPanel_rendersLabelOnly() {
            assertThat(PanelMacro.of(PanelType.PANEL, List.of()).toText()).isEqualTo("📋 PANEL");
        }

        @Test
        void panel_withIconText_usesIconAsLabel() {
            Node panel = new PanelMacro("panel", PanelType.PANEL, null, null, null, null, null, null,
                ":rocket:", null, "🚀", List.of(paragraph("Launch")));

            assertThat(panel.toText()).isEqualTo("🚀 Launch");
        }

        @Test
        void code_rendersRawCode() {
            String code = "def hello():\n    print(\"hi\")";

            assertThat(CodeMacro.of("python", code).toText()).isEqualTo(code);
        }

        @Test
        void status_rendersTitleAndColour() {
            assertThat(new StatusMacro("Done", "Green", false).toText()).isEqualTo("🏷️ Status: Done (Green)");
            assertThat(new StatusMacro(null, "Red", false).toText()).isEqualTo("🏷️ Status: Status (Red)");
            assertThat(new StatusMacro("Open", null, false).toText()).isEqualTo("🏷️ Status: Open");
        }

        @Test
        void expandAndDetails_renderBodyOnly() {
            assertThat(new ExpandMacro("Click me", null, List.of(paragraph("Hidden"))).toText()).isEqualTo("Hidden");
            assertThat(new DetailsMacro("Properties", "props", false, List.of(paragraph("Owner"))).toText()).isEqualTo("Owner");
        }

        @Test
        void unknownMacro_rendersBodyOnly() {
            Node macro = new UnknownMacroElement("gallery", null, Map.of("columns", "3"), List.of(new Text("Photos")));

            assertThat(macro.toText()).isEqualTo("Photos");
        }

        @Test
        void jira_omitsDefaultServer() {
            assertThat(JiraMacro.of("PROJ-123", "Custom Jira").toText()).isEqualTo("🎫 PROJ-123 (Custom Jira)");
            assertThat(JiraMacro.of("PROJ-456", "System Jira").toText()).isEqualTo("🎫 PROJ-456");
            assertThat(JiraMacro.of("PROJ-789", null).toText()).isEqualTo("🎫 PROJ-789");
            assertThat(JiraMacro.of(null, null).toText()).isEqualTo("🎫 JIRA Issue");
        }

        @Test
        void referenceMacros_renderTargetOrLabel() {
            assertThat(new IncludeMacro("My Page", null).toText()).isEqualTo("📄 Include: My Page");
            assertThat(new IncludeMacro(null, null).toText()).isEqualTo("📄 Include Page");
            assertThat(new ExcerptIncludeMacro("News", null, "2024-01-15", false).toText())
                .isEqualTo("📝 Excerpt: News (2024-01-15)");
            assertThat(new ExcerptIncludeMacro(null, null, null, false).toText()).isEqualTo("📝 Excerpt Include");
            assertThat(new TasksReportMacro("SPACE1,SPACE2", null, null, null).toText())
                .isEqualTo("📊 Tasks Report: SPACE1,SPACE2");
            assertThat(new TasksReportMacro(null, null, null, null).toText()).isEqualTo("📊 Tasks Report");
            assertThat(new AttachmentsMacro("*.pdf", null, null, false, false).toText())
                .isEqualTo("📎 Attachments: *.pdf");
            assertThat(new ViewPdfMacro("manual.pdf", null).toText()).isEqualTo("📄 PDF: manual.pdf");
            assertThat(new ViewPdfMacro(null, null).toText()).isEqualTo("📄 PDF Viewer");
            assertThat(new ViewFileMacro("deck.pptx", null, null).toText()).isEqualTo("📁 File: deck.pptx");
            assertThat(new ViewFileMacro(null, null, null).toText()).isEqualTo("📁 File Viewer");
            assertThat(new ProfileMacro("acc-1").toText()).isEqualTo("👤 Profile: acc-1");
            assertThat(new ProfileMacro(null).toText()).isEqualTo("👤 User Profile");
            assertThat(new AnchorMacro("top").toText()).isEqualTo("⚓ Anchor: top");
            assertThat(new AnchorMacro(null).toText()).isEqualTo("⚓ Anchor");
            assertThat(new TocMacro(null, null, null, null, null, false, null, true).toText())
                .isEqualTo("📑 Table of Contents");
        }

        @Test
        void excerpt_flattensBody() {
            assertThat(new ExcerptMacro(null, false, List.of(paragraph("Short"), paragraph("summary"))).toText())
                .isEqualTo("📄 Excerpt: Short summary");
            assertThat(new ExcerptMacro(null, false, List.of()).toText()).isEqualTo("📄 Excerpt");
        }
    }

    @Test
    void flatten_collapsesAllWhitespace() {
        assertThat(TextRenderer.flatten("  a\n\n b\t c  ")).isEqualTo("a b c");
    }
}
