package com.confluenceparser.cli;

import com.confluenceparser.ConfluenceParserCLI;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the parse subcommands: {@link TextCommand}, {@link InspectCommand},
 * {@link FindCommand} and {@link ValidateCommand}.
 */
class ParseCommandsTest {

    private static final String VALID_PAGE = """
        <h1>Overview</h1>
        <p>Read <a href="https://example.com">the docs</a> first.</p>
        <ac:structured-macro ac:name="code">
          <ac:plain-text-body><![CDATA[mvn test]]></ac:plain-text-body>
        </ac:structured-macro>
        """;

    private static final String PAGE_WITH_UNKNOWN = """
        <p>Before <custom-tag>inside</custom-tag> after</p>
        """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Path validFile;
    private Path unknownFile;

    @BeforeEach
    void setUp() throws IOException {
        validFile = tempDir.resolve("valid.xml");
        unknownFile = tempDir.resolve("unknown.xml");
        Files.writeString(validFile, VALID_PAGE);
        Files.writeString(unknownFile, PAGE_WITH_UNKNOWN);
    }

    private int execute(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = ConfluenceParserCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Nested
    class Text {

        @Test
        void text_printsExtractedText() {
            int exitCode = execute("text", validFile.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString().strip()).isEqualTo("Overview\n\nRead the docs first.\n\nmvn test");
        }

        @Test
        void text_unknownElement_isLenientByDefault() {
            int exitCode = execute("text", unknownFile.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString().strip()).isEqualTo("Before inside after");
        }

        @Test
        void text_strict_failsOnDiagnostics() {
            int exitCode = execute("text", "--strict", unknownFile.toString());

            assertThat(exitCode).isEqualTo(AbstractParseCommand.EXIT_DIAGNOSTICS);
            assertThat(err.toString()).contains("1 diagnostic(s) recorded while parsing: unknown_element:custom-tag");
            assertThat(out.toString()).isEmpty();
        }

        @Test
        void text_strictConfigFile_failsOnDiagnostics() throws IOException {
            Path config = tempDir.resolve("confluence-parser.yaml");
            Files.writeString(config, """
                parser:
                  strictOnDiagnostics: true
                """);

            assertThat(execute("text", "-c", config.toString(), unknownFile.toString()))
                .isEqualTo(AbstractParseCommand.EXIT_DIAGNOSTICS);
        }

        @Test
        void text_missingFile_returnsError() {
            int exitCode = execute("text", tempDir.resolve("missing.xml").toString());

            assertThat(exitCode).isEqualTo(AbstractParseCommand.EXIT_ERROR);
        }
    }

    @Nested
    class Inspect {

        @Test
        void inspect_printsCountsAndDiagnostics() {
            int exitCode = execute("inspect", unknownFile.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString())
                .contains("Root: PARAGRAPH")
                .contains("Nodes: 5")
                .contains("Diagnostics: 1")
                .contains("unknown_element:custom-tag");
        }

        @Test
        void inspect_json_printsReport() throws IOException {
            int exitCode = execute("inspect", "--json", validFile.toString());

            JsonNode report = new ObjectMapper().readTree(out.toString());
            assertThat(exitCode).isZero();
            assertThat(report.get("rootKind").asText()).isEqualTo("FRAGMENT");
            assertThat(report.get("kinds").get("HEADING").asInt()).isEqualTo(1);
            assertThat(report.get("kinds").get("LINK").asInt()).isEqualTo(1);
            assertThat(report.get("kinds").get("CODE").asInt()).isEqualTo(1);
            assertThat(report.get("diagnostics")).isEmpty();
        }
    }

    @Nested
    class Find {

        @Test
        void find_printsMatchingNodes() {
            int exitCode = execute("find", validFile.toString(), "--kind", "link", "--kind", "CODE");

            assertThat(exitCode).isZero();
            assertThat(out.toString())
                .contains("[LINK] the docs")
                .contains("[CODE] mvn test")
                .contains("2 match(es)");
        }

        @Test
        void find_withoutKind_returnsUsageError() {
            assertThat(execute("find", validFile.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        }
    }

    @Nested
    class Validate {

        @Test
        void validate_cleanFile_reportsOk() {
            int exitCode = execute("validate", validFile.toString());

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("OK: " + validFile + " has no diagnostics");
        }

        @Test
        void validate_fileWithDiagnostics_listsThem() {
            int exitCode = execute("validate", unknownFile.toString());

            assertThat(exitCode).isEqualTo(AbstractParseCommand.EXIT_DIAGNOSTICS);
            assertThat(out.toString())
                .contains("INVALID: " + unknownFile + " has 1 diagnostic(s)")
                .contains("  unknown_element:custom-tag");
        }
    }
}
