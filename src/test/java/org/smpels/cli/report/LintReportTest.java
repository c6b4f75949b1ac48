package org.smpels.cli.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.smpels.mcs.api.SourceRange;
import org.smpels.mcs.diagnostics.Diagnostic;
import org.smpels.mcs.diagnostics.DiagnosticCode;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LintReport} summary and its JSON and Markdown renderings.
 */
public class LintReportTest {

    private static final Diagnostic ERROR = new Diagnostic(Diagnostic.Type.ERROR, DiagnosticCode.MISSING_TERMINATOR,
            "Statement must be terminated with '.'", new SourceRange(2, 0, 2, 5));
    private static final Diagnostic WARNING = new Diagnostic(Diagnostic.Type.WARNING, DiagnosticCode.UNKNOWN_OPERAND,
            "Unknown operand 'X' for statement ++PTF", new SourceRange(0, 15, 0, 16));
    private static final Diagnostic HINT = new Diagnostic(Diagnostic.Type.HINT, DiagnosticCode.DUPLICATE_OPERAND,
            "Duplicate operand 'DESC'", new SourceRange(0, 20, 0, 24));

    @Test
    @Tag("unit")
    void summarizesErrorsAndWarnings() {
        // Act
        LintReport report = new LintReport.Builder(false)
                .addFile("a.mcs", List.of(WARNING, HINT))
                .addFile("b.mcs", List.of(ERROR, WARNING))
                .addFile("c.mcs", List.of())
                .build();

        // Assert
        assertThat(report.summary()).isEqualTo(new LintReport.Summary(3, 2, 1, 2, false));
        assertThat(report.files()).extracting(LintReport.FileReport::status).containsExactly("warning", "failure");
        assertThat(report.files().get(0).diagnostics()).singleElement()
                .isEqualTo(new LintReport.Item(1, 16, "WARNING", "unknown_operand", "Unknown operand 'X' for statement ++PTF"));
    }

    @Test
    @Tag("unit")
    void warningsFailOnlyWhenRequested() {
        assertThat(new LintReport.Builder(false).addFile("a.mcs", List.of(WARNING)).build().summary().success()).isTrue();
        assertThat(new LintReport.Builder(true).addFile("a.mcs", List.of(WARNING)).build().summary().success()).isFalse();
    }

    @Test
    @Tag("unit")
    void unreadableFileCountsAsError() {
        LintReport report = new LintReport.Builder(false).addUnreadable("gone.mcs").build();

        assertThat(report.summary().totalErrors()).isEqualTo(1);
        assertThat(report.summary().success()).isFalse();
        assertThat(report.files()).isEmpty();
    }

    /**
     * Verifies the snake_case field names of the JSON document.
     */
    @Test
    @Tag("unit")
    void jsonUsesReportFieldNames() throws Exception {
        // Arrange
        LintReport report = new LintReport.Builder(false).addFile("b.mcs", List.of(ERROR)).build();

        // Act
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Assert
        assertThat(json.path("summary").path("total_files").asInt()).isEqualTo(1);
        assertThat(json.path("summary").path("files_with_issues").asInt()).isEqualTo(1);
        assertThat(json.path("summary").path("total_errors").asInt()).isEqualTo(1);
        assertThat(json.path("summary").path("total_warnings").asInt()).isZero();
        assertThat(json.path("summary").path("success").asBoolean()).isFalse();
        JsonNode item = json.path("files").get(0).path("diagnostics").get(0);
        assertThat(json.path("files").get(0).path("path").asText()).isEqualTo("b.mcs");
        assertThat(item.path("line").asInt()).isEqualTo(3);
        assertThat(item.path("column").asInt()).isEqualTo(1);
        assertThat(item.path("severity").asText()).isEqualTo("ERROR");
        assertThat(item.path("code").asText()).isEqualTo("missing_terminator");
    }

    @Test
    @Tag("unit")
    void markdownListsFindingsAndSummary() {
        // Arrange
        LintReport report = new LintReport.Builder(false).addFile("b.mcs", List.of(ERROR)).build();
        StringWriter out = new StringWriter();

        // Act
        report.printMarkdown(new PrintWriter(out));

        // Assert
        assertThat(out.toString())
                .contains("# SMP/E Lint Report")
                .contains("## File: `b.mcs`")
                .contains("**ERROR** `missing_terminator` (Line 3, Col 1): Statement must be terminated with '.'")
                .contains("- **Total Errors**: 1")
                .contains("FAILURE");
    }

    @Test
    @Tag("unit")
    void markdownForCleanRunIsSummaryOnly() {
        StringWriter out = new StringWriter();

        new LintReport.Builder(false).addFile("ok.mcs", List.of()).build().printMarkdown(new PrintWriter(out));

        assertThat(out.toString()).doesNotContain("# SMP/E Lint Report").contains("SUCCESS");
    }
}
