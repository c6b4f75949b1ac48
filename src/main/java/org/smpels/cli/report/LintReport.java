package org.smpels.cli.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.smpels.mcs.diagnostics.Diagnostic;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * The result of linting a set of files. Only errors and warnings are reported;
 * files without findings are counted but not listed.
 *
 * @param summary The totals.
 * @param files   The files with findings, in the order they were checked.
 */
public record LintReport(Summary summary, List<FileReport> files) {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param totalFiles      The number of files checked.
     * @param filesWithIssues The number of files with at least one error or warning.
     * @param totalErrors     The number of errors, unreadable files included.
     * @param totalWarnings   The number of warnings.
     * @param success         Whether the run passes.
     */
    public record Summary(
            @JsonProperty("total_files") int totalFiles,
            @JsonProperty("files_with_issues") int filesWithIssues,
            @JsonProperty("total_errors") int totalErrors,
            @JsonProperty("total_warnings") int totalWarnings,
            @JsonProperty("success") boolean success
    ) {}

    /**
     * @param path        The file as given on the command line.
     * @param status      {@code success}, {@code warning} or {@code failure}.
     * @param diagnostics The findings.
     */
    public record FileReport(
            @JsonProperty("path") String path,
            @JsonProperty("status") String status,
            @JsonProperty("diagnostics") List<Item> diagnostics
    ) {}

    /**
     * @param line     The 1-based line.
     * @param column   The 1-based column.
     * @param severity {@code ERROR} or {@code WARNING}.
     * @param code     The rule code.
     * @param message  The message.
     */
    public record Item(
            @JsonProperty("line") int line,
            @JsonProperty("column") int column,
            @JsonProperty("severity") String severity,
            @JsonProperty("code") String code,
            @JsonProperty("message") String message
    ) {}

    /**
     * Serializes the report as indented JSON.
     * @return The JSON text.
     * @throws JsonProcessingException if serialization fails.
     */
    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    /**
     * Writes the report as Markdown.
     * @param out The target.
     */
    public void printMarkdown(PrintWriter out) {
        if (!files.isEmpty()) {
            out.println("# SMP/E Lint Report");
            out.println();
            for (FileReport file : files) {
                out.printf("## File: `%s`%n", file.path());
                for (Item item : file.diagnostics()) {
                    String icon = "ERROR".equals(item.severity()) ? "🔴" : "⚠️";
                    out.printf("- %s **%s** `%s` (Line %d, Col %d): %s%n",
                            icon, item.severity(), item.code(), item.line(), item.column(), item.message());
                }
                out.println();
            }
        }
        out.println("## Summary");
        out.printf("- **Files checked**: %d%n", summary.totalFiles());
        if (summary.success()) {
            out.println("- **Result**: ✅ SUCCESS");
        } else {
            out.printf("- **Files with issues**: %d%n", summary.filesWithIssues());
            out.printf("- **Total Errors**: %d%n", summary.totalErrors());
            out.printf("- **Total Warnings**: %d%n", summary.totalWarnings());
            out.println("- **Result**: 🔴 FAILURE");
        }
        out.flush();
    }

    /**
     * Collects per-file results into a {@link LintReport}.
     */
    public static final class Builder {
        private final boolean warningsAsErrors;
        private final List<FileReport> files = new ArrayList<>();
        private int totalFiles;
        private int errors;
        private int warnings;
        private boolean failed;

        /**
         * @param warningsAsErrors Whether warnings fail the run.
         */
        public Builder(boolean warningsAsErrors) {
            this.warningsAsErrors = warningsAsErrors;
        }

        /**
         * Adds the findings of one file; hints and informational findings are dropped.
         * @param path        The file as given on the command line.
         * @param diagnostics The findings.
         * @return This builder.
         */
        public Builder addFile(String path, List<Diagnostic> diagnostics) {
            totalFiles++;
            List<Item> items = new ArrayList<>();
            String status = "success";
            for (Diagnostic diagnostic : diagnostics) {
                if (diagnostic.type() == Diagnostic.Type.ERROR) {
                    errors++;
                    failed = true;
                    status = "failure";
                } else if (diagnostic.type() == Diagnostic.Type.WARNING) {
                    warnings++;
                    failed |= warningsAsErrors;
                    if ("success".equals(status)) {
                        status = "warning";
                    }
                } else {
                    continue;
                }
                items.add(new Item(diagnostic.range().startLine() + 1, diagnostic.range().startCharacter() + 1,
                        diagnostic.type().name(), diagnostic.code().key(), diagnostic.message()));
            }
            if (!items.isEmpty()) {
                files.add(new FileReport(path, status, items));
            }
            return this;
        }

        /**
         * Counts a file that could not be read as a failed file with one error.
         * @param path The file as given on the command line.
         * @return This builder.
         */
        public Builder addUnreadable(String path) {
            totalFiles++;
            errors++;
            failed = true;
            return this;
        }

        /**
         * @return The report.
         */
        public LintReport build() {
            return new LintReport(new Summary(totalFiles, files.size(), errors, warnings, !failed), List.copyOf(files));
        }
    }
}
