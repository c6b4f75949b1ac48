package org.smpels.mcs.api;

import org.smpels.mcs.diagnostics.Diagnostic;
import org.smpels.mcs.frontend.parser.ast.Document;

import java.util.List;

/**
 * The outcome of analyzing one MCS document: the rebuilt tree and the ordered findings.
 *
 * @param document    The document tree built from the full text.
 * @param diagnostics The findings, in the order the rules produced them.
 */
public record AnalysisResult(Document document, List<Diagnostic> diagnostics) {

    /**
     * Compact constructor that freezes the findings list.
     */
    public AnalysisResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if at least one finding has error severity.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
