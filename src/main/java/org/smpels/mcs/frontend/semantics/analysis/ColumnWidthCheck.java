package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.api.SourceRange;
import org.smpels.mcs.diagnostics.Diagnostic;
import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.Document;

import java.util.List;

/**
 * SMP/E reads MCS records up to column 72 only. Every line is checked, inline data included.
 */
public class ColumnWidthCheck implements IDocumentCheck {

    /** The last column SMP/E reads. */
    public static final int MAX_COLUMN = 72;

    @Override
    public void check(Document document, DiagnosticsEngine diagnostics) {
        List<String> lines = document.lines();
        for (int line = 0; line < lines.size(); line++) {
            String text = lines.get(line);
            if (text.length() <= MAX_COLUMN || text.substring(MAX_COLUMN).isBlank()) {
                continue;
            }
            diagnostics.report(Diagnostic.Type.ERROR, DiagnosticCode.CONTENT_BEYOND_COLUMN_72,
                    "Content beyond column 72 will be ignored by SMP/E",
                    new SourceRange(line, MAX_COLUMN, line, text.length()));
        }
    }
}
