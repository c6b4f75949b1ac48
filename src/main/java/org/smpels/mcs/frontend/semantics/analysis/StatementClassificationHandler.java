package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.schema.StatementKind;

/**
 * Reports statement names that are not in the catalog, telling a bad language suffix apart from an unknown name.
 */
public class StatementClassificationHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, Document document, DiagnosticsEngine diagnostics) {
        if (!(node instanceof StatementNode statement) || statement.isRecognized()) {
            return;
        }
        if (statement.kind() == StatementKind.INVALID_LANGUAGE_ID) {
            diagnostics.reportError(DiagnosticCode.INVALID_LANGUAGE_ID,
                    "Invalid language identifier '" + statement.languageId() + "' for statement " + baseName(statement),
                    statement.position());
        } else if (statement.hasLanguageId()) {
            diagnostics.reportError(DiagnosticCode.UNKNOWN_STATEMENT,
                    "Unknown statement type: " + baseName(statement) + " (with language ID " + statement.languageId() + ")",
                    statement.position());
        } else {
            diagnostics.reportError(DiagnosticCode.UNKNOWN_STATEMENT,
                    "Unknown statement type: " + statement.name(), statement.position());
        }
    }

    private static String baseName(StatementNode statement) {
        String name = statement.name();
        return name.substring(0, name.length() - statement.languageId().length());
    }
}
