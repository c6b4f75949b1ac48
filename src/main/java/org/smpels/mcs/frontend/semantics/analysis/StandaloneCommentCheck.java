package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.api.SourceRange;
import org.smpels.mcs.diagnostics.Diagnostic;
import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.CommentNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.StatementNode;

import java.util.List;

/**
 * SMP/E accepts comments inside a statement and after its terminator on the same line,
 * but rejects a comment that opens on a line of its own outside any statement.
 * Comments inside inline data never reach the document, so they are exempt.
 */
public class StandaloneCommentCheck implements IDocumentCheck {

    @Override
    public void check(Document document, DiagnosticsEngine diagnostics) {
        List<StatementNode> statements = document.statements();
        int firstStatementLine = statements.isEmpty() ? Integer.MAX_VALUE : statements.get(0).startLine();
        for (CommentNode comment : document.comments()) {
            int line = comment.position().line();
            int character = comment.position().character();
            String text = document.lines().get(line);
            if (insideStatement(statements, line) || !text.substring(0, character).isBlank()) {
                continue;
            }
            String message = line < firstStatementLine
                    ? "Comment not allowed before first MCS statement - SMP/E syntax error"
                    : "Comment not allowed between MCS statements - SMP/E syntax error";
            diagnostics.report(Diagnostic.Type.ERROR, DiagnosticCode.STANDALONE_COMMENT, message,
                    new SourceRange(line, character, line, text.length()));
        }
    }

    private static boolean insideStatement(List<StatementNode> statements, int line) {
        for (StatementNode statement : statements) {
            if (line >= statement.startLine() && line <= statement.endLine()) {
                return true;
            }
        }
        return false;
    }
}
