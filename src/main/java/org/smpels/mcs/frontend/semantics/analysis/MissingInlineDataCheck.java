package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.schema.DataSourceOperands;
import org.smpels.mcs.schema.OperandDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about statements that expect inline data when nothing but blanks and comments follows them.
 */
public class MissingInlineDataCheck implements IDocumentCheck {

    @Override
    public void check(Document document, DiagnosticsEngine diagnostics) {
        List<StatementNode> statements = document.statements();
        for (int i = 0; i < statements.size(); i++) {
            StatementNode statement = statements.get(i);
            if (!statement.expectsInlineData() || statement.hasInlineData()) {
                continue;
            }
            boolean last = i == statements.size() - 1;
            diagnostics.reportWarning(DiagnosticCode.MISSING_INLINE_DATA, message(statement, last), statement.position());
        }
    }

    private static String message(StatementNode statement, boolean last) {
        StringBuilder message = new StringBuilder(statement.name()).append(" expects inline data but none found");
        if (!last) {
            message.append(" before next statement");
        }
        List<String> alternatives = new ArrayList<>();
        for (OperandDefinition operand : statement.definition().operands()) {
            if (DataSourceOperands.EXTERNAL_SOURCES.contains(operand.primaryName())) {
                alternatives.add(operand.primaryName());
            }
        }
        if (!alternatives.isEmpty()) {
            message.append(" (or specify one of ").append(String.join(", ", alternatives)).append(")");
        }
        return message.toString();
    }
}
