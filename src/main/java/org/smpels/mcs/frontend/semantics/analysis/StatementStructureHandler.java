package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.ParameterNode;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.schema.StatementDefinition;

/**
 * Checks parenthesis balance, the terminator and the statement's own parameter.
 * An imbalance hides the findings it usually causes: a missing terminator and an unterminated parameter.
 */
public class StatementStructureHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, Document document, DiagnosticsEngine diagnostics) {
        if (!(node instanceof StatementNode statement) || !statement.isRecognized()) {
            return;
        }
        int balance = statement.unbalancedParens();
        if (balance > 0) {
            diagnostics.reportError(DiagnosticCode.UNBALANCED_PARENTHESES,
                    "Missing closing parenthesis ')'", statement.position());
        } else if (balance < 0) {
            diagnostics.reportError(DiagnosticCode.UNBALANCED_PARENTHESES,
                    "Missing opening parenthesis '(' or extra closing parenthesis ')'", statement.position());
        }

        if (balance == 0 && !statement.hasTerminator()) {
            diagnostics.reportError(DiagnosticCode.MISSING_TERMINATOR,
                    "Statement must be terminated with '.'", statement.position());
        }

        checkParameter(statement, diagnostics);
    }

    private void checkParameter(StatementNode statement, DiagnosticsEngine diagnostics) {
        StatementDefinition definition = statement.definition();
        if (!definition.hasParameter()) {
            return;
        }
        ParameterNode parameter = statement.parameter();
        if (parameter == null || parameter.isBlank()) {
            diagnostics.reportError(DiagnosticCode.MISSING_PARAMETER,
                    "Missing required parameter: " + definition.parameter(), statement.position());
            return;
        }
        if (!parameter.terminated()) {
            boolean explainedByBalance = statement.unbalancedParens() != 0
                    && diagnostics.isEnabled(DiagnosticCode.UNBALANCED_PARENTHESES);
            if (!explainedByBalance) {
                diagnostics.reportError(DiagnosticCode.MALFORMED_PARAMETER,
                        "Malformed parameter for " + statement.name() + ": missing closing parenthesis ')'",
                        parameter.position());
            }
            return;
        }
        String value = parameter.unquotedValue();
        int max = definition.maxParameterLength();
        if (max > 0 && value.length() > max) {
            diagnostics.reportWarning(DiagnosticCode.PARAMETER_LENGTH,
                    String.format("Parameter '%s' exceeds maximum length (%d > %d)",
                            definition.parameter(), value.length(), max),
                    parameter.position());
        }
    }
}
