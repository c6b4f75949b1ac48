package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.schema.OperandDefinition;

import java.util.Optional;

/**
 * Applies the {@link RequiredOperandTable}. Members of a required group are left to the group rule.
 */
public class RequiredOperandHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, Document document, DiagnosticsEngine diagnostics) {
        if (!(node instanceof StatementNode statement) || !statement.isRecognized()) {
            return;
        }
        for (String required : RequiredOperandTable.requiredOperands(statement.definition().name())) {
            Optional<OperandDefinition> definition = statement.definition().findOperand(required);
            if (definition.isPresent() && definition.get().requiredGroup()) {
                continue;
            }
            boolean present = definition
                    .map(def -> OperandPolicyHandler.isPresent(statement, def))
                    .orElseGet(() -> statement.hasOperand(required));
            if (!present) {
                diagnostics.reportWarning(DiagnosticCode.MISSING_REQUIRED_OPERAND,
                        "Missing required operand: " + required, statement.position());
            }
        }
    }
}
