package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.OperandNode;
import org.smpels.mcs.frontend.parser.ast.ParameterNode;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.schema.OperandDefinition;
import org.smpels.mcs.schema.SubOperandDefinition;

import java.util.HashSet;
import java.util.Set;

/**
 * Validates every operand occurrence of a statement against the catalog:
 * unknown names, duplicates, missing or oversized parameters and the sub-operands of compound operands.
 */
public class OperandAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, Document document, DiagnosticsEngine diagnostics) {
        if (!(node instanceof StatementNode statement) || !statement.isRecognized()) {
            return;
        }
        Set<String> reportedUnknown = new HashSet<>();
        for (OperandNode operand : statement.operands()) {
            OperandDefinition definition = operand.definition();
            if (definition == null) {
                if (reportedUnknown.add(operand.name())) {
                    diagnostics.reportWarning(DiagnosticCode.UNKNOWN_OPERAND,
                            "Unknown operand '" + operand.name() + "' for statement " + statement.name(),
                            operand.position());
                }
                continue;
            }
            checkDuplicate(statement, operand, document, diagnostics);
            checkParameter(operand, definition, diagnostics);
            if (definition.declaresNestedValues() && !operand.subOperands().isEmpty()) {
                checkSubOperands(operand, diagnostics);
            }
        }
    }

    private void checkDuplicate(StatementNode statement, OperandNode operand, Document document,
                                DiagnosticsEngine diagnostics) {
        OperandNode first = document.firstOperand(statement, operand.name()).orElse(operand);
        if (first == operand) {
            return;
        }
        String message = "Duplicate operand '" + operand.name() + "'";
        if (first.position().line() != operand.position().line()) {
            message += " (first occurrence at line " + (first.position().line() + 1) + ")";
        }
        diagnostics.reportHint(DiagnosticCode.DUPLICATE_OPERAND, message, operand.position());
    }

    private void checkParameter(OperandNode operand, OperandDefinition definition, DiagnosticsEngine diagnostics) {
        if (definition.hasParameter() && !operand.hasValue()) {
            diagnostics.reportError(DiagnosticCode.EMPTY_OPERAND_PARAMETER,
                    "Operand '" + operand.name() + "' requires a parameter: " + definition.parameterHint(),
                    operand.position());
            return;
        }
        ParameterNode parameter = operand.parameter();
        if (parameter == null || definition.maxLength() <= 0) {
            return;
        }
        String value = parameter.unquotedValue();
        if (value.length() > definition.maxLength()) {
            diagnostics.reportWarning(DiagnosticCode.OPERAND_PARAMETER_LENGTH,
                    String.format("Operand '%s' parameter exceeds maximum length (%d > %d)",
                            operand.name(), value.length(), definition.maxLength()),
                    parameter.position());
        }
    }

    private void checkSubOperands(OperandNode operand, DiagnosticsEngine diagnostics) {
        for (OperandNode sub : operand.subOperands()) {
            SubOperandDefinition definition = sub.valueDefinition();
            if (definition == null) {
                diagnostics.reportWarning(DiagnosticCode.UNKNOWN_SUB_OPERAND,
                        "Unknown sub-operand '" + sub.name() + "' for " + operand.name(), sub.position());
                continue;
            }
            String value = sub.parameter() == null ? "" : sub.parameter().unquotedValue();
            if (definition.requiresValue() && value.isEmpty()) {
                diagnostics.reportWarning(DiagnosticCode.SUB_OPERAND_VALIDATION,
                        "Sub-operand '" + sub.name() + "' of " + operand.name()
                                + " has empty parameter (expected " + definition.type() + ")",
                        sub.position());
            } else if (definition.maxLength() > 0 && value.length() > definition.maxLength()) {
                diagnostics.reportWarning(DiagnosticCode.SUB_OPERAND_VALIDATION,
                        String.format("Sub-operand '%s' of %s exceeds maximum length (%d > %d)",
                                sub.name(), operand.name(), value.length(), definition.maxLength()),
                        sub.position());
            }
        }
    }
}
