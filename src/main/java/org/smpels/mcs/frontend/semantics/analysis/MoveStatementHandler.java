package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.StatementNode;

/**
 * {@code ++MOVE} works in one of two modes, selected by {@code DISTLIB} or {@code SYSLIB}.
 * Each mode needs its target library and at least one element operand of its own set.
 * The catalog's required, exclusive and dependency fields cannot express this, so it is coded here.
 */
public class MoveStatementHandler implements IAnalysisHandler {

    static final String MOVE = "++MOVE";

    @Override
    public void analyze(AstNode node, Document document, DiagnosticsEngine diagnostics) {
        if (!(node instanceof StatementNode statement) || !statement.isRecognized()
                || !MOVE.equals(statement.definition().name())) {
            return;
        }
        boolean distlibMode = statement.hasOperand("DISTLIB");
        boolean syslibMode = statement.hasOperand("SYSLIB");

        if (distlibMode) {
            if (!statement.hasOperand("TODISTLIB")) {
                report(statement, diagnostics, "TODISTLIB is required when DISTLIB is specified");
            }
            if (!anyPresent(statement, "MAC", "MOD", "SRC")) {
                report(statement, diagnostics, "One of MAC, MOD, or SRC is required when DISTLIB is specified");
            }
        }
        if (syslibMode) {
            if (!statement.hasOperand("TOSYSLIB")) {
                report(statement, diagnostics, "TOSYSLIB is required when SYSLIB is specified");
            }
            if (!anyPresent(statement, "MAC", "SRC", "LMOD", "FMID")) {
                report(statement, diagnostics, "One of MAC, SRC, LMOD, or FMID is required when SYSLIB is specified");
            }
        }
        if (!distlibMode && !syslibMode) {
            report(statement, diagnostics, "Either DISTLIB or SYSLIB must be specified");
        }
    }

    private static boolean anyPresent(StatementNode statement, String... names) {
        for (String name : names) {
            if (statement.hasOperand(name)) {
                return true;
            }
        }
        return false;
    }

    private static void report(StatementNode statement, DiagnosticsEngine diagnostics, String message) {
        diagnostics.reportError(DiagnosticCode.MOVE_STATEMENT_MODE, message, statement.position());
    }
}
