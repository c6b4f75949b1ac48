package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.OperandNode;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.schema.OperandDefinition;
import org.smpels.mcs.schema.StatementDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the relations the catalog declares between operands: {@code allowed_if} dependencies,
 * mutual exclusion and required groups.
 */
public class OperandPolicyHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, Document document, DiagnosticsEngine diagnostics) {
        if (!(node instanceof StatementNode statement) || !statement.isRecognized()) {
            return;
        }
        checkDependencies(statement, diagnostics);
        checkMutualExclusion(statement, diagnostics);
        checkRequiredGroups(statement, diagnostics);
    }

    private void checkDependencies(StatementNode statement, DiagnosticsEngine diagnostics) {
        for (OperandDefinition definition : statement.definition().operands()) {
            String allowedIf = definition.allowedIf();
            if (allowedIf == null || allowedIf.isEmpty()) {
                continue;
            }
            Optional<OperandNode> present = firstPresent(statement, definition);
            if (present.isPresent() && !isPresent(statement, allowedIf)) {
                diagnostics.reportInfo(DiagnosticCode.DEPENDENCY_VIOLATION,
                        definition.primaryName() + " requires " + allowedIf + " to be specified",
                        present.get().position());
            }
        }
    }

    private void checkMutualExclusion(StatementNode statement, DiagnosticsEngine diagnostics) {
        StatementDefinition statementDefinition = statement.definition();
        Set<String> reportedPairs = new HashSet<>();
        for (OperandDefinition definition : statementDefinition.operands()) {
            Optional<OperandNode> present = firstPresent(statement, definition);
            if (present.isEmpty()) {
                continue;
            }
            for (String peer : definition.mutuallyExclusiveWith()) {
                if (!isPresent(statement, peer)) {
                    continue;
                }
                String peerPrimary = statementDefinition.findOperand(peer)
                        .map(OperandDefinition::primaryName)
                        .orElse(peer);
                if (reportedPairs.add(pairKey(definition.primaryName(), peerPrimary))) {
                    diagnostics.reportError(DiagnosticCode.MUTUALLY_EXCLUSIVE,
                            definition.primaryName() + " is mutually exclusive with " + peer,
                            present.get().position());
                }
            }
        }
    }

    private void checkRequiredGroups(StatementNode statement, DiagnosticsEngine diagnostics) {
        Map<String, List<OperandDefinition>> groups = new LinkedHashMap<>();
        for (OperandDefinition definition : statement.definition().operands()) {
            if (definition.isRequiredGroupMember()) {
                groups.computeIfAbsent(definition.requiredGroupId(), id -> new ArrayList<>()).add(definition);
            }
        }
        for (List<OperandDefinition> members : groups.values()) {
            boolean satisfied = members.stream().anyMatch(member -> firstPresent(statement, member).isPresent());
            if (!satisfied) {
                List<String> names = new ArrayList<>();
                for (OperandDefinition member : members) {
                    names.add(member.primaryName());
                }
                diagnostics.reportError(DiagnosticCode.REQUIRED_GROUP,
                        "One of the following operands must be specified: " + String.join(", ", names),
                        statement.position());
            }
        }
    }

    /**
     * @param statement  A statement.
     * @param definition One of its operand definitions.
     * @return {@code true} if any alias of the operand is written in the statement.
     */
    static boolean isPresent(StatementNode statement, OperandDefinition definition) {
        return firstPresent(statement, definition).isPresent();
    }

    /**
     * Checks for an operand by name; a name the catalog knows also matches its aliases.
     */
    private static boolean isPresent(StatementNode statement, String name) {
        return statement.definition().findOperand(name)
                .map(definition -> isPresent(statement, definition))
                .orElseGet(() -> statement.hasOperand(name));
    }

    private static Optional<OperandNode> firstPresent(StatementNode statement, OperandDefinition definition) {
        for (OperandNode operand : statement.operands()) {
            if (definition.matches(operand.name())) {
                return Optional.of(operand);
            }
        }
        return Optional.empty();
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
