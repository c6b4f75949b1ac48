package org.smpels.mcs.frontend.parser.ast;

import org.smpels.mcs.api.SourceInfo;
import org.smpels.mcs.schema.DataSourceOperands;
import org.smpels.mcs.schema.StatementDefinition;
import org.smpels.mcs.schema.StatementKind;

import java.util.ArrayList;
import java.util.List;

/**
 * One MCS statement with its own parameter and its operands.
 *
 * @param name               The statement name as written, e.g. {@code ++USERMOD} or {@code ++SAMPENU}.
 * @param languageId         The national language suffix, or the empty string.
 * @param kind               How the name matched the catalog.
 * @param position           The position of the name.
 * @param definition         The catalog entry, {@code null} if the name is not recognized.
 * @param parameter          The statement's own parameter, {@code null} if absent.
 * @param operands           All operand occurrences in source order, duplicates included.
 * @param hasTerminator      Whether a {@code .} was found outside all parentheses.
 * @param terminator         The position of the terminator, {@code null} if there is none.
 * @param unbalancedParens   Positive for missing closing parentheses, negative for extra closing ones, zero if balanced.
 * @param startLine          The first line of the statement.
 * @param endLine            The last line of the statement (the terminator line when terminated).
 * @param hasInlineData      Whether non-blank inline data follows the statement.
 * @param inlineDataLines    The number of non-blank inline data lines.
 */
public record StatementNode(
        String name,
        String languageId,
        StatementKind kind,
        SourceInfo position,
        StatementDefinition definition,
        ParameterNode parameter,
        List<OperandNode> operands,
        boolean hasTerminator,
        SourceInfo terminator,
        int unbalancedParens,
        int startLine,
        int endLine,
        boolean hasInlineData,
        int inlineDataLines
) implements AstNode {

    /**
     * Compact constructor to ensure the operand list is never null.
     */
    public StatementNode {
        operands = operands == null ? List.of() : List.copyOf(operands);
        languageId = languageId == null ? "" : languageId;
    }

    /**
     * @return {@code true} if the name matched a catalog entry.
     */
    public boolean isRecognized() {
        return definition != null;
    }

    /**
     * @return {@code true} if the name carried a national language suffix.
     */
    public boolean hasLanguageId() {
        return !languageId.isEmpty();
    }

    /**
     * @param operandName An operand name or alias.
     * @return {@code true} if at least one operand occurrence is written with this name.
     */
    public boolean hasOperand(String operandName) {
        for (OperandNode operand : operands) {
            if (operand.name().equals(operandName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A terminated statement whose catalog entry allows inline data expects it unless
     * an operand points to external data or requests deletion.
     * @return {@code true} if the lines after the terminator are inline data.
     */
    public boolean expectsInlineData() {
        if (definition == null || !definition.expectsInlineData() || !hasTerminator) {
            return false;
        }
        for (OperandNode operand : operands) {
            if (DataSourceOperands.cancelsInlineData(operand.name())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy with the inline data that was captured after the statement.
     * @param present Whether any non-blank inline content was found.
     * @param lines   The number of non-blank inline lines.
     * @return The new node.
     */
    public StatementNode withInlineData(boolean present, int lines) {
        return new StatementNode(name, languageId, kind, position, definition, parameter, operands,
                hasTerminator, terminator, unbalancedParens, startLine, endLine, present, lines);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(operands.size() + 1);
        if (parameter != null) {
            children.add(parameter);
        }
        children.addAll(operands);
        return children;
    }
}
