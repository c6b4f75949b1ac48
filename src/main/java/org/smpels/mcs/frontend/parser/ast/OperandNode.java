package org.smpels.mcs.frontend.parser.ast;

import org.smpels.mcs.api.SourceInfo;
import org.smpels.mcs.schema.OperandDefinition;
import org.smpels.mcs.schema.SubOperandDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * An operand of a statement, or a sub-operand nested inside another operand's parameter.
 *
 * @param name            The operand name as written.
 * @param position        The position of the name.
 * @param definition      The catalog entry of a top-level operand, {@code null} if unknown or if this is a sub-operand.
 * @param valueDefinition The catalog entry of a sub-operand, {@code null} if unknown or if this is a top-level operand.
 * @param parameter       The parenthesized parameter, or {@code null} for a flag operand or one with sub-operands.
 * @param subOperands     The nested operands, only present when the definition declares nested values.
 */
public record OperandNode(
        String name,
        SourceInfo position,
        OperandDefinition definition,
        SubOperandDefinition valueDefinition,
        ParameterNode parameter,
        List<OperandNode> subOperands
) implements AstNode {

    /**
     * Compact constructor to ensure the sub-operand list is never null.
     */
    public OperandNode {
        subOperands = subOperands == null ? List.of() : List.copyOf(subOperands);
    }

    /**
     * @return {@code true} if the operand carries a non-blank parameter or at least one sub-operand.
     */
    public boolean hasValue() {
        return (parameter != null && !parameter.isBlank()) || !subOperands.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(subOperands.size() + 1);
        if (parameter != null) {
            children.add(parameter);
        }
        children.addAll(subOperands);
        return children;
    }
}
