package org.smpels.mcs.schema;

import java.util.List;
import java.util.Optional;

/**
 * The catalog entry of one MCS statement.
 *
 * @param name                   The statement name, e.g. {@code ++MAC}.
 * @param description            Human-readable description.
 * @param parameter              The name of the statement's own parameter, or {@code null} if it takes none.
 * @param maxParameterLength     Maximum length of the statement parameter, {@code 0} if unlimited.
 * @param type                   The catalog's statement type tag (e.g. {@code "sysmod"}, {@code "element"}).
 * @param acceptsLanguageVariant Whether the name may carry a national language suffix.
 * @param expectsInlineData      Whether the statement may be followed by inline data.
 * @param operands               The operand definitions in catalog order.
 */
public record StatementDefinition(
        String name,
        String description,
        String parameter,
        int maxParameterLength,
        String type,
        boolean acceptsLanguageVariant,
        boolean expectsInlineData,
        List<OperandDefinition> operands
) {

    /**
     * Compact constructor to ensure the operand list is never null.
     */
    public StatementDefinition {
        operands = operands == null ? List.of() : List.copyOf(operands);
    }

    /**
     * @return {@code true} if the statement requires a parenthesized parameter after its name.
     */
    public boolean hasParameter() {
        return parameter != null && !parameter.isEmpty();
    }

    /**
     * Finds the operand definition that declares the given alias.
     * @param alias An operand name as written in the source.
     * @return The matching definition, or empty if none declares this alias.
     */
    public Optional<OperandDefinition> findOperand(String alias) {
        for (OperandDefinition operand : operands) {
            if (operand.matches(alias)) {
                return Optional.of(operand);
            }
        }
        return Optional.empty();
    }
}
