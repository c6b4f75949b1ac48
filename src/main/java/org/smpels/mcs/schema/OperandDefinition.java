package org.smpels.mcs.schema;

import java.util.List;
import java.util.Optional;

/**
 * The catalog entry of one operand of a statement. All aliases bind to the same definition.
 *
 * @param aliases               The accepted names; the first one is the primary name.
 * @param description           Human-readable description.
 * @param parameterHint         The parameter syntax hint, or {@code null} for a flag operand.
 * @param type                  The parameter type tag from the catalog.
 * @param maxLength             Maximum parameter length, {@code 0} if unlimited.
 * @param required              Whether the catalog marks the operand as required.
 * @param requiredGroup         Whether the operand belongs to a group of which one member must appear.
 * @param requiredGroupId       The identifier of that group, or {@code null}.
 * @param allowedIf             Name of an operand that must be present for this one to be allowed, or {@code null}.
 * @param mutuallyExclusiveWith Names of operands that must not appear together with this one.
 * @param subOperands           Nested value definitions (e.g. {@code DSN} inside {@code FROMDS}) or plain allowed values.
 */
public record OperandDefinition(
        List<String> aliases,
        String description,
        String parameterHint,
        String type,
        int maxLength,
        boolean required,
        boolean requiredGroup,
        String requiredGroupId,
        String allowedIf,
        List<String> mutuallyExclusiveWith,
        List<SubOperandDefinition> subOperands
) {

    /**
     * Compact constructor to ensure lists are never null.
     */
    public OperandDefinition {
        if (aliases == null || aliases.isEmpty()) {
            throw new IllegalArgumentException("An operand definition needs at least one name");
        }
        aliases = List.copyOf(aliases);
        mutuallyExclusiveWith = mutuallyExclusiveWith == null ? List.of() : List.copyOf(mutuallyExclusiveWith);
        subOperands = subOperands == null ? List.of() : List.copyOf(subOperands);
    }

    /**
     * @return The first declared alias.
     */
    public String primaryName() {
        return aliases.get(0);
    }

    /**
     * @param name An operand name as written in the source.
     * @return {@code true} if the name is one of this operand's aliases.
     */
    public boolean matches(String name) {
        return aliases.contains(name);
    }

    /**
     * @return {@code true} if the operand must be followed by a parenthesized parameter.
     */
    public boolean hasParameter() {
        return parameterHint != null && !parameterHint.isEmpty();
    }

    /**
     * Nested value definitions are only structural when the parameter hint itself shows
     * parenthesized sub-operands; otherwise the values are a plain list of allowed keywords.
     * @return {@code true} if the parameter is scanned for sub-operands.
     */
    public boolean declaresNestedValues() {
        return !subOperands.isEmpty() && hasParameter() && parameterHint.contains("(");
    }

    /**
     * @return {@code true} if this operand takes part in a required-group check.
     */
    public boolean isRequiredGroupMember() {
        return required && requiredGroup && requiredGroupId != null && !requiredGroupId.isEmpty();
    }

    /**
     * @param name A sub-operand name as written in the source.
     * @return The nested value definition declaring that name, or empty.
     */
    public Optional<SubOperandDefinition> findSubOperand(String name) {
        for (SubOperandDefinition sub : subOperands) {
            if (sub.matches(name)) {
                return Optional.of(sub);
            }
        }
        return Optional.empty();
    }
}
