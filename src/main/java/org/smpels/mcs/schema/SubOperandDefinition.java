package org.smpels.mcs.schema;

import java.util.List;

/**
 * A nested value definition of an operand, such as {@code VOL} inside {@code FROMDS(...)}.
 *
 * @param aliases     The accepted names; the first one is the primary name.
 * @param description Human-readable description.
 * @param parameter   Parameter syntax hint, or {@code null}.
 * @param type        Value type ({@code "string"}, {@code "integer"}, ...), or {@code null}.
 * @param maxLength   Maximum value length, {@code 0} if unlimited.
 */
public record SubOperandDefinition(
        List<String> aliases,
        String description,
        String parameter,
        String type,
        int maxLength
) {

    /**
     * Compact constructor to ensure the alias list is immutable.
     */
    public SubOperandDefinition {
        if (aliases == null || aliases.isEmpty()) {
            throw new IllegalArgumentException("A sub-operand definition needs at least one name");
        }
        aliases = List.copyOf(aliases);
    }

    /**
     * @return The first declared alias.
     */
    public String primaryName() {
        return aliases.get(0);
    }

    /**
     * @param name A name as written in the source.
     * @return {@code true} if the name is one of the aliases.
     */
    public boolean matches(String name) {
        return aliases.contains(name);
    }

    /**
     * Only string and integer values with a declared length must carry a value.
     * @return {@code true} if an empty or missing value is reported.
     */
    public boolean requiresValue() {
        return maxLength > 0 && ("string".equals(type) || "integer".equals(type));
    }
}
