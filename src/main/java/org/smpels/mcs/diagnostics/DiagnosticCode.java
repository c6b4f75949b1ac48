package org.smpels.mcs.diagnostics;

import java.util.Optional;

/**
 * Stable rule categories. Every finding carries exactly one code and every code can be
 * switched off on its own in {@link DiagnosticsConfig}.
 */
public enum DiagnosticCode {
    // Statement structure
    UNKNOWN_STATEMENT("unknown_statement"),
    INVALID_LANGUAGE_ID("invalid_language_id"),
    UNBALANCED_PARENTHESES("unbalanced_parentheses"),
    MISSING_TERMINATOR("missing_terminator"),
    MISSING_PARAMETER("missing_parameter"),
    MALFORMED_PARAMETER("malformed_parameter"),
    PARAMETER_LENGTH("parameter_length"),

    // Operands
    UNKNOWN_OPERAND("unknown_operand"),
    DUPLICATE_OPERAND("duplicate_operand"),
    EMPTY_OPERAND_PARAMETER("empty_operand_parameter"),
    OPERAND_PARAMETER_LENGTH("operand_parameter_length"),
    UNKNOWN_SUB_OPERAND("unknown_sub_operand"),
    SUB_OPERAND_VALIDATION("sub_operand_validation"),

    // Operand policy
    MISSING_REQUIRED_OPERAND("missing_required_operand"),
    DEPENDENCY_VIOLATION("dependency_violation"),
    MUTUALLY_EXCLUSIVE("mutually_exclusive"),
    REQUIRED_GROUP("required_group"),
    MOVE_STATEMENT_MODE("move_statement_mode"),

    // Document layout
    MISSING_INLINE_DATA("missing_inline_data"),
    CONTENT_BEYOND_COLUMN_72("content_beyond_column_72"),
    STANDALONE_COMMENT("standalone_comment");

    private final String key;

    DiagnosticCode(String key) {
        this.key = key;
    }

    /**
     * @return The configuration key, e.g. {@code unknown_statement}.
     */
    public String key() {
        return key;
    }

    /**
     * Finds a code by its configuration key.
     * @param key The key as written in configuration or on the command line.
     * @return The code, or empty if the key is not known.
     */
    public static Optional<DiagnosticCode> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase().replace('-', '_');
        for (DiagnosticCode code : values()) {
            if (code.key.equals(normalized)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
