package org.smpels.mcs.frontend.parser.ast;

import org.smpels.mcs.api.SourceInfo;

/**
 * The text between a pair of parentheses, owned by a statement or an operand.
 *
 * @param value      The raw text between the parentheses, or everything up to the end of the statement if unterminated.
 * @param position   The position of the first character after the opening parenthesis.
 * @param terminated {@code false} if the closing parenthesis was never found.
 */
public record ParameterNode(String value, SourceInfo position, boolean terminated) implements AstNode {

    /**
     * @return {@code true} if the parameter holds nothing but whitespace.
     */
    public boolean isBlank() {
        return value.isBlank();
    }

    /**
     * Returns the value with surrounding whitespace and one pair of enclosing single quotes removed.
     * @return The unquoted value.
     */
    public String unquotedValue() {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
