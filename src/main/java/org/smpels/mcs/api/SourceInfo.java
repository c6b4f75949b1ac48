package org.smpels.mcs.api;

/**
 * A pure data class representing a position in an MCS document.
 * It is part of the public API and free of implementation details.
 *
 * @param line      The zero-based line number.
 * @param character The zero-based column on that line.
 * @param length    The number of characters covered, starting at {@code character}.
 */
public record SourceInfo(int line, int character, int length) {

    /**
     * Checks whether the given location lies on this position's line and inside its columns.
     * The column directly after the last covered character still counts, so a cursor placed
     * at the end of a token is treated as being on the token.
     * @param line      The zero-based line.
     * @param character The zero-based column.
     * @return {@code true} if the location is covered.
     */
    public boolean covers(int line, int character) {
        return this.line == line && character >= this.character && character <= this.character + length;
    }

    /**
     * @return The range spanned by this position on its single line.
     */
    public SourceRange toRange() {
        return new SourceRange(line, character, line, character + length);
    }
}
