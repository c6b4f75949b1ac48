package org.smpels.mcs.api;

/**
 * A start/end pair of zero-based line and column coordinates. The end column is exclusive.
 *
 * @param startLine      The first line.
 * @param startCharacter The first column on the first line.
 * @param endLine        The last line.
 * @param endCharacter   The column after the last covered character on the last line.
 */
public record SourceRange(int startLine, int startCharacter, int endLine, int endCharacter) {

    @Override
    public String toString() {
        return String.format("%d:%d-%d:%d", startLine + 1, startCharacter + 1, endLine + 1, endCharacter + 1);
    }
}
