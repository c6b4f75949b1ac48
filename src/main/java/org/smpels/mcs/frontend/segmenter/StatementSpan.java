package org.smpels.mcs.frontend.segmenter;

import org.smpels.mcs.api.SourceInfo;

/**
 * The raw extent of one statement: its lines, its comment-free text and the lexical facts
 * found while looking for the terminator.
 *
 * @param startLine        The line holding the statement marker.
 * @param endLine          The terminator line, or the last line absorbed when unterminated.
 * @param text             The joined comment-free text, ending before the terminator.
 * @param hasTerminator    Whether a {@code .} was found outside all parentheses.
 * @param terminator       The terminator position, {@code null} if there is none.
 * @param unbalancedParens The signed parenthesis balance of the span.
 */
public record StatementSpan(
        int startLine,
        int endLine,
        SpanText text,
        boolean hasTerminator,
        SourceInfo terminator,
        int unbalancedParens
) {
}
