package org.smpels.mcs.frontend.parser.ast;

import org.smpels.mcs.api.SourceInfo;
import org.smpels.mcs.api.SourceRange;

/**
 * A {@code /* ... *}{@code /} comment. It carries no payload besides its extent.
 *
 * @param position     Where the comment opens; the length covers the rest of the opening line.
 * @param endLine      The line holding the closing delimiter (or the last line, if never closed).
 * @param endCharacter The column after the closing delimiter.
 */
public record CommentNode(SourceInfo position, int endLine, int endCharacter) implements AstNode {

    /**
     * @return The full extent of the comment.
     */
    public SourceRange range() {
        return new SourceRange(position.line(), position.character(), endLine, endCharacter);
    }

    /**
     * @return {@code true} if the comment spans more than one line.
     */
    public boolean isMultiLine() {
        return endLine > position.line();
    }
}
