package org.smpels.mcs.frontend.segmenter;

/**
 * The verbatim lines captured after a statement that carries inline data.
 *
 * @param firstLine    The first captured line.
 * @param lineCount    The number of captured lines, blank ones included.
 * @param contentLines The number of captured lines with content besides whitespace and comments.
 */
public record InlineDataBlock(int firstLine, int lineCount, int contentLines) {

    /**
     * @return {@code true} if at least one captured line has content.
     */
    public boolean hasContent() {
        return contentLines > 0;
    }
}
