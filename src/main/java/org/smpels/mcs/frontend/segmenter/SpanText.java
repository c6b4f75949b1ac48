package org.smpels.mcs.frontend.segmenter;

import org.smpels.mcs.api.SourceInfo;

import java.util.Arrays;

/**
 * The comment-free text of a statement with its physical lines joined by {@code '\n'}.
 * Every offset in the joined text maps back to its line and column in the document.
 */
public final class SpanText {

    private final String text;
    private final int[] lines;
    private final int[] columns;

    private SpanText(String text, int[] lines, int[] columns) {
        this.text = text;
        this.lines = lines;
        this.columns = columns;
    }

    /**
     * @return The joined text.
     */
    public String text() {
        return text;
    }

    /**
     * @return The number of characters in the joined text.
     */
    public int length() {
        return text.length();
    }

    /**
     * @param offset An offset into the joined text; the offset just past the end is allowed.
     * @return The document line of that offset.
     */
    public int lineAt(int offset) {
        if (offset >= text.length()) {
            return text.isEmpty() ? 0 : lines[text.length() - 1];
        }
        return lines[offset];
    }

    /**
     * @param offset An offset into the joined text; the offset just past the end is allowed.
     * @return The document column of that offset.
     */
    public int columnAt(int offset) {
        if (offset >= text.length()) {
            return text.isEmpty() ? 0 : columns[text.length() - 1] + 1;
        }
        return columns[offset];
    }

    /**
     * @param offset The start offset.
     * @param length The number of characters covered.
     * @return The document position of the range starting at {@code offset}.
     */
    public SourceInfo positionOf(int offset, int length) {
        return new SourceInfo(lineAt(offset), columnAt(offset), length);
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates line fragments, inserting the separator and recording positions as it goes.
     */
    static final class Builder {
        private final StringBuilder text = new StringBuilder();
        private int[] lines = new int[128];
        private int[] columns = new int[128];
        private boolean first = true;
        private int lastLine;
        private int lastLineEnd;

        /**
         * Appends the first {@code end} characters of a line.
         * @param line    The document line.
         * @param content The comment-free line content.
         * @param end     The exclusive end column.
         */
        void append(int line, String content, int end) {
            if (!first) {
                put('\n', lastLine, lastLineEnd);
            }
            for (int col = 0; col < end; col++) {
                put(content.charAt(col), line, col);
            }
            first = false;
            lastLine = line;
            lastLineEnd = end;
        }

        private void put(char c, int line, int col) {
            int index = text.length();
            if (index == lines.length) {
                lines = Arrays.copyOf(lines, index * 2);
                columns = Arrays.copyOf(columns, index * 2);
            }
            text.append(c);
            lines[index] = line;
            columns[index] = col;
        }

        SpanText build() {
            int n = text.length();
            return new SpanText(text.toString(), Arrays.copyOf(lines, n), Arrays.copyOf(columns, n));
        }
    }
}
