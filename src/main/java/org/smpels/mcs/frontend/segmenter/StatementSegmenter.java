package org.smpels.mcs.frontend.segmenter;

import org.smpels.mcs.api.SourceInfo;
import org.smpels.mcs.diagnostics.AnalysisLogger;
import org.smpels.mcs.frontend.parser.ast.CommentNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits MCS source lines into statement spans.
 * <p>
 * The segmenter is a cursor over the document. {@link #nextStatement()} returns the next span;
 * the caller then decides whether the statement carries inline data and, if so, calls
 * {@link #consumeInlineData()} before asking for the next span. Comments outside inline data are
 * collected along the way and replaced by blanks in the span text so that columns stay intact.
 * A line whose comment-free content starts with the marker always starts a new statement.
 */
public class StatementSegmenter {

    /** The two characters that introduce a statement. */
    public static final String MARKER = "++";

    private final List<String> lines;
    private final List<CommentNode> comments = new ArrayList<>();
    private int nextLine = 0;

    // Lookahead: a marker line that ended the previous span.
    private int pendingMarkerLine = -1;
    private String pendingMarkerContent;

    private boolean inComment = false;
    private boolean commentRecorded;
    private int commentStartLine;
    private int commentStartCharacter;

    /**
     * Creates a segmenter over a document.
     * @param lines The physical lines, without line terminators.
     */
    public StatementSegmenter(List<String> lines) {
        this.lines = Objects.requireNonNull(lines, "lines");
    }

    /**
     * Advances to the next statement.
     * @return The next span, or empty when the document is exhausted.
     */
    public Optional<StatementSpan> nextStatement() {
        if (pendingMarkerLine >= 0) {
            int line = pendingMarkerLine;
            String content = pendingMarkerContent;
            pendingMarkerLine = -1;
            pendingMarkerContent = null;
            return Optional.of(collect(line, content));
        }
        while (nextLine < lines.size()) {
            int line = nextLine++;
            String content = stripComments(line, true);
            if (isMarkerLine(content)) {
                return Optional.of(collect(line, content));
            }
        }
        finishOpenComment();
        return Optional.empty();
    }

    /**
     * Captures the lines after the last returned statement verbatim, up to the next marker line.
     * Comments inside the block are not recorded.
     * @return The captured block; empty if the next line is already a statement.
     */
    public InlineDataBlock consumeInlineData() {
        int first = nextLine;
        if (pendingMarkerLine >= 0) {
            return new InlineDataBlock(first, 0, 0);
        }
        int contentLines = 0;
        while (nextLine < lines.size()) {
            String raw = lines.get(nextLine);
            if (raw.trim().startsWith(MARKER)) {
                if (inComment) {
                    finishComment(nextLine - 1, lineLength(nextLine - 1));
                }
                break;
            }
            String content = stripComments(nextLine, false);
            if (!content.isBlank()) {
                contentLines++;
            }
            nextLine++;
        }
        AnalysisLogger.trace("Inline data at line {}: {} lines, {} with content", first + 1, nextLine - first, contentLines);
        return new InlineDataBlock(first, nextLine - first, contentLines);
    }

    /**
     * @return The comments seen so far outside inline data, in source order.
     */
    public List<CommentNode> comments() {
        return Collections.unmodifiableList(comments);
    }

    private StatementSpan collect(int startLine, String firstContent) {
        SpanText.Builder text = SpanText.builder();
        int depth = 0;
        int minDepth = 0;
        int line = startLine;
        String content = firstContent;
        while (true) {
            for (int col = 0; col < content.length(); col++) {
                char c = content.charAt(col);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    minDepth = Math.min(minDepth, depth);
                } else if (c == '.' && depth <= 0) {
                    text.append(line, content, col);
                    return new StatementSpan(startLine, line, text.build(), true,
                            new SourceInfo(line, col, 1), balance(depth, minDepth));
                }
            }
            text.append(line, content, content.length());
            if (nextLine >= lines.size()) {
                break;
            }
            int candidate = nextLine++;
            String candidateContent = stripComments(candidate, true);
            if (isMarkerLine(candidateContent)) {
                pendingMarkerLine = candidate;
                pendingMarkerContent = candidateContent;
                break;
            }
            line = candidate;
            content = candidateContent;
        }
        return new StatementSpan(startLine, line, text.build(), false, null, balance(depth, minDepth));
    }

    private static int balance(int depth, int minDepth) {
        return minDepth < 0 ? minDepth : depth;
    }

    private static boolean isMarkerLine(String content) {
        return content.trim().startsWith(MARKER);
    }

    /**
     * Blanks out comment text on a line, carrying the open-comment state across lines.
     */
    private String stripComments(int line, boolean record) {
        String raw = lines.get(line);
        if (!inComment && raw.indexOf("/*") < 0) {
            return raw;
        }
        char[] out = raw.toCharArray();
        int i = 0;
        while (i < raw.length()) {
            if (inComment) {
                int end = raw.indexOf("*/", i);
                int stop = end < 0 ? raw.length() : end + 2;
                Arrays.fill(out, i, stop, ' ');
                i = stop;
                if (end >= 0) {
                    finishComment(line, stop);
                }
            } else {
                int start = raw.indexOf("/*", i);
                if (start < 0) {
                    break;
                }
                inComment = true;
                commentRecorded = record;
                commentStartLine = line;
                commentStartCharacter = start;
                Arrays.fill(out, start, start + 2, ' ');
                i = start + 2;
            }
        }
        return new String(out);
    }

    private void finishComment(int endLine, int endCharacter) {
        inComment = false;
        if (!commentRecorded) {
            return;
        }
        int length = endLine == commentStartLine
                ? endCharacter - commentStartCharacter
                : lineLength(commentStartLine) - commentStartCharacter;
        comments.add(new CommentNode(new SourceInfo(commentStartLine, commentStartCharacter, length),
                endLine, endCharacter));
    }

    private void finishOpenComment() {
        if (inComment && !lines.isEmpty()) {
            int last = lines.size() - 1;
            finishComment(last, lineLength(last));
        }
    }

    private int lineLength(int line) {
        return lines.get(line).length();
    }
}
