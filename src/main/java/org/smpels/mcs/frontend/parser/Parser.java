package org.smpels.mcs.frontend.parser;

import org.smpels.mcs.diagnostics.AnalysisLogger;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.frontend.segmenter.InlineDataBlock;
import org.smpels.mcs.frontend.segmenter.StatementSegmenter;
import org.smpels.mcs.frontend.segmenter.StatementSpan;
import org.smpels.mcs.schema.SchemaStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The main parser for MCS source. It drives the {@link StatementSegmenter} over the document,
 * hands every span to the {@link TreeBuilder} and captures inline data after the statements that expect it.
 * A parser holds no per-document state and may be shared between threads.
 */
public class Parser {

    private final TreeBuilder builder;

    /**
     * Constructs a new Parser.
     * @param schema The catalog used to interpret statement and operand names.
     */
    public Parser(SchemaStore schema) {
        this.builder = new TreeBuilder(Objects.requireNonNull(schema, "schema"));
    }

    /**
     * Parses a whole document.
     * @param text The document text; {@code \n} and {@code \r\n} line ends are accepted.
     * @return The parsed document.
     */
    public Document parse(String text) {
        return parse(splitLines(Objects.requireNonNull(text, "text")));
    }

    /**
     * Parses a whole document given as lines.
     * @param lines The physical lines, without line terminators.
     * @return The parsed document.
     */
    public Document parse(List<String> lines) {
        StatementSegmenter segmenter = new StatementSegmenter(lines);
        List<StatementNode> statements = new ArrayList<>();
        Optional<StatementSpan> span;
        while ((span = segmenter.nextStatement()).isPresent()) {
            StatementNode statement = builder.build(span.get());
            if (statement.expectsInlineData()) {
                InlineDataBlock block = segmenter.consumeInlineData();
                statement = statement.withInlineData(block.hasContent(), block.contentLines());
            }
            statements.add(statement);
        }
        AnalysisLogger.debug("Parsed {} lines into {} statements and {} comments",
                lines.size(), statements.size(), segmenter.comments().size());
        return new Document(lines, statements, segmenter.comments());
    }

    /**
     * Splits text into physical lines, keeping a trailing empty line.
     * @param text The document text.
     * @return The lines without terminators.
     */
    public static List<String> splitLines(String text) {
        return Arrays.asList(text.split("\\r?\\n", -1));
    }
}
