package org.smpels.mcs;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.smpels.mcs.api.AnalysisResult;
import org.smpels.mcs.api.SchemaLoadException;
import org.smpels.mcs.diagnostics.Diagnostic;
import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsConfig;
import org.smpels.mcs.frontend.parser.ast.StatementNode;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link McsAnalyzer} facade, run against a sample file with several
 * kinds of problems.
 */
public class McsAnalyzerTest {

    private static McsAnalyzer analyzer;
    private static Path sample;

    @BeforeAll
    static void setUp() throws SchemaLoadException, URISyntaxException {
        analyzer = McsAnalyzer.withBundledCatalog(DiagnosticsConfig.defaults());
        sample = Path.of(McsAnalyzerTest.class.getResource("/fixtures/sample.mcs").toURI());
    }

    /**
     * Verifies the statement count and the findings of the sample file in document order.
     */
    @Test
    @Tag("unit")
    void analyzesSampleFile() throws IOException {
        // Act
        AnalysisResult result = analyzer.analyze(sample);

        // Assert
        assertThat(result.document().statements()).extracting(StatementNode::name)
                .containsExactly("++USERMOD", "++VER", "++MAC", "++MOD", "++SRC");
        assertThat(result.document().statements().get(2).inlineDataLines()).isEqualTo(3);
        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(
                DiagnosticCode.SUB_OPERAND_VALIDATION,
                DiagnosticCode.UNKNOWN_OPERAND,
                DiagnosticCode.MISSING_INLINE_DATA,
                DiagnosticCode.STANDALONE_COMMENT);
        assertThat(result.hasErrors()).isTrue();
    }

    @Test
    @Tag("unit")
    void disabledRulesAreSilent() throws IOException {
        McsAnalyzer quiet = new McsAnalyzer(analyzer.schema(), DiagnosticsConfig.defaults().withDisabled(
                DiagnosticCode.UNKNOWN_OPERAND, DiagnosticCode.STANDALONE_COMMENT));

        AnalysisResult result = quiet.analyze(sample);

        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(
                DiagnosticCode.SUB_OPERAND_VALIDATION,
                DiagnosticCode.MISSING_INLINE_DATA);
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void verWithFunctionIsClean() {
        assertThat(analyzer.analyze("++VER(Z038) FMID(A) .").diagnostics()).isEmpty();
        assertThat(analyzer.analyze("++VER(Z038) FMID(HBB77C0) PRE(UA00001 UA00002) SUP(AA00001) .").diagnostics())
                .isEmpty();
    }

    @Test
    @Tag("unit")
    void repeatedFunctionOnVerIsADuplicate() {
        AnalysisResult result = analyzer.analyze("++VER(Z038) FMID(A)\n FMID(B) .");

        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.DUPLICATE_OPERAND);
            assertThat(d.message()).isEqualTo("Duplicate operand 'FMID' (first occurrence at line 1)");
        });
    }

    @Test
    @Tag("unit")
    void lineListAndTextGiveTheSameResult() {
        List<String> lines = List.of("++PTF(UA00001) BOGUS .", "++VER(Z038)");

        AnalysisResult fromLines = analyzer.analyze(lines);
        AnalysisResult fromText = analyzer.analyze(String.join("\n", lines));

        assertThat(fromLines.diagnostics()).isEqualTo(fromText.diagnostics());
        assertThat(fromLines.diagnostics()).hasSize(2);
    }

    /**
     * Every line beginning with the statement marker outside inline data yields one statement,
     * whether or not it is well formed.
     */
    @Test
    @Tag("unit")
    void statementCountMatchesMarkers() {
        String source = String.join("\n",
                "++PTF(UA00001) .",
                "++VER(Z038) FMID(HBB7790",
                "++MAC(A) .",
                "  MACRO ++X",
                "++FOO ++BAR .",
                "  ++NULL .");

        AnalysisResult result = analyzer.analyze(source);

        assertThat(result.document().statements()).extracting(StatementNode::name)
                .containsExactly("++PTF", "++VER", "++MAC", "++FOO", "++NULL");
    }
}
