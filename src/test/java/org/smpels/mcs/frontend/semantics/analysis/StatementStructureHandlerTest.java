package org.smpels.mcs.frontend.semantics.analysis;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.smpels.mcs.api.SchemaLoadException;
import org.smpels.mcs.diagnostics.Diagnostic;
import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.Parser;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.schema.CatalogSchemaStore;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link StatementStructureHandler}.
 */
public class StatementStructureHandlerTest {

    private static Parser parser;

    @BeforeAll
    static void loadCatalog() throws SchemaLoadException {
        parser = new Parser(CatalogSchemaStore.bundled());
    }

    private static List<Diagnostic> check(String source) {
        Document document = parser.parse(source);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new StatementStructureHandler().analyze(document.statements().get(0), document, diagnostics);
        return diagnostics.getDiagnostics();
    }

    @Test
    @Tag("unit")
    void missingTerminator() {
        assertThat(check("++VER(Z038)")).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.MISSING_TERMINATOR);
            assertThat(d.message()).isEqualTo("Statement must be terminated with '.'");
        });
    }

    @Test
    @Tag("unit")
    void extraClosingParenthesis() {
        assertThat(check("++VER(Z038)) .")).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("Missing opening parenthesis '(' or extra closing parenthesis ')'");
    }

    @Test
    @Tag("unit")
    void missingAndBlankParameter() {
        assertThat(check("++VER .")).singleElement()
                .extracting(Diagnostic::message).isEqualTo("Missing required parameter: srel");
        assertThat(check("++VER(  ) .")).singleElement()
                .extracting(Diagnostic::code).isEqualTo(DiagnosticCode.MISSING_PARAMETER);
    }

    /**
     * Verifies that the parameter length counts the value without its quotes.
     */
    @Test
    @Tag("unit")
    void parameterLength() {
        assertThat(check("++VER(Z0381) .")).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.message()).isEqualTo("Parameter 'srel' exceeds maximum length (5 > 4)");
            assertThat(d.range().startCharacter()).isEqualTo(6);
        });
        assertThat(check("++VER('Z038') .")).isEmpty();
    }

    @Test
    @Tag("unit")
    void statementWithoutParameterIgnoresGroup() {
        assertThat(check("++NULL .")).isEmpty();
    }
}
