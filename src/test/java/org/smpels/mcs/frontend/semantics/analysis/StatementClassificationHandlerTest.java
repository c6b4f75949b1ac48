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
import org.smpels.mcs.schema.StatementDefinition;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class StatementClassificationHandlerTest {

    private static Parser parser;

    @BeforeAll
    static void loadCatalog() throws SchemaLoadException {
        parser = new Parser(CatalogSchemaStore.bundled());
    }

    private static List<Diagnostic> check(String source) {
        Document document = parser.parse(source);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new StatementClassificationHandler().analyze(document.statements().get(0), document, diagnostics);
        return diagnostics.getDiagnostics();
    }

    @Test
    @Tag("unit")
    void unknownStatement() {
        assertThat(check("++FOO .")).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.message()).isEqualTo("Unknown statement type: ++FOO");
            assertThat(d.range().endCharacter()).isEqualTo(5);
        });
    }

    @Test
    @Tag("unit")
    void invalidLanguageIdentifier() {
        assertThat(check("++SAMPXYZ(A) .")).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.INVALID_LANGUAGE_ID);
            assertThat(d.message()).isEqualTo("Invalid language identifier 'XYZ' for statement ++SAMP");
        });
    }

    @Test
    @Tag("unit")
    void validIdentifierOnUncataloguedBase() {
        // Arrange
        Parser samplesOnly = new Parser(CatalogSchemaStore.of(List.of(
                new StatementDefinition("++SAMP", "sample", "name", 8, "element", true, true, List.of()))));
        Document document = samplesOnly.parse("++HELPDEU .");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        new StatementClassificationHandler().analyze(document.statements().get(0), document, diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("Unknown statement type: ++HELP (with language ID DEU)");
    }

    @Test
    @Tag("unit")
    void bundledVariantElementsAreRecognized() {
        assertThat(check("++HELPENU(ISRHELP) DISTLIB(AHELP) .\n data")).isEmpty();
        assertThat(check("++MSGDEU(ISRMSG) TXLIB(MSGLIB) .")).isEmpty();
        assertThat(check("++JARUPD(MYJAR) RELFILE(2) .")).isEmpty();
    }

    @Test
    @Tag("unit")
    void knownStatementsAndVariantsPass() {
        assertThat(check("++VER(Z038) .")).isEmpty();
        assertThat(check("++SAMPJPN(A) .\n data")).isEmpty();
    }
}
