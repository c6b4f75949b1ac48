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
 * Contains unit tests for the {@link OperandPolicyHandler}: dependencies, mutual exclusion and required groups.
 */
public class OperandPolicyHandlerTest {

    private static Parser parser;

    @BeforeAll
    static void loadCatalog() throws SchemaLoadException {
        parser = new Parser(CatalogSchemaStore.bundled());
    }

    private static List<Diagnostic> check(String source) {
        Document document = parser.parse(source);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new OperandPolicyHandler().analyze(document.statements().get(0), document, diagnostics);
        return diagnostics.getDiagnostics();
    }

    @Test
    @Tag("unit")
    void exclusivePairIsReportedOnce() {
        assertThat(check("++MAC(A) FROMDS(DSN(X.Y)) RELFILE(1) .")).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.code()).isEqualTo(DiagnosticCode.MUTUALLY_EXCLUSIVE);
            assertThat(d.message()).isEqualTo("FROMDS is mutually exclusive with RELFILE");
        });
    }

    @Test
    @Tag("unit")
    void dependencyWithoutItsOperandIsInfo() {
        assertThat(check("++PTF(UA00001) RFDSNPFX(IBM) .")).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.INFO);
            assertThat(d.message()).isEqualTo("RFDSNPFX requires FILES to be specified");
        });
        assertThat(check("++PTF(UA00001) FILES(3) RFDSNPFX(IBM) .")).isEmpty();
    }

    /**
     * Verifies that a group without any member present is one error listing every member,
     * and that one member satisfies it.
     */
    @Test
    @Tag("unit")
    void requiredGroupNeedsOneMember() {
        assertThat(check("++HOLD(UA00001) FMID(HBB7790) REASON(AA00001) .")).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(DiagnosticCode.REQUIRED_GROUP);
            assertThat(d.message()).isEqualTo("One of the following operands must be specified: ERROR, FIXCAT, SYSTEM, USER");
        });
        assertThat(check("++HOLD(UA00001) FMID(HBB7790) REASON(AA00001) SYSTEM .")).isEmpty();
    }

    @Test
    @Tag("unit")
    void twoGroupMembersAreExclusive() {
        assertThat(check("++HOLD(UA00001) ERROR USER .")).extracting(Diagnostic::message)
                .containsExactly("ERROR is mutually exclusive with USER");
    }

    @Test
    @Tag("unit")
    void satisfiedDependencyIsClean() {
        assertThat(check("++FUNCTION(HBB7790) DESC(BASE) FILES(5) RFDSNPFX(IBM) .")).isEmpty();
    }
}
