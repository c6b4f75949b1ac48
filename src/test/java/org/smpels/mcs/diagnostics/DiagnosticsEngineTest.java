package org.smpels.mcs.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.smpels.mcs.api.SourceInfo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void collectsFindingsInReportOrder() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning(DiagnosticCode.UNKNOWN_OPERAND, "first", new SourceInfo(0, 4, 3));
        engine.reportError(DiagnosticCode.MISSING_TERMINATOR, "second", new SourceInfo(2, 0, 5));

        // Assert
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::message).containsExactly("first", "second");
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics().get(0).range().endCharacter()).isEqualTo(7);
        assertThat(engine.summary()).contains("[ERROR] 3:1: second (missing_terminator)");
    }

    @Test
    @Tag("unit")
    void disabledRuleIsDropped() {
        DiagnosticsEngine engine = new DiagnosticsEngine(
                DiagnosticsConfig.defaults().withDisabled(DiagnosticCode.MISSING_TERMINATOR));

        engine.reportError(DiagnosticCode.MISSING_TERMINATOR, "dropped", new SourceInfo(0, 0, 1));
        engine.reportHint(DiagnosticCode.DUPLICATE_OPERAND, "kept", new SourceInfo(0, 0, 1));

        assertThat(engine.isEnabled(DiagnosticCode.MISSING_TERMINATOR)).isFalse();
        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).singleElement()
                .extracting(Diagnostic::type).isEqualTo(Diagnostic.Type.HINT);
    }

    @Test
    @Tag("unit")
    void findingsAreReadOnly() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportInfo(DiagnosticCode.DEPENDENCY_VIOLATION, "info", new SourceInfo(0, 0, 1));

        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
