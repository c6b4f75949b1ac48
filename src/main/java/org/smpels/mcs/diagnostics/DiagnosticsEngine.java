package org.smpels.mcs.diagnostics;

import org.smpels.mcs.api.SourceInfo;
import org.smpels.mcs.api.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the findings of one analysis run.
 * <p>
 * This decouples the validation rules from how their results are stored and filtered. Findings
 * whose code is disabled in the configuration are dropped here, so rules do not have to check twice.
 * An engine belongs to one analysis call and is not thread-safe.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final DiagnosticsConfig config;

    /**
     * Creates an engine that keeps every finding.
     */
    public DiagnosticsEngine() {
        this(DiagnosticsConfig.defaults());
    }

    /**
     * @param config The rule switches; findings with a disabled code are ignored.
     */
    public DiagnosticsEngine(DiagnosticsConfig config) {
        this.config = config;
    }

    /**
     * @param code A rule category.
     * @return {@code true} if findings of this category are collected.
     */
    public boolean isEnabled(DiagnosticCode code) {
        return config.isEnabled(code);
    }

    /**
     * Reports an error.
     * @param code     The rule category.
     * @param message  The message.
     * @param position The single-line position the error refers to.
     */
    public void reportError(DiagnosticCode code, String message, SourceInfo position) {
        report(Diagnostic.Type.ERROR, code, message, position.toRange());
    }

    /**
     * Reports a warning.
     * @param code     The rule category.
     * @param message  The message.
     * @param position The single-line position the warning refers to.
     */
    public void reportWarning(DiagnosticCode code, String message, SourceInfo position) {
        report(Diagnostic.Type.WARNING, code, message, position.toRange());
    }

    /**
     * Reports an informational finding.
     * @param code     The rule category.
     * @param message  The message.
     * @param position The single-line position it refers to.
     */
    public void reportInfo(DiagnosticCode code, String message, SourceInfo position) {
        report(Diagnostic.Type.INFO, code, message, position.toRange());
    }

    /**
     * Reports a hint.
     * @param code     The rule category.
     * @param message  The message.
     * @param position The single-line position it refers to.
     */
    public void reportHint(DiagnosticCode code, String message, SourceInfo position) {
        report(Diagnostic.Type.HINT, code, message, position.toRange());
    }

    /**
     * Reports a finding with an explicit range.
     * @param type    The severity.
     * @param code    The rule category.
     * @param message The message.
     * @param range   The range.
     */
    public void report(Diagnostic.Type type, DiagnosticCode code, String message, SourceRange range) {
        if (!config.isEnabled(code)) {
            return;
        }
        diagnostics.add(new Diagnostic(type, code, message, range));
    }

    /**
     * Checks if errors have been reported.
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected findings in report order.
     * @return An unmodifiable list of findings.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected findings as a single, formatted string.
     * @return A formatted string summary of all findings.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
