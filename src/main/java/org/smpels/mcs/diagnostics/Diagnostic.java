package org.smpels.mcs.diagnostics;

import org.smpels.mcs.api.SourceRange;

/**
 * Represents a single finding (error, warning, information, hint)
 * produced while validating an MCS document.
 *
 * @param type    The severity of the finding.
 * @param code    The stable rule category that produced it.
 * @param message The human-readable message.
 * @param range   The source range the finding refers to.
 */
public record Diagnostic(
        Type type,
        DiagnosticCode code,
        String message,
        SourceRange range
) {
    /**
     * The severity of a finding, most severe first.
     */
    public enum Type {
        /** SMP/E rejects the statement. */
        ERROR,
        /** Likely a mistake, but SMP/E may accept it. */
        WARNING,
        /** An informational message. */
        INFO,
        /** A stylistic suggestion. */
        HINT
    }

    @Override
    public String toString() {
        return String.format("[%s] %d:%d: %s (%s)", type, range.startLine() + 1, range.startCharacter() + 1,
                message, code.key());
    }
}
