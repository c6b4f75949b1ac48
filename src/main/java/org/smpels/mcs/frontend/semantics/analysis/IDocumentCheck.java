package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.Document;

/**
 * A rule that looks at the document as a whole rather than at one statement.
 */
@FunctionalInterface
public interface IDocumentCheck {
    /**
     * Runs the check.
     * @param document The parsed document.
     * @param diagnostics The engine for reporting findings.
     */
    void check(Document document, DiagnosticsEngine diagnostics);
}
