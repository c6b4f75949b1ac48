package org.smpels.mcs.frontend.semantics.analysis;

import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for one group of rules on a specific type of node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single node.
     * @param node The node to analyze.
     * @param document The document the node belongs to.
     * @param diagnostics The engine for reporting findings.
     */
    void analyze(AstNode node, Document document, DiagnosticsEngine diagnostics);
}
