package org.smpels.mcs.frontend.semantics;

import org.smpels.mcs.diagnostics.AnalysisLogger;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.TreeWalker;
import org.smpels.mcs.frontend.parser.ast.AstNode;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.parser.ast.StatementNode;
import org.smpels.mcs.frontend.semantics.analysis.ColumnWidthCheck;
import org.smpels.mcs.frontend.semantics.analysis.IAnalysisHandler;
import org.smpels.mcs.frontend.semantics.analysis.IDocumentCheck;
import org.smpels.mcs.frontend.semantics.analysis.MissingInlineDataCheck;
import org.smpels.mcs.frontend.semantics.analysis.MoveStatementHandler;
import org.smpels.mcs.frontend.semantics.analysis.OperandAnalysisHandler;
import org.smpels.mcs.frontend.semantics.analysis.OperandPolicyHandler;
import org.smpels.mcs.frontend.semantics.analysis.RequiredOperandHandler;
import org.smpels.mcs.frontend.semantics.analysis.StandaloneCommentCheck;
import org.smpels.mcs.frontend.semantics.analysis.StatementClassificationHandler;
import org.smpels.mcs.frontend.semantics.analysis.StatementStructureHandler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Validates a parsed document. It walks the tree, dispatching each node to the handlers registered
 * for its class in registration order, and then runs the whole-document checks.
 * Handler order matters: earlier findings decide whether later ones are reported.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final Map<Class<? extends AstNode>, List<IAnalysisHandler>> handlers = new HashMap<>();
    private final List<IDocumentCheck> documentChecks = new ArrayList<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting findings.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        register(StatementNode.class, new StatementClassificationHandler());
        register(StatementNode.class, new StatementStructureHandler());
        register(StatementNode.class, new OperandAnalysisHandler());
        register(StatementNode.class, new RequiredOperandHandler());
        register(StatementNode.class, new OperandPolicyHandler());
        register(StatementNode.class, new MoveStatementHandler());

        documentChecks.add(new MissingInlineDataCheck());
        documentChecks.add(new ColumnWidthCheck());
        documentChecks.add(new StandaloneCommentCheck());
    }

    /**
     * Adds a handler for a node class. It runs after the handlers already registered for that class.
     * @param nodeClass The node class.
     * @param handler The handler.
     */
    public void register(Class<? extends AstNode> nodeClass, IAnalysisHandler handler) {
        handlers.computeIfAbsent(nodeClass, k -> new ArrayList<>()).add(handler);
    }

    /**
     * Adds a whole-document check. It runs after the checks already registered.
     * @param check The check.
     */
    public void register(IDocumentCheck check) {
        documentChecks.add(check);
    }

    /**
     * Analyzes the given document.
     * @param document The parsed document.
     */
    public void analyze(Document document) {
        Map<Class<? extends AstNode>, Consumer<AstNode>> dispatch = new HashMap<>();
        for (Map.Entry<Class<? extends AstNode>, List<IAnalysisHandler>> entry : handlers.entrySet()) {
            List<IAnalysisHandler> chain = entry.getValue();
            dispatch.put(entry.getKey(), node -> {
                for (IAnalysisHandler handler : chain) {
                    handler.analyze(node, document, diagnostics);
                }
            });
        }
        new TreeWalker(dispatch).walk(document.statements());

        for (IDocumentCheck check : documentChecks) {
            check.check(document, diagnostics);
        }
        AnalysisLogger.debug("Analyzed {} statements: {} findings",
                document.statements().size(), diagnostics.getDiagnostics().size());
    }
}
