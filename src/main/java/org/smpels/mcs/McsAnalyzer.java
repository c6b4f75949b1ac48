package org.smpels.mcs;

import org.smpels.mcs.api.AnalysisResult;
import org.smpels.mcs.api.IMcsAnalyzer;
import org.smpels.mcs.api.SchemaLoadException;
import org.smpels.mcs.diagnostics.DiagnosticsConfig;
import org.smpels.mcs.diagnostics.DiagnosticsEngine;
import org.smpels.mcs.frontend.parser.Parser;
import org.smpels.mcs.frontend.parser.ast.Document;
import org.smpels.mcs.frontend.semantics.SemanticAnalyzer;
import org.smpels.mcs.schema.CatalogSchemaStore;
import org.smpels.mcs.schema.SchemaStore;

import java.util.Objects;

/**
 * The main analyzer implementation. It parses the text into a {@link Document} and runs the
 * semantic analysis over it. The catalog and the rule switches are fixed at construction;
 * every call builds its own document and findings, so one instance can serve several threads.
 */
public class McsAnalyzer implements IMcsAnalyzer {

    private final SchemaStore schema;
    private final DiagnosticsConfig config;
    private final Parser parser;

    /**
     * Creates an analyzer with every rule enabled.
     * @param schema The statement catalog.
     */
    public McsAnalyzer(SchemaStore schema) {
        this(schema, DiagnosticsConfig.defaults());
    }

    /**
     * @param schema The statement catalog.
     * @param config The rule switches.
     */
    public McsAnalyzer(SchemaStore schema, DiagnosticsConfig config) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.config = Objects.requireNonNull(config, "config");
        this.parser = new Parser(schema);
    }

    /**
     * Creates an analyzer over the catalog shipped with this library.
     * @param config The rule switches.
     * @return The analyzer.
     * @throws SchemaLoadException if the bundled catalog cannot be read.
     */
    public static McsAnalyzer withBundledCatalog(DiagnosticsConfig config) throws SchemaLoadException {
        return new McsAnalyzer(CatalogSchemaStore.bundled(), config);
    }

    @Override
    public AnalysisResult analyze(String text) {
        Document document = parse(text);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(config);
        new SemanticAnalyzer(diagnostics).analyze(document);
        return new AnalysisResult(document, diagnostics.getDiagnostics());
    }

    /**
     * Parses the text without validating it.
     * @param text The full document text.
     * @return The document tree.
     */
    public Document parse(String text) {
        return parser.parse(text);
    }

    /**
     * @return The catalog this analyzer interprets statements with.
     */
    public SchemaStore schema() {
        return schema;
    }

    /**
     * @return The rule switches.
     */
    public DiagnosticsConfig config() {
        return config;
    }
}
