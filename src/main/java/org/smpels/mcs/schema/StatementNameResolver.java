package org.smpels.mcs.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * Classifies statement names against the catalog, including the national language suffix heuristic.
 * The tree builder and the statement classification rule share this class so both reach the same verdict.
 */
public final class StatementNameResolver {

    private final SchemaStore schema;

    /**
     * @param schema The catalog to resolve against.
     */
    public StatementNameResolver(SchemaStore schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * Resolves a statement name.
     * <ol>
     *   <li>An exact catalog entry is {@link StatementKind#KNOWN}.</li>
     *   <li>A language-capable base plus a valid identifier resolves to the base definition.</li>
     *   <li>A language-capable base plus three other characters is an invalid language identifier.</li>
     *   <li>Everything else is unknown.</li>
     * </ol>
     * @param name The statement name including the marker.
     * @return The classification.
     */
    public ResolvedStatementName resolve(String name) {
        Optional<StatementDefinition> exact = schema.lookup(name);
        if (exact.isPresent()) {
            return new ResolvedStatementName(StatementKind.KNOWN, name, "", exact.get());
        }
        // "++" plus at least one character plus the suffix
        if (name.length() <= 2 + LanguageIdentifiers.SUFFIX_LENGTH) {
            return new ResolvedStatementName(StatementKind.UNKNOWN, name, "", null);
        }
        String base = name.substring(0, name.length() - LanguageIdentifiers.SUFFIX_LENGTH);
        String suffix = name.substring(name.length() - LanguageIdentifiers.SUFFIX_LENGTH);
        Optional<StatementDefinition> baseDefinition = schema.lookup(base);
        boolean variantBase = LanguageIdentifiers.isVariantBase(base)
                || baseDefinition.map(StatementDefinition::acceptsLanguageVariant).orElse(false);
        if (!variantBase) {
            return new ResolvedStatementName(StatementKind.UNKNOWN, name, "", null);
        }
        if (LanguageIdentifiers.isValidLanguageId(suffix)) {
            return baseDefinition
                    .map(def -> new ResolvedStatementName(StatementKind.LANGUAGE_VARIANT, base, suffix, def))
                    .orElseGet(() -> new ResolvedStatementName(StatementKind.UNKNOWN, base, suffix, null));
        }
        return new ResolvedStatementName(StatementKind.INVALID_LANGUAGE_ID, base, suffix, null);
    }
}
