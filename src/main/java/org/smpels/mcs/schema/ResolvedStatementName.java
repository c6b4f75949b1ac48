package org.smpels.mcs.schema;

/**
 * The result of matching a statement name against the catalog.
 *
 * @param kind       The classification.
 * @param baseName   The name without language suffix (equal to the full name when there is none).
 * @param languageId The three-character suffix, or the empty string.
 * @param definition The resolved definition, or {@code null} unless {@code kind} is KNOWN or LANGUAGE_VARIANT.
 */
public record ResolvedStatementName(
        StatementKind kind,
        String baseName,
        String languageId,
        StatementDefinition definition
) {

    /**
     * @return {@code true} if a definition was found.
     */
    public boolean isRecognized() {
        return definition != null;
    }
}
