package org.smpels.mcs.schema;

/**
 * How a statement name relates to the catalog.
 */
public enum StatementKind {
    /** The name is a catalog entry. */
    KNOWN,
    /** The name is a catalog base followed by a valid national language suffix. */
    LANGUAGE_VARIANT,
    /** The name is a language-capable base followed by three characters that are no language identifier. */
    INVALID_LANGUAGE_ID,
    /** The name is not in the catalog. */
    UNKNOWN
}
