package org.smpels.mcs.schema;

import java.util.List;
import java.util.Optional;

/**
 * Read-only catalog of MCS statement definitions, keyed by statement name.
 * Implementations must be safe for concurrent reads once constructed.
 */
public interface SchemaStore {

    /**
     * Looks up a statement definition by its exact name (e.g. {@code "++USERMOD"}).
     * @param statementName The statement name including the {@code ++} marker.
     * @return The definition, or empty if the catalog has no such statement.
     */
    Optional<StatementDefinition> lookup(String statementName);

    /**
     * @return All definitions in catalog order.
     */
    List<StatementDefinition> statements();
}
