package org.smpels.mcs.schema;

import java.util.List;
import java.util.Set;

/**
 * Operand names that tell SMP/E where element data comes from instead of inline data.
 * The catalog format has no flag for this, so the set is fixed here.
 */
public final class DataSourceOperands {

    /** Operands naming an external source, in the order they are suggested to users. */
    public static final List<String> EXTERNAL_SOURCES = List.of("FROMDS", "RELFILE", "TXLIB");

    /** Deletion mode removes the element, so no data is expected at all. */
    public static final String DELETE = "DELETE";

    private static final Set<String> CANCELLING = Set.of("FROMDS", "RELFILE", "TXLIB", DELETE);

    private DataSourceOperands() {}

    /**
     * @param operandName An operand name as written in the source.
     * @return {@code true} if its presence means no inline data follows the statement.
     */
    public static boolean cancelsInlineData(String operandName) {
        return CANCELLING.contains(operandName);
    }
}
