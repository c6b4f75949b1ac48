package org.smpels.mcs.frontend.semantics.analysis;

import java.util.List;
import java.util.Map;

/**
 * Operands a statement must carry, for the cases the catalog format cannot express.
 * Keyed by the catalog name of the statement (without language suffix).
 */
public final class RequiredOperandTable {

    private static final Map<String, List<String>> REQUIRED = Map.of(
            "++ASSIGN", List.of("SOURCEID", "TO"),
            "++IF", List.of("FMID", "REQ"),
            "++DELETE", List.of("SYSLIB"),
            "++MOD", List.of("DISTLIB"),
            "++SRC", List.of("DISTLIB"),
            "++RENAME", List.of("TONAME"),
            "++PRODUCT", List.of("DESCRIPTION", "SREL"),
            "++PROGRAM", List.of("DISTLIB"),
            "++RELEASE", List.of("FMID", "REASON")
    );

    private RequiredOperandTable() {}

    /**
     * @param statementName The catalog name, e.g. {@code ++ASSIGN}.
     * @return The primary names of the required operands, empty if the statement has no such policy.
     */
    public static List<String> requiredOperands(String statementName) {
        return REQUIRED.getOrDefault(statementName, List.of());
    }
}
