package org.smpels.mcs.schema;

import java.util.List;
import java.util.Set;

/**
 * The national language identifiers of the SMP/E reference and the statement bases that may carry one.
 * This table is fixed by the product and not part of the statement catalog.
 */
public final class LanguageIdentifiers {

    /** Length of every language suffix. */
    public static final int SUFFIX_LENGTH = 3;

    private static final List<String> IDENTIFIERS = List.of(
            "ARA", "CHS", "CHT", "DAN", "DES", "DEU", "ELL", "ENG",
            "ENP", "ENU", "ESP", "FIN", "FRA", "FRB", "FRC", "FRS",
            "HEB", "ISL", "ITA", "ITS", "JPN", "KOR", "NLB", "NLD",
            "NOR", "PTB", "PTG", "RMS", "RUS", "SVE", "THA", "TRK"
    );

    private static final Set<String> IDENTIFIER_SET = Set.copyOf(IDENTIFIERS);

    private static final Set<String> VARIANT_BASES = Set.of(
            "++BOOK", "++BSIND", "++CGM", "++DATA6", "++FONT",
            "++GDF", "++HELP", "++IMG", "++MSG", "++PNL",
            "++PROBJ", "++PRSRC", "++PSEG", "++PUBLB", "++SAMP",
            "++SKL", "++TBL", "++TEXT", "++UTIN", "++UTOUT"
    );

    private LanguageIdentifiers() {}

    /**
     * @param id A three-letter candidate.
     * @return {@code true} if it is one of the national language identifiers.
     */
    public static boolean isValidLanguageId(String id) {
        return id != null && IDENTIFIER_SET.contains(id);
    }

    /**
     * @param baseName A statement name without suffix, e.g. {@code ++SAMP}.
     * @return {@code true} if the fixed table lists it as accepting a language suffix.
     */
    public static boolean isVariantBase(String baseName) {
        return baseName != null && VARIANT_BASES.contains(baseName);
    }

    /**
     * @return All identifiers in reference order.
     */
    public static List<String> identifiers() {
        return IDENTIFIERS;
    }

    /**
     * Generates every suffixed name of a base, e.g. {@code ++SAMPARA ... ++SAMPTRK}.
     * @param baseName The statement base.
     * @return The variants, or just the base if it accepts no suffix.
     */
    public static List<String> variantsOf(String baseName) {
        if (!isVariantBase(baseName)) {
            return List.of(baseName);
        }
        return IDENTIFIERS.stream().map(id -> baseName + id).toList();
    }
}
