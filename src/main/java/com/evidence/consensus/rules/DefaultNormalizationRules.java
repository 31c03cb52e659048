package com.evidence.consensus.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in normalization rules for drug names and development codes.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>(getNameRules());
        rules.addAll(getCodeRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Rules for generic and brand names. The identity key of a name is its lowercased,
     * trimmed form, so only marks that never carry meaning are removed.
     */
    public static List<NormalizationRule> getNameRules() {
        return List.of(
                NormalizationRule.of("name-trademark-marks", "[\\u00AE\\u2122\\u00A9]", "", 10,
                        NameKind.GENERIC_NAME),
                // Non-breaking and other unicode spaces
                NormalizationRule.of("name-unicode-spaces", "[\\u00A0\\u2007\\u202F]", " ", 20,
                        NameKind.GENERIC_NAME)
        );
    }

    /**
     * Rules for development codes: "MEDI-545", "medi 545" and "MEDI545" all normalize to "medi545".
     * Letters outside ASCII are kept ("α-interferon" becomes "αinterferon").
     */
    public static List<NormalizationRule> getCodeRules() {
        return List.of(
                NormalizationRule.of("code-strip-separators", "[^\\p{L}\\p{N}]", "", 10,
                        NameKind.DEVELOPMENT_CODE)
        );
    }
}
