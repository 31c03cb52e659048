package com.evidence.consensus.rules;

/**
 * Kind of name a normalization rule applies to.
 */
public enum NameKind {
    /**
     * Generic or brand name ("Upadacitinib", "Benlysta").
     */
    GENERIC_NAME,

    /**
     * Internal development code ("MEDI-545", "BMS-986165").
     */
    DEVELOPMENT_CODE
}
