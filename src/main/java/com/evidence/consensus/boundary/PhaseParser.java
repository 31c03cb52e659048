package com.evidence.consensus.boundary;

import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.DevelopmentStatus;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps free-text phase and status strings from extractors onto the typed enums.
 *
 * <p>Patterns are checked from most to least advanced, so combined phases resolve upward
 * ("Phase 2/3" is Phase 3, "Phase 1/2" is Phase 2).</p>
 */
public final class PhaseParser {

    private static final Pattern APPROVED = Pattern.compile("approved|market");
    private static final Pattern FILING = Pattern.compile("\\b(nda|bla|maa|regulatory|filing|filed|submitted)\\b");
    private static final Pattern PHASE_3 = Pattern.compile("phase\\s*(?:[12]\\s*/\\s*)?(?:3|iii)[ab]?\\b|^iii$");
    private static final Pattern PHASE_2 = Pattern.compile("phase\\s*(?:1\\s*/\\s*)?(?:2|ii)[ab]?\\b|^ii$");
    private static final Pattern PHASE_1 = Pattern.compile("phase\\s*(?:0|1|i)[ab]?\\b|^i$");
    private static final Pattern PRECLINICAL = Pattern.compile("pre\\s*-?\\s*clinical|discovery");

    private static final Pattern DISCONTINUED = Pattern.compile("discontinu|terminat|withdrawn|abandon");
    private static final Pattern FAILED = Pattern.compile("\\bfail");
    private static final Pattern ON_HOLD = Pattern.compile("on\\s*hold|suspend|paused");
    private static final Pattern ACTIVE = Pattern.compile("\\b(active|ongoing|recruiting|approved|marketed)\\b");

    private PhaseParser() {
        // Utility class
    }

    /**
     * Parses a phase; missing or unrecognized text is {@link DevelopmentPhase#UNKNOWN}.
     */
    public static DevelopmentPhase parsePhase(String text) {
        String value = clean(text);
        if (value.isEmpty()) {
            return DevelopmentPhase.UNKNOWN;
        }
        for (DevelopmentPhase phase : DevelopmentPhase.values()) {
            if (phase.name().equalsIgnoreCase(value.replace(' ', '_'))) {
                return phase;
            }
        }
        if (APPROVED.matcher(value).find()) {
            return DevelopmentPhase.APPROVED;
        }
        if (FILING.matcher(value).find()) {
            return DevelopmentPhase.REGULATORY_FILING;
        }
        if (PHASE_3.matcher(value).find()) {
            return DevelopmentPhase.PHASE_3;
        }
        if (PHASE_2.matcher(value).find()) {
            return DevelopmentPhase.PHASE_2;
        }
        if (PHASE_1.matcher(value).find()) {
            return DevelopmentPhase.PHASE_1;
        }
        if (PRECLINICAL.matcher(value).find()) {
            return DevelopmentPhase.PRECLINICAL;
        }
        return DevelopmentPhase.UNKNOWN;
    }

    /**
     * Parses a development status; empty when the text names none.
     */
    public static Optional<DevelopmentStatus> parseStatus(String text) {
        String value = clean(text);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (ON_HOLD.matcher(value).find()) {
            return Optional.of(DevelopmentStatus.ON_HOLD);
        }
        if (FAILED.matcher(value).find()) {
            return Optional.of(DevelopmentStatus.FAILED);
        }
        if (DISCONTINUED.matcher(value).find()) {
            return Optional.of(DevelopmentStatus.DISCONTINUED);
        }
        if (ACTIVE.matcher(value).find()) {
            return Optional.of(DevelopmentStatus.ACTIVE);
        }
        return Optional.empty();
    }

    private static String clean(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).replace('_', ' ').trim().replaceAll("\\s+", " ");
    }
}
