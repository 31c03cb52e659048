package com.evidence.consensus.core.model;

import java.util.Comparator;

/**
 * Details of a terminal development status.
 *
 * @param date         partial ISO date of the event ("2022", "2022-03", "2022-03-15"), may be null
 * @param reason       stated reason ("Lack of efficacy", "Strategic", "Safety"), may be null
 * @param failureStage phase in which the program stopped, may be null
 */
public record StatusDetail(String date, String reason, DevelopmentPhase failureStage) {

    /**
     * Orders details by date: a later date is greater; on a shared prefix the more specific
     * date is greater ("2022-03" &gt; "2022"); a missing date sorts first.
     */
    public static final Comparator<StatusDetail> BY_DATE =
            Comparator.comparing(StatusDetail::dateParts, StatusDetail::compareParts);

    public StatusDetail {
        date = date != null && !date.isBlank() ? date.trim() : null;
        reason = reason != null && !reason.isBlank() ? reason.trim() : null;
    }

    public static StatusDetail of(String date, String reason) {
        return new StatusDetail(date, reason, null);
    }

    /**
     * Returns true if this detail is strictly later or more specific than the other.
     */
    public boolean isAfter(StatusDetail other) {
        if (other == null) {
            return true;
        }
        return BY_DATE.compare(this, other) > 0;
    }

    private int[] dateParts() {
        if (date == null) {
            return new int[0];
        }
        String[] tokens = date.split("[-/.]");
        int[] parts = new int[Math.min(tokens.length, 3)];
        for (int i = 0; i < parts.length; i++) {
            try {
                parts[i] = Integer.parseInt(tokens[i].trim());
            } catch (NumberFormatException e) {
                int[] truncated = new int[i];
                System.arraycopy(parts, 0, truncated, 0, i);
                return truncated;
            }
        }
        return parts;
    }

    private static int compareParts(int[] a, int[] b) {
        int common = Math.min(a.length, b.length);
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(a[i], b[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.length, b.length);
    }
}
