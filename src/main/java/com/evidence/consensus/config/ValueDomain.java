package com.evidence.consensus.config;

/**
 * Closed interval of plausible values for one value kind.
 */
public record ValueDomain(double min, double max) {

    public ValueDomain {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Domain bounds must be numbers");
        }
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max, got [" + min + ", " + max + "]");
        }
    }

    public static ValueDomain nonNegative() {
        return new ValueDomain(0.0, Double.POSITIVE_INFINITY);
    }

    public static ValueDomain percentage() {
        return new ValueDomain(0.0, 100.0);
    }

    /**
     * Returns true if the value is finite and within [min, max].
     */
    public boolean contains(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value) && value >= min && value <= max;
    }

    public String describe() {
        return Double.isInfinite(max) ? "[" + format(min) + ", +inf)" : "[" + format(min) + ", " + format(max) + "]";
    }

    private static String format(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
