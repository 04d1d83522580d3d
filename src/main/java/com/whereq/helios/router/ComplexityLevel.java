package com.whereq.helios.router;

/**
 * Bucketed task complexity
 */
public enum ComplexityLevel {
    TRIVIAL,
    SIMPLE,
    MODERATE,
    COMPLEX,
    VERY_COMPLEX;

    public static ComplexityLevel of(double score) {
        if (score < 3) {
            return TRIVIAL;
        }
        if (score < 5) {
            return SIMPLE;
        }
        if (score < 7) {
            return MODERATE;
        }
        if (score < 9) {
            return COMPLEX;
        }
        return VERY_COMPLEX;
    }
}
