package com.cvrfplatform.common.model;

public enum ImpactDirection {
    POSITIVE,
    NEGATIVE;

    /** +1 for {@link #POSITIVE}, -1 for {@link #NEGATIVE}. */
    public int sign() {
        return this == POSITIVE ? 1 : -1;
    }

    public static ImpactDirection of(double value) {
        return value >= 0 ? POSITIVE : NEGATIVE;
    }
}
