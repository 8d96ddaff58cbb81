package com.dexsentinel.core.model;

import java.util.Locale;

/**
 * Severity of an {@link AnomalyFinding}, declared by the rule that produced it.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parse a severity name, case-insensitively.
     *
     * @param value severity name, e.g. {@code "high"}
     * @return the matching severity
     * @throws IllegalArgumentException if the value is null or unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
