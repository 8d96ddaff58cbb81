package com.dexsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Level of an {@link Alert}.
 *
 * @since 1.0.0
 */
public enum AlertLevel {

    INFO,
    WARNING,
    CRITICAL;

    /**
     * Look up a level by name, case-insensitively.
     *
     * @param value level name, e.g. {@code "critical"}
     * @return the level, or empty if the name is unknown
     */
    public static Optional<AlertLevel> find(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
