package com.dexsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Leveled, human-readable notification held in the alert history.
 *
 * <p>
 * Alerts are derived from an {@link AnomalyFinding} through the severity
 * table of the alert system, or issued manually at an explicit level. They
 * are immutable; the only way to remove one is to clear the history.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code level}, {@code title} and {@code timestamp} are present; omitting any
 * of them will throw a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Sequence number assigned by the alert system, unique per instance. */
    private final long id;

    private final Instant timestamp;

    private final AlertLevel level;

    private final String title;

    private final String message;

    /** Defensive copy of the structured details, or {@code null}. */
    private final Map<String, Object> details;

    private Alert(Builder builder) {
        this.id = builder.id;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.level = Objects.requireNonNull(builder.level, "level must not be null");
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.message = builder.message;
        // Defensive copy to prevent mutation by callers
        this.details = builder.details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.details))
                : null;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private long id;
        private Instant timestamp;
        private AlertLevel level;
        private String title;
        private String message;
        private Map<String, Object> details;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code timestamp}, {@code level} or
         *                              {@code title} is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return unmodifiable details map, or {@code null} if none were given
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id == alert.id
                && level == alert.level
                && Objects.equals(title, alert.title)
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, level, title, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id=" + id +
                ", level=" + level +
                ", title='" + title + '\'' +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                '}';
    }
}
