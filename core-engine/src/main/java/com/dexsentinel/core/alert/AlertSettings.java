package com.dexsentinel.core.alert;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the {@link AlertSystem}.
 *
 * <p>
 * Duplicate suppression and rate limiting are off by default, so every
 * finding becomes exactly one alert.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertSettings {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int historyCapacity;

    /** Window in which an alert with the same title and level is dropped; zero disables. */
    private final Duration duplicateWindow;

    /** Maximum alerts accepted per rolling minute; zero disables. */
    private final int maxAlertsPerMinute;

    private AlertSettings(Builder b) {
        this.historyCapacity = b.historyCapacity;
        this.duplicateWindow = b.duplicateWindow;
        this.maxAlertsPerMinute = b.maxAlertsPerMinute;
    }

    public static AlertSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public Duration getDuplicateWindow() {
        return duplicateWindow;
    }

    public boolean isDuplicateSuppressionEnabled() {
        return !duplicateWindow.isZero();
    }

    public int getMaxAlertsPerMinute() {
        return maxAlertsPerMinute;
    }

    public boolean isRateLimitEnabled() {
        return maxAlertsPerMinute > 0;
    }

    /**
     * Fluent builder for {@link AlertSettings}.
     */
    public static class Builder {
        private int historyCapacity = DEFAULT_CAPACITY;
        private Duration duplicateWindow = Duration.ZERO;
        private int maxAlertsPerMinute;

        public Builder historyCapacity(int v) {
            this.historyCapacity = v;
            return this;
        }

        public Builder duplicateWindow(Duration v) {
            this.duplicateWindow = v;
            return this;
        }

        public Builder maxAlertsPerMinute(int v) {
            this.maxAlertsPerMinute = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public AlertSettings build() {
            Objects.requireNonNull(duplicateWindow, "duplicateWindow required");
            if (historyCapacity < 1) {
                throw new IllegalArgumentException("historyCapacity must be >= 1, got: " + historyCapacity);
            }
            if (duplicateWindow.isNegative()) {
                throw new IllegalArgumentException("duplicateWindow must not be negative");
            }
            if (maxAlertsPerMinute < 0) {
                throw new IllegalArgumentException(
                        "maxAlertsPerMinute must be >= 0, got: " + maxAlertsPerMinute);
            }
            return new AlertSettings(this);
        }
    }

    @Override
    public String toString() {
        return "AlertSettings{" +
                "historyCapacity=" + historyCapacity +
                ", duplicateWindow=" + duplicateWindow +
                ", maxAlertsPerMinute=" + maxAlertsPerMinute +
                '}';
    }
}
