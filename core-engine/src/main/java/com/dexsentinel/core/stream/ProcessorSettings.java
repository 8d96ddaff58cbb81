package com.dexsentinel.core.stream;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the {@link StreamProcessor}.
 *
 * <p>
 * A zero {@code pollInterval} disables the background store poller; records
 * then only enter through {@link StreamProcessor#ingest} and
 * {@link StreamProcessor#simulate}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProcessorSettings {

    public static final int DEFAULT_EVENT_LOG_CAPACITY = 1000;

    private final int eventLogCapacity;
    private final Duration pollInterval;
    private final Duration lookback;
    private final Duration dedupWindow;

    private ProcessorSettings(Builder b) {
        this.eventLogCapacity = b.eventLogCapacity;
        this.pollInterval = b.pollInterval;
        this.lookback = b.lookback;
        this.dedupWindow = b.dedupWindow;
    }

    public static ProcessorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getEventLogCapacity() {
        return eventLogCapacity;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public boolean isPollingEnabled() {
        return !pollInterval.isZero();
    }

    /** How far back a record's {@code updatedAt} may lie for the poller to pick it up. */
    public Duration getLookback() {
        return lookback;
    }

    /** Minimum time before the poller processes the same record id again. */
    public Duration getDedupWindow() {
        return dedupWindow;
    }

    /**
     * Fluent builder for {@link ProcessorSettings}.
     */
    public static class Builder {
        private int eventLogCapacity = DEFAULT_EVENT_LOG_CAPACITY;
        private Duration pollInterval = Duration.ZERO;
        private Duration lookback = Duration.ofMinutes(5);
        private Duration dedupWindow = Duration.ofMinutes(5);

        public Builder eventLogCapacity(int v) {
            this.eventLogCapacity = v;
            return this;
        }

        public Builder pollInterval(Duration v) {
            this.pollInterval = v;
            return this;
        }

        public Builder lookback(Duration v) {
            this.lookback = v;
            return this;
        }

        public Builder dedupWindow(Duration v) {
            this.dedupWindow = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public ProcessorSettings build() {
            Objects.requireNonNull(pollInterval, "pollInterval required");
            Objects.requireNonNull(lookback, "lookback required");
            Objects.requireNonNull(dedupWindow, "dedupWindow required");
            if (eventLogCapacity < 1) {
                throw new IllegalArgumentException(
                        "eventLogCapacity must be >= 1, got: " + eventLogCapacity);
            }
            if (pollInterval.isNegative() || lookback.isNegative() || dedupWindow.isNegative()) {
                throw new IllegalArgumentException("durations must not be negative");
            }
            return new ProcessorSettings(this);
        }
    }

    @Override
    public String toString() {
        return "ProcessorSettings{" +
                "eventLogCapacity=" + eventLogCapacity +
                ", pollInterval=" + pollInterval +
                ", lookback=" + lookback +
                ", dedupWindow=" + dedupWindow +
                '}';
    }
}
