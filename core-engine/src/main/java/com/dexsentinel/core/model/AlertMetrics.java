package com.dexsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the alert system's counters, consistent with the history it
 * was taken from.
 *
 * @since 1.0.0
 */
public final class AlertMetrics {

    private final int totalAlerts;
    private final Instant lastAlert;
    private final Map<AlertLevel, Integer> alertsByLevel;
    private final long suppressedAlerts;
    private final long rateLimitedAlerts;
    private final long droppedAlerts;
    private final int bufferCapacity;
    private final List<String> enabledChannels;

    public AlertMetrics(int totalAlerts, Instant lastAlert, Map<AlertLevel, Integer> alertsByLevel,
            long suppressedAlerts, long rateLimitedAlerts, long droppedAlerts,
            int bufferCapacity, List<String> enabledChannels) {
        this.totalAlerts = totalAlerts;
        this.lastAlert = lastAlert;
        EnumMap<AlertLevel, Integer> levels = new EnumMap<>(AlertLevel.class);
        for (AlertLevel level : AlertLevel.values()) {
            levels.put(level, alertsByLevel.getOrDefault(level, 0));
        }
        this.alertsByLevel = Collections.unmodifiableMap(levels);
        this.suppressedAlerts = suppressedAlerts;
        this.rateLimitedAlerts = rateLimitedAlerts;
        this.droppedAlerts = droppedAlerts;
        this.bufferCapacity = bufferCapacity;
        this.enabledChannels = List.copyOf(enabledChannels);
    }

    /**
     * @return number of alerts currently retained in the history
     */
    public int getTotalAlerts() {
        return totalAlerts;
    }

    /**
     * @return timestamp of the newest retained alert, or {@code null}
     */
    public Instant getLastAlert() {
        return lastAlert;
    }

    public Map<AlertLevel, Integer> getAlertsByLevel() {
        return alertsByLevel;
    }

    public long getSuppressedAlerts() {
        return suppressedAlerts;
    }

    public long getRateLimitedAlerts() {
        return rateLimitedAlerts;
    }

    /**
     * @return alerts evicted from the history because it was full
     */
    public long getDroppedAlerts() {
        return droppedAlerts;
    }

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public List<String> getEnabledChannels() {
        return enabledChannels;
    }

    @Override
    public String toString() {
        return "AlertMetrics{" +
                "totalAlerts=" + totalAlerts +
                ", lastAlert=" + lastAlert +
                ", alertsByLevel=" + alertsByLevel +
                '}';
    }
}
