package com.dexsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time copy of the stream processor's state.
 *
 * <p>
 * {@code processedCount}, {@code anomaliesDetected} and {@code alertsSent}
 * are lifetime counters of the processor instance: they survive stop/start
 * cycles and are not affected by clearing the alert history.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProcessorStatus {

    private final boolean running;
    private final long processedCount;
    private final long anomaliesDetected;
    private final long alertsSent;
    private final long processingErrors;
    private final long droppedEvents;
    private final Instant lastProcessed;
    private final Instant startTime;
    private final int recentEventsCount;
    private final int bufferSize;

    public ProcessorStatus(boolean running, long processedCount, long anomaliesDetected,
            long alertsSent, long processingErrors, long droppedEvents,
            Instant lastProcessed, Instant startTime, int recentEventsCount, int bufferSize) {
        this.running = running;
        this.processedCount = processedCount;
        this.anomaliesDetected = anomaliesDetected;
        this.alertsSent = alertsSent;
        this.processingErrors = processingErrors;
        this.droppedEvents = droppedEvents;
        this.lastProcessed = lastProcessed;
        this.startTime = startTime;
        this.recentEventsCount = recentEventsCount;
        this.bufferSize = bufferSize;
    }

    @JsonProperty("is_running")
    public boolean isRunning() {
        return running;
    }

    public long getProcessedCount() {
        return processedCount;
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected;
    }

    public long getAlertsSent() {
        return alertsSent;
    }

    public long getProcessingErrors() {
        return processingErrors;
    }

    public long getDroppedEvents() {
        return droppedEvents;
    }

    public Instant getLastProcessed() {
        return lastProcessed;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public int getRecentEventsCount() {
        return recentEventsCount;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    @Override
    public String toString() {
        return "ProcessorStatus{" +
                "running=" + running +
                ", processedCount=" + processedCount +
                ", anomaliesDetected=" + anomaliesDetected +
                ", alertsSent=" + alertsSent +
                ", processingErrors=" + processingErrors +
                ", lastProcessed=" + lastProcessed +
                ", startTime=" + startTime +
                '}';
    }
}
