package com.dexsentinel.core.dashboard;

/**
 * Processor counters as echoed by the dashboard. {@code alertsGenerated} is
 * the number of alerts currently retained by the alert system, not the
 * processor's lifetime {@code alertsSent}.
 *
 * @since 1.0.0
 */
public final class ProcessingStats {

    private final long totalProcessed;
    private final long anomaliesDetected;
    private final int alertsGenerated;
    private final long processingErrors;
    private final boolean running;

    public ProcessingStats(long totalProcessed, long anomaliesDetected, int alertsGenerated,
            long processingErrors, boolean running) {
        this.totalProcessed = totalProcessed;
        this.anomaliesDetected = anomaliesDetected;
        this.alertsGenerated = alertsGenerated;
        this.processingErrors = processingErrors;
        this.running = running;
    }

    public long getTotalProcessed() {
        return totalProcessed;
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected;
    }

    public int getAlertsGenerated() {
        return alertsGenerated;
    }

    public long getProcessingErrors() {
        return processingErrors;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public String toString() {
        return "ProcessingStats{" +
                "totalProcessed=" + totalProcessed +
                ", anomaliesDetected=" + anomaliesDetected +
                ", alertsGenerated=" + alertsGenerated +
                ", processingErrors=" + processingErrors +
                ", running=" + running +
                '}';
    }
}
