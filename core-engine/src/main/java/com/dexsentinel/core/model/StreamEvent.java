package com.dexsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of pushing one record through the stream processor.
 *
 * <p>
 * Findings keep the order in which the rules were registered with the engine.
 * Events are read-only once created.
 * </p>
 *
 * @since 1.0.0
 */
public final class StreamEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final Integer recordId;
    private final String recordName;
    private final List<AnomalyFinding> findings;

    public StreamEvent(Instant timestamp, Integer recordId, String recordName,
            List<AnomalyFinding> findings) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.recordId = recordId;
        this.recordName = recordName;
        this.findings = List.copyOf(Objects.requireNonNull(findings, "findings must not be null"));
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Integer getRecordId() {
        return recordId;
    }

    public String getRecordName() {
        return recordName;
    }

    public int getAnomaliesCount() {
        return findings.size();
    }

    public List<AnomalyFinding> getFindings() {
        return findings;
    }

    @Override
    public String toString() {
        return "StreamEvent{" +
                "timestamp=" + timestamp +
                ", recordId=" + recordId +
                ", recordName='" + recordName + '\'' +
                ", findings=" + findings +
                '}';
    }
}
