package com.dexsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single rule violation produced by evaluating one record.
 *
 * <p>
 * Findings are created fresh on every evaluation and only ever live inside a
 * {@link StreamEvent}; they are never stored on their own.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyFinding implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ruleId;
    private final Severity severity;
    private final String description;

    /** Rule-specific payload, e.g. the list of offending stats. */
    private final Map<String, Object> details;

    public AnomalyFinding(String ruleId, Severity severity, String description,
            Map<String, Object> details) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    public String getRuleId() {
        return ruleId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyFinding that))
            return false;
        return ruleId.equals(that.ruleId)
                && severity == that.severity
                && description.equals(that.description)
                && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, severity, description, details);
    }

    @Override
    public String toString() {
        return "AnomalyFinding{" +
                "ruleId='" + ruleId + '\'' +
                ", severity=" + severity +
                ", description='" + description + '\'' +
                '}';
    }
}
