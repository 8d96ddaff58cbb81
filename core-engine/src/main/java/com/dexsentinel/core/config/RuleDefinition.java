package com.dexsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Describes a single anomaly rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code negative_stats}: any stat below zero</li>
 * <li>{@code invalid_type}: a category tag outside the known vocabulary</li>
 * <li>{@code missing_sprite}: both image references empty</li>
 * <li>{@code extreme_stats}: a stat outside {@code [min, max]}</li>
 * <li>{@code missing_data}: blank name, non-positive id or no category
 * tags</li>
 * </ul>
 *
 * <p>
 * {@code severity} and {@code description} are optional; the rule factory
 * falls back to per-type defaults. Call {@link #validate()} after
 * construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Set<String> SUPPORTED_TYPES = Set.of(
            "negative_stats", "invalid_type", "missing_sprite", "extreme_stats", "missing_data");

    private static final Set<String> SEVERITIES = Set.of("low", "medium", "high");

    /** Unique rule id used in findings and alerts. Defaults to the type. */
    private String id;

    private String type;

    /** "low", "medium" or "high". */
    private String severity;

    /** Description template; {@code %s} is replaced by the violations. */
    private String description;

    private boolean enabled = true;

    // --- extreme_stats bounds ---
    private int min = 1;
    private int max = 255;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the declared type is supported and the remaining fields
     * hold legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        } else if (!SUPPORTED_TYPES.contains(type)) {
            errors.add("Unknown rule type: '" + type + "'. Supported: " + String.join(", ",
                    SUPPORTED_TYPES.stream().sorted().toList()));
        }
        if (getId() == null || getId().isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (severity != null && !SEVERITIES.contains(severity)) {
            errors.add("Rule '" + getId() + "' has invalid severity '" + severity
                    + "'. Supported: low, medium, high");
        }
        if ("extreme_stats".equals(type) && min > max) {
            errors.add("Extreme-stats rule '" + getId() + "' requires 'min' <= 'max'");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid RuleDefinition: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    /**
     * @return the configured id, or the type when no id was given
     */
    public String getId() {
        return id != null && !id.isBlank() ? id : type;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity != null ? severity.toLowerCase(Locale.ROOT) : null;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMin() {
        return min;
    }

    public void setMin(int min) {
        this.min = min;
    }

    public int getMax() {
        return max;
    }

    public void setMax(int max) {
        this.max = max;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(getId(), that.getId()) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getId(), type);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "id='" + getId() + '\'' +
                ", type='" + type + '\'' +
                ", severity='" + severity + '\'' +
                ", enabled=" + enabled +
                ", min=" + min +
                ", max=" + max +
                '}';
    }
}
