package com.dexsentinel.core.rules;

import com.dexsentinel.core.model.AnomalyFinding;
import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.model.Severity;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A registered anomaly rule: id, type, severity, description template and
 * the check that decides whether it fires.
 *
 * <p>
 * A rule produces at most one finding per evaluation. The description
 * template may contain {@code %s}, which is replaced by the
 * comma-separated violations; no other format syntax is interpreted. Rules are immutable; {@link #withEnabled(boolean)}
 * returns a copy.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRule {

    private final String id;
    private final String type;
    private final Severity severity;
    private final String descriptionTemplate;
    private final boolean enabled;
    private final RuleCheck check;

    public AnomalyRule(String id, String type, Severity severity, String descriptionTemplate,
            boolean enabled, RuleCheck check) {
        this.id = requireNonBlank(id, "id");
        this.type = requireNonBlank(type, "type");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.descriptionTemplate = requireNonBlank(descriptionTemplate, "descriptionTemplate");
        this.enabled = enabled;
        this.check = Objects.requireNonNull(check, "check must not be null");
    }

    /**
     * Evaluate the rule against a record.
     *
     * @param record the record to inspect; must not be {@code null}
     * @return a finding if the check reports violations, empty otherwise or
     *         when the rule is disabled
     */
    public Optional<AnomalyFinding> evaluate(CreatureRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        if (!enabled) {
            return Optional.empty();
        }
        List<String> violations = check.violations(record);
        if (violations == null || violations.isEmpty()) {
            return Optional.empty();
        }
        // literal substitution, other '%' characters in the template are kept as-is
        String description = descriptionTemplate.replace("%s", String.join(", ", violations));
        return Optional.of(new AnomalyFinding(id, severity, description,
                Map.of("violations", List.copyOf(violations))));
    }

    public AnomalyRule withEnabled(boolean enabled) {
        return new AnomalyRule(id, type, severity, descriptionTemplate, enabled, check);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescriptionTemplate() {
        return descriptionTemplate;
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    @Override
    public String toString() {
        return "AnomalyRule{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", severity=" + severity +
                ", enabled=" + enabled +
                '}';
    }
}
