package com.dexsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * knownTypes: [normal, fire, water]
 * rules:
 *   - id: negative_stats
 *     type: negative_stats
 *     severity: high
 * </pre>
 *
 * <p>
 * When {@code knownTypes} is omitted the built-in vocabulary is used.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> knownTypes = new ArrayList<>();

    private List<RuleDefinition> rules = new ArrayList<>();

    /**
     * @return unmodifiable list of configured category tags; empty means
     *         "use the default vocabulary"
     */
    public List<String> getKnownTypes() {
        return Collections.unmodifiableList(knownTypes);
    }

    public void setKnownTypes(List<String> knownTypes) {
        this.knownTypes = knownTypes != null ? new ArrayList<>(knownTypes) : new ArrayList<>();
    }

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of rule definitions
     */
    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the rule definitions
     */
    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule, reject duplicate rule ids and blank category tags.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < knownTypes.size(); i++) {
            String type = knownTypes.get(i);
            if (type == null || type.isBlank()) {
                errors.add("knownTypes entry at index " + i + " is blank");
            }
        }

        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
                if (!ids.add(rule.getId())) {
                    errors.add("Duplicate rule id: '" + rule.getId() + "'");
                }
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{knownTypes=" + knownTypes + ", rules=" + rules + '}';
    }
}
