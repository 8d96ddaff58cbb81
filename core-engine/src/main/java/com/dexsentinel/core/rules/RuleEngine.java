package com.dexsentinel.core.rules;

import com.dexsentinel.core.model.AnomalyFinding;
import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.model.RecordValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Evaluates a record against the registered anomaly rules.
 *
 * <h3>Rule set</h3>
 * <p>
 * Rules are kept in registration order in an immutable map that is swapped
 * atomically on every change (copy-on-write). An evaluation therefore always
 * sees one complete rule set, never a half-applied reconfiguration.
 * Re-registering an existing id replaces the rule in place, keeping its
 * original position.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * For a fixed record and rule set, {@link #evaluate(CreatureRecord)} returns
 * equal findings in rule registration order on every call.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final AtomicReference<Map<String, AnomalyRule>> rules =
            new AtomicReference<>(Collections.emptyMap());

    private final TypeVocabulary vocabulary;

    public RuleEngine(List<AnomalyRule> initialRules, TypeVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
        reconfigure(initialRules);
    }

    /**
     * Engine with the default rules and vocabulary.
     */
    public static RuleEngine withDefaults() {
        return new RuleEngine(RuleFactory.defaults(TypeVocabulary.DEFAULT), TypeVocabulary.DEFAULT);
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate one record.
     *
     * @param record the record; never mutated
     * @return findings in rule registration order; empty if the record is clean
     * @throws RecordValidationException if the record is {@code null} or has no
     *                                   id or name
     */
    public List<AnomalyFinding> evaluate(CreatureRecord record) {
        requireIdentity(record);

        List<AnomalyFinding> findings = new ArrayList<>();
        for (AnomalyRule rule : rules.get().values()) {
            try {
                rule.evaluate(record).ifPresent(findings::add);
            } catch (RuntimeException e) {
                LOG.error("Rule [{}] threw while evaluating '{}' - continuing with next rule",
                        rule.getId(), record.getName(), e);
            }
        }
        return Collections.unmodifiableList(findings);
    }

    // ---------------------------------------------------------------
    // Reconfiguration
    // ---------------------------------------------------------------

    /**
     * Add a rule, or replace the rule with the same id.
     */
    public void register(AnomalyRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        update(current -> {
            Map<String, AnomalyRule> next = new LinkedHashMap<>(current);
            next.put(rule.getId(), rule);
            return next;
        });
        LOG.info("Registered rule {}", rule);
    }

    /**
     * Remove a rule by id.
     *
     * @return {@code true} if a rule was removed
     */
    public boolean remove(String ruleId) {
        Map<String, AnomalyRule> previous = update(current -> {
            Map<String, AnomalyRule> next = new LinkedHashMap<>(current);
            next.remove(ruleId);
            return next;
        });
        boolean removed = previous.containsKey(ruleId);
        if (removed) {
            LOG.info("Removed rule [{}]", ruleId);
        }
        return removed;
    }

    /**
     * Replace the whole rule set in one step. Later duplicates of an id win.
     */
    public void reconfigure(List<AnomalyRule> newRules) {
        Objects.requireNonNull(newRules, "rules must not be null");
        Map<String, AnomalyRule> next = new LinkedHashMap<>();
        for (AnomalyRule rule : newRules) {
            next.put(Objects.requireNonNull(rule, "rule must not be null").getId(), rule);
        }
        rules.set(Collections.unmodifiableMap(next));
        LOG.info("Rule set configured with {} rule(s): {}", next.size(), next.keySet());
    }

    /**
     * Enable or disable a registered rule.
     *
     * @return {@code true} if the rule exists
     */
    public boolean setEnabled(String ruleId, boolean enabled) {
        Map<String, AnomalyRule> previous = update(current -> {
            AnomalyRule rule = current.get(ruleId);
            if (rule == null) {
                return current;
            }
            Map<String, AnomalyRule> next = new LinkedHashMap<>(current);
            next.put(ruleId, rule.withEnabled(enabled));
            return next;
        });
        boolean found = previous.containsKey(ruleId);
        if (found) {
            LOG.info("Rule [{}] {}", ruleId, enabled ? "enabled" : "disabled");
        }
        return found;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Optional<AnomalyRule> rule(String ruleId) {
        return Optional.ofNullable(rules.get().get(ruleId));
    }

    /**
     * @return snapshot of the registered rules, in registration order
     */
    public List<AnomalyRule> rules() {
        return List.copyOf(rules.get().values());
    }

    public TypeVocabulary vocabulary() {
        return vocabulary;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Map<String, AnomalyRule> update(UnaryOperator<Map<String, AnomalyRule>> change) {
        return rules.getAndUpdate(current -> Collections.unmodifiableMap(change.apply(current)));
    }

    private static void requireIdentity(CreatureRecord record) {
        if (record == null) {
            throw new RecordValidationException("Record must not be null");
        }
        if (record.getId() == null) {
            throw new RecordValidationException("Record '" + record.getName() + "' has no id");
        }
        if (record.getName() == null) {
            throw new RecordValidationException("Record #" + record.getId() + " has no name");
        }
    }
}
