package com.dexsentinel.core.rules;

import com.dexsentinel.core.config.RuleDefinition;
import com.dexsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyRule} instances from
 * {@link RuleDefinition} configurations.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the type string here together with its check and defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFactory.class);

    private RuleFactory() {
        // utility class; not instantiable
    }

    /**
     * Create a rule for the given definition.
     *
     * @param definition the rule configuration; must not be {@code null}
     * @param vocabulary known category tags, used by {@code invalid_type}
     * @return the rule, enabled or disabled as configured
     * @throws NullPointerException     if an argument or the type is {@code null}
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static AnomalyRule create(RuleDefinition definition, TypeVocabulary vocabulary) {
        Objects.requireNonNull(definition, "RuleDefinition must not be null");
        Objects.requireNonNull(vocabulary, "TypeVocabulary must not be null");
        String type = Objects.requireNonNull(definition.getType(), "Rule type must not be null");

        RuleCheck check;
        Severity defaultSeverity;
        String defaultDescription;
        switch (type) {
            case "negative_stats" -> {
                check = BuiltInChecks.negativeStats();
                defaultSeverity = Severity.HIGH;
                defaultDescription = "Negative stats detected: %s";
            }
            case "invalid_type" -> {
                check = BuiltInChecks.invalidTypes(vocabulary);
                defaultSeverity = Severity.MEDIUM;
                defaultDescription = "Unknown category tags: %s";
            }
            case "missing_sprite" -> {
                check = BuiltInChecks.missingSprite();
                defaultSeverity = Severity.LOW;
                defaultDescription = "No image reference populated: %s";
            }
            case "extreme_stats" -> {
                check = BuiltInChecks.extremeStats(definition.getMin(), definition.getMax());
                defaultSeverity = Severity.MEDIUM;
                defaultDescription = "Extreme stats detected: %s";
            }
            case "missing_data" -> {
                check = BuiltInChecks.missingData();
                defaultSeverity = Severity.HIGH;
                defaultDescription = "Mandatory data missing: %s";
            }
            default -> throw new IllegalArgumentException(
                    "Unknown rule type: '" + type + "'. Supported types: "
                            + String.join(", ", RuleDefinition.SUPPORTED_TYPES.stream().sorted().toList()));
        }

        Severity severity = definition.getSeverity() != null
                ? Severity.parse(definition.getSeverity())
                : defaultSeverity;
        String description = definition.getDescription() != null && !definition.getDescription().isBlank()
                ? definition.getDescription()
                : defaultDescription;

        return new AnomalyRule(definition.getId(), type, severity, description,
                definition.isEnabled(), check);
    }

    /**
     * Create rules for every definition, preserving order.
     *
     * @param definitions rule configurations; must not be {@code null}
     * @param vocabulary  known category tags
     * @return unmodifiable list of rules (one per definition)
     */
    public static List<AnomalyRule> createAll(List<RuleDefinition> definitions, TypeVocabulary vocabulary) {
        Objects.requireNonNull(definitions, "Rule definitions must not be null");
        LOG.info("Creating {} anomaly rule(s) from configuration", definitions.size());
        return definitions.stream()
                .map(definition -> create(definition, vocabulary))
                .toList();
    }

    /**
     * The three rules every deployment starts with when no configuration is
     * supplied: {@code negative_stats}, {@code invalid_type},
     * {@code missing_sprite}.
     */
    public static List<AnomalyRule> defaults(TypeVocabulary vocabulary) {
        return List.of(
                create(definition("negative_stats"), vocabulary),
                create(definition("invalid_type"), vocabulary),
                create(definition("missing_sprite"), vocabulary));
    }

    private static RuleDefinition definition(String type) {
        RuleDefinition definition = new RuleDefinition();
        definition.setType(type);
        return definition;
    }
}
