package com.dexsentinel.core.rules;

import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.model.StatBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stock {@link RuleCheck} implementations, one per built-in rule type.
 *
 * @since 1.0.0
 */
public final class BuiltInChecks {

    private BuiltInChecks() {
        // utility class; not instantiable
    }

    /**
     * Reports every stat below zero as {@code name=value}.
     */
    public static RuleCheck negativeStats() {
        return record -> {
            List<String> violations = new ArrayList<>();
            for (Map.Entry<String, Integer> stat : stats(record).entrySet()) {
                if (stat.getValue() != null && stat.getValue() < 0) {
                    violations.add(stat.getKey() + "=" + stat.getValue());
                }
            }
            return violations;
        };
    }

    /**
     * Reports every category tag that is not in {@code vocabulary}.
     */
    public static RuleCheck invalidTypes(TypeVocabulary vocabulary) {
        Objects.requireNonNull(vocabulary, "vocabulary must not be null");
        return record -> record.getTypes().stream()
                .filter(type -> !vocabulary.contains(type))
                .toList();
    }

    /**
     * Fires when neither image reference is populated.
     */
    public static RuleCheck missingSprite() {
        return record -> isBlank(record.getSpriteFront()) && isBlank(record.getSpriteShiny())
                ? List.of("sprite_front", "sprite_shiny")
                : List.of();
    }

    /**
     * Reports every stat outside {@code [min, max]}.
     */
    public static RuleCheck extremeStats(int min, int max) {
        return record -> {
            List<String> violations = new ArrayList<>();
            for (Map.Entry<String, Integer> stat : stats(record).entrySet()) {
                Integer value = stat.getValue();
                if (value != null && (value < min || value > max)) {
                    violations.add(stat.getKey() + "=" + value + " (outside " + min + "-" + max + ")");
                }
            }
            return violations;
        };
    }

    /**
     * Reports missing mandatory data: blank name, non-positive id, no
     * category tags.
     */
    public static RuleCheck missingData() {
        return record -> {
            List<String> violations = new ArrayList<>();
            if (isBlank(record.getName())) {
                violations.add("name");
            }
            if (record.getId() == null || record.getId() <= 0) {
                violations.add("id");
            }
            if (record.getTypes().isEmpty()) {
                violations.add("types");
            }
            return violations;
        };
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Map<String, Integer> stats(CreatureRecord record) {
        StatBlock stats = record.getStats();
        return stats != null ? stats.asMap() : Map.of();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
