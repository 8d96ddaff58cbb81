/**
 * Deterministic anomaly rule engine.
 *
 * <p>
 * A {@link com.dexsentinel.core.rules.RuleEngine} holds an ordered,
 * copy-on-write set of {@link com.dexsentinel.core.rules.AnomalyRule}s built
 * by {@link com.dexsentinel.core.rules.RuleFactory} from configuration.
 * Built-in rule types:
 * </p>
 * <ul>
 * <li>{@code negative_stats}: any stat below zero (high)</li>
 * <li>{@code invalid_type}: category tag outside the
 * {@link com.dexsentinel.core.rules.TypeVocabulary} (medium)</li>
 * <li>{@code missing_sprite}: no image reference (low)</li>
 * <li>{@code extreme_stats}: stat outside a configured range (medium)</li>
 * <li>{@code missing_data}: blank name, non-positive id or no tags
 * (high)</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a rule type, write a {@link com.dexsentinel.core.rules.RuleCheck}
 * and register the type string in {@code RuleFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.dexsentinel.core.rules;
