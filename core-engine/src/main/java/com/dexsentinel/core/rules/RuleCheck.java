package com.dexsentinel.core.rules;

import com.dexsentinel.core.model.CreatureRecord;

import java.util.List;

/**
 * Predicate part of an {@link AnomalyRule}.
 *
 * <p>
 * Returns a human-readable entry per violation found in the record, e.g.
 * {@code "hp=-10"}. An empty list means the record passes. Implementations
 * must not mutate the record and must treat absent fields as input rather
 * than failing on them.
 * </p>
 */
@FunctionalInterface
public interface RuleCheck {

    List<String> violations(CreatureRecord record);
}
