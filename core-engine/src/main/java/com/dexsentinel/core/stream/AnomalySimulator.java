package com.dexsentinel.core.stream;

import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.model.StatBlock;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Derives records that deliberately violate a given rule type.
 *
 * <p>
 * Used by {@link StreamProcessor#simulate(String, String)} for demos and
 * end-to-end checks. The input record is never modified.
 * </p>
 */
final class AnomalySimulator {

    /** Ids handed to synthesized records start above any catalog id. */
    static final int SIMULATED_ID_BASE = 900_000;

    private static final StatBlock BASELINE_STATS = StatBlock.of(50, 50, 50, 50, 50, 50);

    private static final Map<String, UnaryOperator<CreatureRecord>> MUTATIONS = Map.of(
            "negative_stats", record -> record.toBuilder()
                    .stats(statsOf(record).toBuilder().hp(-10).build())
                    .build(),
            "invalid_type", record -> record.toBuilder()
                    .addType("invalid_type")
                    .build(),
            "missing_sprite", record -> record.toBuilder()
                    .spriteFront(null)
                    .spriteShiny(null)
                    .build(),
            "extreme_stats", record -> record.toBuilder()
                    .stats(statsOf(record).toBuilder().attack(999).build())
                    .build(),
            "missing_data", record -> record.toBuilder()
                    .types(List.of())
                    .build());

    private final AtomicInteger sequence = new AtomicInteger();

    /**
     * A clean record with the given name, used when the store has none.
     */
    CreatureRecord baseline(String name, Instant now) {
        return CreatureRecord.builder()
                .id(SIMULATED_ID_BASE + sequence.incrementAndGet())
                .name(name)
                .height(10)
                .weight(100)
                .baseExperience(100)
                .types(List.of("normal"))
                .stats(BASELINE_STATS)
                .spriteFront("simulated://" + name + "/front")
                .spriteShiny("simulated://" + name + "/shiny")
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * @param ruleType rule type to violate
     * @param base     record to derive from
     * @return the violating copy, or empty if the type has no simulation
     */
    Optional<CreatureRecord> inject(String ruleType, CreatureRecord base) {
        UnaryOperator<CreatureRecord> mutation = MUTATIONS.get(ruleType);
        return mutation == null ? Optional.empty() : Optional.of(mutation.apply(base));
    }

    private static StatBlock statsOf(CreatureRecord record) {
        return record.getStats() != null ? record.getStats() : BASELINE_STATS;
    }
}
