package com.dexsentinel.core.dashboard;

import com.dexsentinel.core.alert.AlertSystem;
import com.dexsentinel.core.model.AlertMetrics;
import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.model.ProcessorStatus;
import com.dexsentinel.core.model.RecordValidationException;
import com.dexsentinel.core.model.StatBlock;
import com.dexsentinel.core.rules.RuleEngine;
import com.dexsentinel.core.rules.TypeVocabulary;
import com.dexsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the dashboard summary on demand.
 *
 * <p>
 * Every call scans the record store afresh and re-evaluates each record
 * against the current rule set; nothing is cached. The aggregator takes no
 * locks of its own: processor status and alert metrics are point-in-time
 * snapshots, so the three sections are each consistent but not taken at the
 * same instant.
 * </p>
 *
 * <h3>Quality metrics</h3>
 * <ul>
 * <li><b>valid</b>: id present and positive, non-blank name, all six stats
 * present and non-negative, at least one category tag</li>
 * <li><b>completeness</b>: share of records with both image references</li>
 * <li><b>accuracy</b>: share of records the rule engine finds nothing
 * wrong with</li>
 * <li><b>consistency</b>: share of records whose tags are all known</li>
 * <li><b>quality score</b>: mean of the three shares, scaled to 0-100</li>
 * </ul>
 * <p>
 * An empty store yields {@code 0.0} for every share and for the score.
 * </p>
 *
 * @since 1.0.0
 */
public class DashboardAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(DashboardAggregator.class);

    static final String OTHER_GENERATION = "Other";

    /** Upper id bound (inclusive) per generation, in ascending order. */
    private static final int[] GENERATION_BOUNDS = { 151, 251, 386, 493, 649 };

    static final double COMPLETENESS_TARGET = 0.9;
    static final double MISSING_EXPERIENCE_THRESHOLD = 0.1;

    private final RecordStore store;
    private final RuleEngine engine;
    private final StreamProcessorView processor;
    private final AlertSystem alertSystem;
    private final Clock clock;

    /**
     * Narrow view of the stream processor the aggregator reads from.
     */
    @FunctionalInterface
    public interface StreamProcessorView {
        ProcessorStatus status();
    }

    public DashboardAggregator(RecordStore store, RuleEngine engine, StreamProcessorView processor,
            AlertSystem alertSystem, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.alertSystem = Objects.requireNonNull(alertSystem, "alertSystem must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Build the summary.
     *
     * @return data quality, catalog statistics and processing statistics
     * @throws com.dexsentinel.core.store.StoreUnavailableException if the
     *                                                              store
     *                                                              cannot be
     *                                                              scanned
     */
    public DashboardSummary summarize() {
        ProcessorStatus status = processor.status();
        AlertMetrics metrics = alertSystem.metrics();
        TypeVocabulary vocabulary = engine.vocabulary();

        long total = 0;
        long valid = 0;
        long complete = 0;
        long accurate = 0;
        long consistent = 0;
        long withExperience = 0;
        long experienceSum = 0;
        boolean negativeStats = false;
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> byGeneration = new LinkedHashMap<>();

        for (CreatureRecord record : store.scan()) {
            total++;
            if (isValid(record)) {
                valid++;
            }
            if (hasBothSprites(record)) {
                complete++;
            }
            if (isAccurate(record)) {
                accurate++;
            }
            if (vocabulary.containsAll(record.getTypes())) {
                consistent++;
            }
            if (record.getBaseExperience() != null) {
                withExperience++;
                experienceSum += record.getBaseExperience();
            }
            negativeStats |= hasNegativeStat(record);
            for (String type : record.getTypes()) {
                byType.merge(type, 1, Integer::sum);
            }
            byGeneration.merge(generationOf(record.getId()), 1, Integer::sum);
        }

        double completeness = fraction(complete, total);
        double accuracy = fraction(accurate, total);
        double consistency = fraction(consistent, total);
        double score = total == 0 ? 0.0 : (completeness + accuracy + consistency) / 3.0 * 100.0;

        List<String> recommendations = recommendations(total, valid, completeness, accuracy,
                consistency, total - withExperience, negativeStats);

        DataQuality quality = new DataQuality(score, total, valid, completeness, accuracy,
                consistency, recommendations);
        CatalogStats catalog = new CatalogStats(total, byType, byGeneration,
                withExperience == 0 ? null : (double) experienceSum / withExperience);
        ProcessingStats processing = new ProcessingStats(status.getProcessedCount(),
                status.getAnomaliesDetected(), metrics.getTotalAlerts(),
                status.getProcessingErrors(), status.isRunning());

        LOG.debug("Dashboard summary computed over {} record(s), quality score {}", total, score);
        return new DashboardSummary(quality, catalog, processing, clock.instant());
    }

    // ---------------------------------------------------------------
    // Record classification
    // ---------------------------------------------------------------

    static boolean isValid(CreatureRecord record) {
        if (record.getId() == null || record.getId() <= 0) {
            return false;
        }
        if (record.getName() == null || record.getName().isBlank()) {
            return false;
        }
        StatBlock stats = record.getStats();
        if (stats == null) {
            return false;
        }
        for (Integer value : stats.asMap().values()) {
            if (value == null || value < 0) {
                return false;
            }
        }
        return !record.getTypes().isEmpty();
    }

    static String generationOf(Integer id) {
        if (id == null || id <= 0) {
            return OTHER_GENERATION;
        }
        for (int i = 0; i < GENERATION_BOUNDS.length; i++) {
            if (id <= GENERATION_BOUNDS[i]) {
                return "Gen " + (i + 1);
            }
        }
        return OTHER_GENERATION;
    }

    private boolean isAccurate(CreatureRecord record) {
        try {
            return engine.evaluate(record).isEmpty();
        } catch (RecordValidationException e) {
            LOG.debug("Record cannot be evaluated, counted as inaccurate: {}", e.getMessage());
            return false;
        }
    }

    private static boolean hasBothSprites(CreatureRecord record) {
        return notBlank(record.getSpriteFront()) && notBlank(record.getSpriteShiny());
    }

    private static boolean hasNegativeStat(CreatureRecord record) {
        if (record.getStats() == null) {
            return false;
        }
        return record.getStats().asMap().values().stream()
                .anyMatch(value -> value != null && value < 0);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static double fraction(long part, long total) {
        return total == 0 ? 0.0 : (double) part / total;
    }

    // ---------------------------------------------------------------
    // Recommendations
    // ---------------------------------------------------------------

    private static List<String> recommendations(long total, long valid, double completeness,
            double accuracy, double consistency, long missingExperience, boolean negativeStats) {
        List<String> out = new ArrayList<>();
        if (total == 0) {
            out.add("No records in the store. Import catalog data to compute quality metrics.");
            return out;
        }
        if (valid < total) {
            out.add("Fix " + (total - valid) + " record(s) with missing identity, stats or category tags");
        }
        if (negativeStats) {
            out.add("Correct the negative stats found in the data");
        }
        if (consistency < 1.0) {
            out.add("Check category tags outside the known vocabulary, they may indicate an import error");
        }
        if (completeness < COMPLETENESS_TARGET) {
            out.add("Fetch image references for records without sprites");
        }
        if ((double) missingExperience / total > MISSING_EXPERIENCE_THRESHOLD) {
            out.add("Consider fetching base experience for records that lack it");
        }
        if (accuracy < 1.0 && out.isEmpty()) {
            out.add("Review the records flagged by the anomaly rules");
        }
        if (out.isEmpty()) {
            out.add("Data quality is good. Keep monitoring.");
        }
        return out;
    }
}
