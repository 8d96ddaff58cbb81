package com.dexsentinel.core.dashboard;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of {@link DashboardAggregator#summarize()}.
 *
 * @since 1.0.0
 */
public final class DashboardSummary {

    private final DataQuality dataQuality;
    private final CatalogStats catalogStats;
    private final ProcessingStats processingStats;
    private final Instant generatedAt;

    public DashboardSummary(DataQuality dataQuality, CatalogStats catalogStats,
            ProcessingStats processingStats, Instant generatedAt) {
        this.dataQuality = Objects.requireNonNull(dataQuality, "dataQuality must not be null");
        this.catalogStats = Objects.requireNonNull(catalogStats, "catalogStats must not be null");
        this.processingStats = Objects.requireNonNull(processingStats, "processingStats must not be null");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }

    public DataQuality getDataQuality() {
        return dataQuality;
    }

    @JsonProperty("pokemon_stats")
    public CatalogStats getCatalogStats() {
        return catalogStats;
    }

    public ProcessingStats getProcessingStats() {
        return processingStats;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    @Override
    public String toString() {
        return "DashboardSummary{" +
                "dataQuality=" + dataQuality +
                ", catalogStats=" + catalogStats +
                ", processingStats=" + processingStats +
                ", generatedAt=" + generatedAt +
                '}';
    }
}
