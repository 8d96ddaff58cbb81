package com.dexsentinel.core.dashboard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog statistics: record counts grouped by category tag and by
 * generation. Map iteration order is the order of first occurrence in the
 * store scan.
 *
 * @since 1.0.0
 */
public final class CatalogStats {

    private final long totalRecords;
    private final Map<String, Integer> byType;
    private final Map<String, Integer> byGeneration;
    private final Double averageBaseExperience;

    public CatalogStats(long totalRecords, Map<String, Integer> byType,
            Map<String, Integer> byGeneration, Double averageBaseExperience) {
        this.totalRecords = totalRecords;
        this.byType = Collections.unmodifiableMap(new LinkedHashMap<>(byType));
        this.byGeneration = Collections.unmodifiableMap(new LinkedHashMap<>(byGeneration));
        this.averageBaseExperience = averageBaseExperience;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public int getUniqueTypes() {
        return byType.size();
    }

    public Map<String, Integer> getByType() {
        return byType;
    }

    public Map<String, Integer> getByGeneration() {
        return byGeneration;
    }

    /**
     * @return mean base experience over records that carry one, or
     *         {@code null} if none do
     */
    public Double getAverageBaseExperience() {
        return averageBaseExperience;
    }

    @Override
    public String toString() {
        return "CatalogStats{" +
                "totalRecords=" + totalRecords +
                ", byType=" + byType +
                ", byGeneration=" + byGeneration +
                '}';
    }
}
