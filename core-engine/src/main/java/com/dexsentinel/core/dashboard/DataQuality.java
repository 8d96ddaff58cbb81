package com.dexsentinel.core.dashboard;

import java.util.List;

/**
 * Data-quality section of the dashboard summary.
 *
 * <p>
 * {@code completeness}, {@code accuracy} and {@code consistency} are fractions
 * in {@code [0, 1]}; {@code qualityScore} is their mean on a {@code [0, 100]}
 * scale. An empty store yields {@code 0.0} for all four.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataQuality {

    private final double qualityScore;
    private final long totalRecords;
    private final long validRecords;
    private final long invalidRecords;
    private final double completeness;
    private final double accuracy;
    private final double consistency;
    private final List<String> recommendations;

    public DataQuality(double qualityScore, long totalRecords, long validRecords,
            double completeness, double accuracy, double consistency, List<String> recommendations) {
        this.qualityScore = qualityScore;
        this.totalRecords = totalRecords;
        this.validRecords = validRecords;
        this.invalidRecords = totalRecords - validRecords;
        this.completeness = completeness;
        this.accuracy = accuracy;
        this.consistency = consistency;
        this.recommendations = List.copyOf(recommendations);
    }

    public double getQualityScore() {
        return qualityScore;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public long getValidRecords() {
        return validRecords;
    }

    public long getInvalidRecords() {
        return invalidRecords;
    }

    public double getCompleteness() {
        return completeness;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getConsistency() {
        return consistency;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    @Override
    public String toString() {
        return "DataQuality{" +
                "qualityScore=" + qualityScore +
                ", totalRecords=" + totalRecords +
                ", validRecords=" + validRecords +
                ", completeness=" + completeness +
                ", accuracy=" + accuracy +
                ", consistency=" + consistency +
                '}';
    }
}
