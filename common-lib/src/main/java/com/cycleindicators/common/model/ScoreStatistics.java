package com.cycleindicators.common.model;

import java.util.List;

/**
 * Descriptive statistics over the valid normalized scores of one composite.
 * {@code std} is the population standard deviation (divide by n) and is 0 below two samples.
 */
public record ScoreStatistics(
    int count,
    double mean,
    double min,
    double max,
    double std
) {

    public static ScoreStatistics of(List<Double> scores) {
        if (scores == null || scores.isEmpty()) {
            throw new IllegalArgumentException("Score statistics need at least one score");
        }
        int n = scores.size();
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double s : scores) {
            sum += s;
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        double mean = sum / n;

        double std = 0.0;
        if (n > 1) {
            double variance = 0.0;
            for (double s : scores) {
                double diff = s - mean;
                variance += diff * diff;
            }
            std = Math.sqrt(variance / n);
        }
        return new ScoreStatistics(n, mean, min, max, std);
    }
}
