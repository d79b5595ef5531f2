package com.cycleindicators.common.scoring;

import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.ScoreStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless weighted-mean aggregation of normalized indicator scores.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Partition results into {@code valid} (normalized score present) and {@code failed},
 *       preserving input order in both.</li>
 *   <li>{@code composite = Σ(score × weight) / Σ(weight)} over {@code valid} only.</li>
 *   <li>When {@code Σ(weight) == 0} the composite is absent; this is a representable
 *       result, not an error.</li>
 *   <li>Mean, min, max and population std of the valid scores are attached.</li>
 * </ol>
 *
 * <p>Pure: no logging, no side effects, safe to call concurrently.
 */
public final class WeightedCompositeCalculator {

    private WeightedCompositeCalculator() {}

    public static WeightedScore compute(List<IndicatorResult> results) {
        List<IndicatorResult> valid  = new ArrayList<>();
        List<IndicatorResult> failed = new ArrayList<>();
        List<Double> scores = new ArrayList<>();

        double totalWeight = 0.0;
        double weightedSum = 0.0;
        for (IndicatorResult r : results) {
            if (r.isValid()) {
                valid.add(r);
                scores.add(r.normalizedScore());
                weightedSum += r.normalizedScore() * r.weight();
                totalWeight += r.weight();
            } else {
                failed.add(r);
            }
        }

        Double composite = totalWeight > 0.0 ? weightedSum / totalWeight : null;
        ScoreStatistics statistics = scores.isEmpty() ? null : ScoreStatistics.of(scores);

        return new WeightedScore(composite, totalWeight, valid, failed, statistics);
    }
}
