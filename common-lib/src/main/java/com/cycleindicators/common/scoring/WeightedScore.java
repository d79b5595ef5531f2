package com.cycleindicators.common.scoring;

import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.ScoreStatistics;

import java.util.List;

/**
 * Output of {@link WeightedCompositeCalculator}.
 *
 * <p>{@code compositeScore} is {@code null} when {@code totalWeight == 0}, either because no
 * indicator produced a normalized score or because every valid indicator has zero weight.
 * {@code statistics} is {@code null} when {@code valid} is empty.
 */
public record WeightedScore(
    Double compositeScore,
    double totalWeight,
    List<IndicatorResult> valid,
    List<IndicatorResult> failed,
    ScoreStatistics statistics
) {
    public WeightedScore {
        valid  = List.copyOf(valid);
        failed = List.copyOf(failed);
    }

    public boolean hasComposite() {
        return compositeScore != null;
    }
}
