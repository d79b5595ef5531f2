package com.cycleindicators.common.composer;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.model.Bounds;
import com.cycleindicators.common.model.CompositeResult;
import com.cycleindicators.common.model.DataQuality;
import com.cycleindicators.common.model.FailedWeightPolicy;
import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.IndicatorSpec;
import com.cycleindicators.common.model.Interpretation;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.scoring.SignalInterpreter;
import com.cycleindicators.common.scoring.WeightedCompositeCalculator;
import com.cycleindicators.common.scoring.WeightedScore;
import com.cycleindicators.common.indicator.Indicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates a fixed, ordered roster of {@link Indicator}s for one {@link Side} and folds
 * the results into a {@link CompositeResult}.
 *
 * <p>Indicators run one after another on the calling thread. One indicator's failure never
 * prevents evaluation of the next. {@link #calculateCompleteAnalysis()} never throws.
 */
public class IndicatorComposer {

    private static final Logger log = LoggerFactory.getLogger(IndicatorComposer.class);

    private final Side side;
    private final List<Indicator> roster;
    private final IndicatorConfiguration configuration;
    private final FailedWeightPolicy failedWeightPolicy;
    private final Clock clock;

    public IndicatorComposer(Side side, List<? extends Indicator> roster, IndicatorConfiguration configuration,
                             FailedWeightPolicy failedWeightPolicy, Clock clock) {
        for (Indicator indicator : roster) {
            if (indicator.side() != side) {
                throw new IllegalArgumentException(String.format(
                    "Indicator %s scores side %s but was registered with the %s composer",
                    indicator.name(), indicator.side().key(), side.key()));
            }
        }
        this.side               = side;
        this.roster             = List.copyOf(roster);
        this.configuration      = configuration;
        this.failedWeightPolicy = failedWeightPolicy;
        this.clock              = clock;
    }

    public Side side() {
        return side;
    }

    public List<Indicator> roster() {
        return roster;
    }

    /** One result per roster member, in roster order. */
    public List<IndicatorResult> calculateIndividualScores() {
        List<IndicatorResult> results = new ArrayList<>(roster.size());
        for (Indicator indicator : roster) {
            log.info("Calculating {} indicator {}", side.key(), indicator.name());
            results.add(evaluate(indicator));
        }
        return results;
    }

    public WeightedScore calculateWeightedScore(List<IndicatorResult> results) {
        WeightedScore score = WeightedCompositeCalculator.compute(results);
        if (!score.hasComposite()) {
            log.error("NO_VALID_INDICATORS side={} failed={}", side.key(),
                      score.failed().stream().map(IndicatorResult::name).toList());
        }
        return score;
    }

    public Interpretation interpret(double compositeScore) {
        return SignalInterpreter.interpret(side, compositeScore);
    }

    public CompositeResult calculateCompleteAnalysis() {
        try {
            if (roster.isEmpty()) {
                throw new IllegalStateException("No indicators registered for side " + side.key());
            }
            log.info("Starting complete {} analysis with {} indicators", side.key(), roster.size());

            List<IndicatorResult> results = calculateIndividualScores();
            WeightedScore score = calculateWeightedScore(results);
            DataQuality quality = dataQuality(results, score);
            Instant now = clock.instant();

            if (!score.hasComposite()) {
                return new CompositeResult(side, null, 0.0, score.valid(), score.failed(),
                                           score.statistics(), null, quality, now,
                                           CompositeResult.NO_VALID_INDICATORS);
            }

            Interpretation interpretation = interpret(score.compositeScore());
            log.info("COMPOSITE_COMPUTED side={} score={} strength={} valid={} failed={} successRate={}",
                     side.key(), String.format("%.4f", score.compositeScore()), interpretation.strength().label(),
                     score.valid().size(), score.failed().size(), quality.successRate());

            return new CompositeResult(side, score.compositeScore(), score.totalWeight(),
                                       score.valid(), score.failed(), score.statistics(),
                                       interpretation, quality, now, null);
        } catch (RuntimeException e) {
            log.error("Error in complete {} analysis", side.key(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return CompositeResult.error(side, error, clock.instant());
        }
    }

    // ── internals ────────────────────────────────────────────────────────────

    private IndicatorResult evaluate(Indicator indicator) {
        try {
            return indicator.fullResult();
        } catch (RuntimeException e) {
            log.error("INDICATOR_FAILED name={} side={} escaped its own boundary",
                      indicator.name(), side.key(), e);
            Optional<IndicatorSpec> spec = configuration.spec(side, indicator.name());
            double weight = spec.map(IndicatorSpec::weight).orElse(0.0);
            Bounds bounds = spec.map(IndicatorSpec::bounds).orElse(null);
            String error  = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return IndicatorResult.failed(indicator.name(), side, weight, bounds, clock.instant(), error);
        }
    }

    private DataQuality dataQuality(List<IndicatorResult> results, WeightedScore score) {
        int total      = roster.size();
        int successful = score.valid().size();
        int failed     = score.failed().size();

        int counted = total;
        if (failedWeightPolicy == FailedWeightPolicy.EXCLUDE) {
            long zeroWeightFailures = score.failed().stream().filter(r -> r.weight() == 0.0).count();
            counted = total - (int) zeroWeightFailures;
        }
        double successRate = counted > 0 ? successful * 100.0 / counted : 0.0;
        return new DataQuality(total, successful, failed, counted, successRate);
    }
}
