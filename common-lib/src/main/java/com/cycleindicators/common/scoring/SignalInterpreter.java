package com.cycleindicators.common.scoring;

import com.cycleindicators.common.model.Interpretation;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.SignalStrength;

/**
 * Maps a composite score to its {@link SignalStrength} band plus a side-specific
 * description and display color. Band edges are the same for both sides.
 *
 * <pre>
 *   band          bottom color   top color
 *   VERY_STRONG   green          red
 *   STRONG        yellow-green   orange
 *   MODERATE      yellow         yellow
 *   WEAK          orange         yellow-green
 *   VERY_WEAK     red            green
 * </pre>
 */
public final class SignalInterpreter {

    private SignalInterpreter() {}

    public static Interpretation interpret(Side side, double score) {
        SignalStrength strength = SignalStrength.classify(score);
        return new Interpretation(strength, describe(side, strength), color(side, strength),
                                  score, percentage(score));
    }

    /** {@code round(score × 100, 1)}. */
    public static double percentage(double score) {
        return Math.round(score * 1000.0) / 10.0;
    }

    private static String describe(Side side, SignalStrength strength) {
        String target = side.target();
        return switch (strength) {
            case VERY_STRONG -> "Multiple indicators suggest high probability of " + target;
            case STRONG      -> "Several indicators suggest potential " + target;
            case MODERATE    -> "Mixed signals with some " + side.key() + " indicators present";
            case WEAK        -> "Few " + side.key() + " indicators present, market may continue "
                                + side.continuation();
            case VERY_WEAK   -> capitalize(side.key()) + " indicators not present, market likely to continue "
                                + side.continuation();
        };
    }

    private static String color(Side side, SignalStrength strength) {
        return switch (strength) {
            case VERY_STRONG -> side == Side.BOTTOM ? "green" : "red";
            case STRONG      -> side == Side.BOTTOM ? "yellow-green" : "orange";
            case MODERATE    -> "yellow";
            case WEAK        -> side == Side.BOTTOM ? "orange" : "yellow-green";
            case VERY_WEAK   -> side == Side.BOTTOM ? "red" : "green";
        };
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
