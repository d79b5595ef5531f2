package com.cycleindicators.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Interpretation bands for a composite score. Bands are closed on the lower edge:
 * <pre>
 *   [0.8, 1.0] → VERY_STRONG
 *   [0.6, 0.8) → STRONG
 *   [0.4, 0.6) → MODERATE
 *   [0.2, 0.4) → WEAK
 *   [0.0, 0.2) → VERY_WEAK
 * </pre>
 * Declared strongest first so {@link #classify(double)} can stop at the first match.
 */
public enum SignalStrength {

    VERY_STRONG("Very Strong", 0.8),
    STRONG("Strong", 0.6),
    MODERATE("Moderate", 0.4),
    WEAK("Weak", 0.2),
    VERY_WEAK("Very Weak", 0.0);

    private final String label;
    private final double lowerEdge;

    SignalStrength(String label, double lowerEdge) {
        this.label     = label;
        this.lowerEdge = lowerEdge;
    }

    @JsonValue
    public String label() { return label; }

    public double lowerEdge() { return lowerEdge; }

    public static SignalStrength classify(double score) {
        for (SignalStrength band : values()) {
            if (score >= band.lowerEdge) {
                return band;
            }
        }
        return VERY_WEAK;
    }
}
