package com.cycleindicators.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which end of the market cycle a roster of indicators is looking for.
 *
 * <p>The lower-case {@link #key()} doubles as the top-level section name in the
 * indicator configuration file and as the serialized form.
 */
public enum Side {

    BOTTOM("bottom", "market bottom", "declining"),
    TOP("top", "market top", "rising");

    private final String key;
    private final String target;
    private final String continuation;

    Side(String key, String target, String continuation) {
        this.key          = key;
        this.target       = target;
        this.continuation = continuation;
    }

    @JsonValue
    public String key() { return key; }

    /** Human wording of what this side detects, e.g. "market bottom". */
    public String target() { return target; }

    /** Direction the market keeps moving when this side's signal is absent. */
    public String continuation() { return continuation; }

    @JsonCreator
    public static Side fromKey(String key) {
        if (key == null) return null;
        for (Side side : values()) {
            if (side.key.equalsIgnoreCase(key.trim())) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown side: " + key);
    }
}
