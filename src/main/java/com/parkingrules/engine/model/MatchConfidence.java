package com.parkingrules.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a rule came to be attached to its segment. Kept for display and debugging.
 */
public enum MatchConfidence {
    /** Keyed straight to (centerline, side) by the source dataset. */
    DIRECT("direct"),
    CLEAR("clear"),
    BOUNDARY_RESOLVED("boundary-resolved"),
    ADDRESS_MATCHED("address-matched");

    private final String label;

    MatchConfidence(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
