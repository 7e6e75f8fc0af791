package com.parkingrules.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of parking regulation, ordered by evaluation precedence tier.
 */
public enum RuleKind {
    TOW_AWAY("tow-away", PrecedenceTier.HARD_BLOCKER),
    SWEEPING("sweeping", PrecedenceTier.HARD_BLOCKER),
    NO_PARKING("no-parking", PrecedenceTier.HARD_BLOCKER),
    RPP_ZONE("rpp-zone", PrecedenceTier.DURATION_CONSTRAINED),
    TIME_LIMIT("time-limit", PrecedenceTier.DURATION_CONSTRAINED),
    METER("meter", PrecedenceTier.PAYMENT);

    private final String label;
    private final PrecedenceTier tier;

    RuleKind(String label, PrecedenceTier tier) {
        this.label = label;
        this.tier = tier;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public PrecedenceTier tier() {
        return tier;
    }

    public boolean isHardBlocker() {
        return tier == PrecedenceTier.HARD_BLOCKER;
    }

    public static RuleKind fromLabel(String label) {
        for (RuleKind kind : values()) {
            if (kind.label.equalsIgnoreCase(label) || kind.name().equalsIgnoreCase(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown rule kind: " + label);
    }

    /**
     * Precedence tiers, highest first.
     */
    public enum PrecedenceTier {
        HARD_BLOCKER,
        DURATION_CONSTRAINED,
        PAYMENT
    }
}
