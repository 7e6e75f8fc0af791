package com.parkingrules.engine.model;

import lombok.Builder;

import java.util.Objects;

/**
 * One regulation applicable to one segment side. Immutable once attached; conflicting
 * information produces another rule, never an edit.
 *
 * @param kind                 regulation kind, drives precedence
 * @param schedule             when the rule is active
 * @param durationLimitMinutes stated parking limit, if any
 * @param permitZone           residential permit zone code, if any
 * @param description          free-text source description
 * @param interpretationKey    canonical key into the external interpretation cache, if any
 * @param confidence           how the rule was matched to its segment
 * @param sourceId             id of the record the rule came from
 */
@Builder(toBuilder = true)
public record Rule(
    RuleKind kind,
    Schedule schedule,
    Integer durationLimitMinutes,
    String permitZone,
    String description,
    String interpretationKey,
    MatchConfidence confidence,
    String sourceId
) {

    public Rule {
        Objects.requireNonNull(kind, "kind");
        if (schedule == null) {
            schedule = Schedule.always();
        }
        if (durationLimitMinutes != null && durationLimitMinutes <= 0) {
            throw new IllegalArgumentException("Duration limit must be positive: " + durationLimitMinutes);
        }
        if (description == null) {
            description = "";
        }
        if (confidence == null) {
            confidence = MatchConfidence.CLEAR;
        }
    }

    /**
     * Same rule, re-tagged with the confidence of a particular attachment.
     */
    public Rule withConfidence(MatchConfidence matchConfidence) {
        return toBuilder().confidence(matchConfidence).build();
    }
}
