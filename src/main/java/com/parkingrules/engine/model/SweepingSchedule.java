package com.parkingrules.engine.model;

import java.util.Objects;

/**
 * Street-cleaning rule already keyed to a segment by the source dataset.
 *
 * @param key               target segment
 * @param rule              the sweeping rule
 * @param fromStreet        first cross street of the block, if known
 * @param toStreet          last cross street of the block, if known
 * @param cardinalDirection blockside label from the dataset, if known
 */
public record SweepingSchedule(SegmentKey key, Rule rule, String fromStreet, String toStreet, String cardinalDirection) {

    public SweepingSchedule {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(rule, "rule");
    }
}
