package com.parkingrules.engine.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Globally unique identity of a street segment: one side of one centerline.
 *
 * @param centerlineId id of the surveyed centerline
 * @param side         side of that centerline
 */
public record SegmentKey(String centerlineId, StreetSide side) implements Comparable<SegmentKey> {

    private static final Comparator<SegmentKey> ORDER = Comparator
        .comparing(SegmentKey::centerlineId)
        .thenComparing(SegmentKey::side);

    public SegmentKey {
        if (centerlineId == null || centerlineId.isBlank()) {
            throw new IllegalArgumentException("Centerline id cannot be blank");
        }
        Objects.requireNonNull(side, "side");
    }

    public static SegmentKey of(String centerlineId, StreetSide side) {
        return new SegmentKey(centerlineId, side);
    }

    @Override
    public int compareTo(SegmentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return centerlineId + ":" + side.code();
    }
}
