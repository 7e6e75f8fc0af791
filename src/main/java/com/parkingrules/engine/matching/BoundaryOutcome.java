package com.parkingrules.engine.matching;

/**
 * Detail of a boundary resolution. Only {@link #CONFIRMED} attaches.
 */
public enum BoundaryOutcome {
    CONFIRMED,
    PARCEL_NOT_FOUND,
    ATTRIBUTE_MISMATCH,
    MISSING_ATTRIBUTES;

    public boolean isConfirmed() {
        return this == CONFIRMED;
    }
}
