package com.parkingrules.engine.matching;

import com.parkingrules.engine.model.StreetSide;

import java.util.Optional;

/**
 * Outcome of side voting. {@link #INDETERMINATE} is a normal "no match", never a default side.
 */
public enum SideVerdict {
    LEFT,
    RIGHT,
    INDETERMINATE;

    public boolean isDetermined() {
        return this != INDETERMINATE;
    }

    public Optional<StreetSide> toSide() {
        switch (this) {
            case LEFT:
                return Optional.of(StreetSide.LEFT);
            case RIGHT:
                return Optional.of(StreetSide.RIGHT);
            default:
                return Optional.empty();
        }
    }
}
