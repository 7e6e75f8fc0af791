package com.parkingrules.engine.matching;

/**
 * Distance tier of one candidate side.
 */
public enum ProximityTier {
    CLEAR,
    BOUNDARY,
    OUT_OF_RANGE;

    public static ProximityTier classify(double distanceMeters, JoinSettings settings) {
        if (distanceMeters < settings.clearThresholdMeters()) {
            return CLEAR;
        }
        if (distanceMeters < settings.boundaryThresholdMeters()) {
            return BOUNDARY;
        }
        return OUT_OF_RANGE;
    }
}
