package com.parkingrules.engine.matching;

/**
 * Distance thresholds of the spatial join, all in meters.
 *
 * @param searchRadiusMeters      candidate centerline search radius
 * @param clearThresholdMeters    below this a side is CLEAR
 * @param boundaryThresholdMeters below this (and not CLEAR) a side is BOUNDARY
 */
public record JoinSettings(double searchRadiusMeters, double clearThresholdMeters, double boundaryThresholdMeters) {

    public static final double DEFAULT_SEARCH_RADIUS_METERS = 25.0;
    public static final double DEFAULT_CLEAR_THRESHOLD_METERS = 6.0;
    public static final double DEFAULT_BOUNDARY_THRESHOLD_METERS = 15.0;

    public JoinSettings {
        if (clearThresholdMeters <= 0.0) {
            throw new IllegalArgumentException("Clear threshold must be positive: " + clearThresholdMeters);
        }
        if (boundaryThresholdMeters < clearThresholdMeters) {
            throw new IllegalArgumentException("Boundary threshold " + boundaryThresholdMeters
                + " is below clear threshold " + clearThresholdMeters);
        }
        if (searchRadiusMeters < boundaryThresholdMeters) {
            throw new IllegalArgumentException("Search radius " + searchRadiusMeters
                + " is below boundary threshold " + boundaryThresholdMeters);
        }
    }

    public static JoinSettings defaults() {
        return new JoinSettings(DEFAULT_SEARCH_RADIUS_METERS, DEFAULT_CLEAR_THRESHOLD_METERS,
            DEFAULT_BOUNDARY_THRESHOLD_METERS);
    }
}
