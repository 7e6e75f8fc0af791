package com.parkingrules.engine.store;

import com.parkingrules.engine.model.StreetSegment;

/**
 * A segment found by a radius search, with its distance from the query point in meters.
 */
public record NearbySegment(StreetSegment segment, double distanceMeters) {
}
