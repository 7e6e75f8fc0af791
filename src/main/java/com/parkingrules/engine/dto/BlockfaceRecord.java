package com.parkingrules.engine.dto;

/**
 * Surveyed curb line for one side of a centerline. The side is not given; it is voted.
 *
 * @param id           blockface id
 * @param centerlineId centerline the blockface belongs to
 * @param geometry     WKT {@code LINESTRING} in lon/lat
 */
public record BlockfaceRecord(String id, String centerlineId, String geometry) {
}
