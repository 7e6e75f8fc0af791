package com.parkingrules.engine.dto;

/**
 * Raw administrative parcel.
 *
 * @param id           parcel id
 * @param geometry     WKT {@code POLYGON} or {@code MULTIPOLYGON} in lon/lat
 * @param neighborhood neighborhood name
 * @param district     district name or number
 */
public record ParcelRecord(String id, String geometry, String neighborhood, String district) {
}
