package com.parkingrules.engine.model;

import org.locationtech.jts.geom.LineString;

import java.util.Objects;

/**
 * Normalized street centerline.
 *
 * @param id                stable centerline id
 * @param streetName        street name as surveyed
 * @param geometry          WGS84 polyline (x = longitude, y = latitude)
 * @param leftAddressRange  address interval on the left side, if known
 * @param rightAddressRange address interval on the right side, if known
 */
public record Centerline(
    String id,
    String streetName,
    LineString geometry,
    AddressRange leftAddressRange,
    AddressRange rightAddressRange
) {

    public Centerline {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Centerline id cannot be blank");
        }
        Objects.requireNonNull(geometry, "geometry");
    }

    public AddressRange addressRange(StreetSide side) {
        return side == StreetSide.LEFT ? leftAddressRange : rightAddressRange;
    }
}
