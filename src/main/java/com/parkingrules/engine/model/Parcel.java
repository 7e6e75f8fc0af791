package com.parkingrules.engine.model;

import org.locationtech.jts.geom.Geometry;

import java.util.Objects;

/**
 * Administrative overlay polygon used only to break boundary ties. Never persisted.
 *
 * @param id           parcel id
 * @param geometry     WGS84 polygon or multipolygon
 * @param neighborhood neighborhood name
 * @param district     district name or number
 */
public record Parcel(String id, Geometry geometry, String neighborhood, String district) {

    public Parcel {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(geometry, "geometry");
    }
}
