package com.parkingrules.engine.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * Equirectangular projection of WGS84 lon/lat onto a local plane in meters, centred on an
 * origin. Accurate to well under a meter across a city, which is all the join thresholds need.
 * Projected geometry is always a copy; stored geometry stays in WGS84.
 */
public final class LocalProjection {

    private static final double METERS_PER_RADIAN = GeometryUtils.EARTH_RADIUS_METERS;

    private final double originLon;
    private final double originLat;
    private final double cosOriginLat;

    public LocalProjection(double originLon, double originLat) {
        if (originLat < -90.0 || originLat > 90.0) {
            throw new IllegalArgumentException("Origin latitude out of range: " + originLat);
        }
        this.originLon = originLon;
        this.originLat = originLat;
        this.cosOriginLat = Math.cos(Math.toRadians(originLat));
    }

    /**
     * Projection centred on the middle of a WGS84 envelope.
     */
    public static LocalProjection centredOn(Envelope envelope) {
        if (envelope == null || envelope.isNull()) {
            return new LocalProjection(0.0, 0.0);
        }
        return new LocalProjection(envelope.centre().x, envelope.centre().y);
    }

    public double originLon() {
        return originLon;
    }

    public double originLat() {
        return originLat;
    }

    public Coordinate project(Coordinate lonLat) {
        double x = Math.toRadians(lonLat.x - originLon) * cosOriginLat * METERS_PER_RADIAN;
        double y = Math.toRadians(lonLat.y - originLat) * METERS_PER_RADIAN;
        return new Coordinate(x, y);
    }

    public Coordinate unproject(Coordinate meters) {
        double lon = originLon + Math.toDegrees(meters.x / (METERS_PER_RADIAN * cosOriginLat));
        double lat = originLat + Math.toDegrees(meters.y / METERS_PER_RADIAN);
        return new Coordinate(lon, lat);
    }

    public <G extends Geometry> G project(G lonLat) {
        return transform(lonLat, true);
    }

    public <G extends Geometry> G unproject(G meters) {
        return transform(meters, false);
    }

    /**
     * Degrees of latitude spanned by a distance in meters; sizes WGS84 search envelopes.
     */
    public static double metersToLatDegrees(double meters) {
        return Math.toDegrees(meters / METERS_PER_RADIAN);
    }

    public double metersToLonDegrees(double meters) {
        return Math.toDegrees(meters / (METERS_PER_RADIAN * cosOriginLat));
    }

    @SuppressWarnings("unchecked")
    private <G extends Geometry> G transform(G geometry, boolean forward) {
        G copy = (G) geometry.copy();
        copy.apply(new CoordinateSequenceFilter() {
            @Override
            public void filter(CoordinateSequence seq, int i) {
                Coordinate source = new Coordinate(seq.getX(i), seq.getY(i));
                Coordinate target = forward ? project(source) : unproject(source);
                seq.setOrdinate(i, CoordinateSequence.X, target.x);
                seq.setOrdinate(i, CoordinateSequence.Y, target.y);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public boolean isGeometryChanged() {
                return true;
            }
        });
        return copy;
    }
}
