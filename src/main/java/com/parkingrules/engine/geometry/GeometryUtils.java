package com.parkingrules.engine.geometry;

import com.parkingrules.engine.model.StreetSide;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.linearref.LengthIndexedLine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Primitive vector math shared by side determination and the spatial join.
 *
 * Coordinates follow the JTS convention: x = longitude, y = latitude for WGS84 geometry,
 * x = east meters, y = north meters for geometry in a {@link LocalProjection}. Planar helpers
 * ({@link #crossProductSide}, {@link #distanceToLine}, {@link #interpolate}) work in whatever
 * units the caller passes; the join always hands them projected meters. {@link #bearing} and
 * {@link #haversineDistance} expect WGS84 degrees.
 */
public final class GeometryUtils {

    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    /**
     * Fractions along a candidate geometry sampled for voting and distance.
     */
    public static final double[] SAMPLE_FRACTIONS = {0.25, 0.5, 0.75};

    public static final GeometryFactory WGS84 = new GeometryFactory(new PrecisionModel(), 4326);

    private static final double COLLINEAR_EPSILON = 1e-12;

    private static final String[] WINDS = {
        "North", "Northeast", "East", "Southeast", "South", "Southwest", "West", "Northwest"
    };

    private GeometryUtils() {
    }

    /**
     * Initial great-circle bearing from {@code from} to {@code to}, degrees in {@code [0, 360)}.
     */
    public static double bearing(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.y);
        double lat2 = Math.toRadians(to.y);
        double dLon = Math.toRadians(to.x - from.x);

        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        double degrees = Math.toDegrees(Math.atan2(y, x));
        return (degrees + 360.0) % 360.0;
    }

    /**
     * Bearing from the first to the last vertex of a line.
     */
    public static double bearing(LineString line) {
        requireValidLine(line);
        return bearing(line.getCoordinateN(0), line.getCoordinateN(line.getNumPoints() - 1));
    }

    /**
     * Eight-wind label of the direction a side faces, given the travel bearing of its
     * centerline. The left side faces {@code bearing - 90}, the right side {@code bearing + 90}.
     */
    public static String sideCardinal(double travelBearing, StreetSide side) {
        double facing = side == StreetSide.LEFT ? travelBearing - 90.0 : travelBearing + 90.0;
        double normalized = ((facing % 360.0) + 360.0) % 360.0;
        int index = (int) Math.round(normalized / 45.0) % WINDS.length;
        return WINDS[index];
    }

    /**
     * Which side of the directed line {@code a -> b} the point {@code p} lies on.
     *
     * @return {@code +1} left, {@code -1} right, {@code 0} collinear (indeterminate)
     */
    public static int crossProductSide(Coordinate a, Coordinate b, Coordinate p) {
        double cross = (b.x - a.x) * (p.y - a.y) - (b.y - a.y) * (p.x - a.x);
        if (Math.abs(cross) <= COLLINEAR_EPSILON) {
            return 0;
        }
        return cross > 0 ? 1 : -1;
    }

    /**
     * Point at {@code fraction} of the arc length of {@code line}.
     */
    public static Coordinate interpolate(LineString line, double fraction) {
        requireValidLine(line);
        if (fraction < 0.0 || fraction > 1.0 || Double.isNaN(fraction)) {
            throw new IllegalArgumentException("Fraction must be within [0, 1]: " + fraction);
        }
        LengthIndexedLine indexed = new LengthIndexedLine(line);
        return indexed.extractPoint(fraction * line.getLength());
    }

    public static Coordinate midpoint(LineString line) {
        return interpolate(line, 0.5);
    }

    /**
     * Minimum planar distance from a point to a polyline.
     */
    public static double distanceToLine(Coordinate point, LineString line) {
        requireValidLine(line);
        return line.distance(line.getFactory().createPoint(point));
    }

    /**
     * Sample points of a candidate geometry at {@link #SAMPLE_FRACTIONS}. Lineal geometries are
     * sampled by arc length; anything else (points, polygons, zero-length lines) is
     * represented by its centroid at every position.
     */
    public static List<Coordinate> samplePoints(Geometry candidate) {
        if (candidate == null || candidate.isEmpty()) {
            throw new GeometryException("Cannot sample an empty geometry");
        }
        List<Coordinate> samples = new ArrayList<>(SAMPLE_FRACTIONS.length);
        if (candidate instanceof Lineal && candidate.getLength() > 0.0) {
            LengthIndexedLine indexed = new LengthIndexedLine(candidate);
            double length = candidate.getLength();
            for (double fraction : SAMPLE_FRACTIONS) {
                samples.add(indexed.extractPoint(fraction * length));
            }
        } else {
            Coordinate centroid = candidate.getCentroid().getCoordinate();
            for (int i = 0; i < SAMPLE_FRACTIONS.length; i++) {
                samples.add(new Coordinate(centroid));
            }
        }
        return samples;
    }

    /**
     * Median of the sample-point distances from {@code candidate} to {@code reference}.
     * A regulation whose end touches a cross street still measures by its body.
     */
    public static double medianSampledDistance(Geometry candidate, LineString reference) {
        requireValidLine(reference);
        List<Coordinate> samples = samplePoints(candidate);
        double[] distances = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            distances[i] = distanceToLine(samples.get(i), reference);
        }
        Arrays.sort(distances);
        return distances[distances.length / 2];
    }

    /**
     * Great-circle distance in meters between two WGS84 coordinates.
     */
    public static double haversineDistance(Coordinate p1, Coordinate p2) {
        double lat1 = Math.toRadians(p1.y);
        double lat2 = Math.toRadians(p2.y);
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(p2.x - p1.x);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * @throws GeometryException when the line is null, has fewer than two vertices or has
     *                           zero length
     */
    public static LineString requireValidLine(LineString line) {
        if (line == null || line.isEmpty()) {
            throw new GeometryException("Line geometry is missing");
        }
        if (line.getNumPoints() < 2) {
            throw new GeometryException("Line needs at least two vertices, got " + line.getNumPoints());
        }
        if (line.getLength() <= 0.0) {
            throw new GeometryException("Line has zero length");
        }
        return line;
    }
}
