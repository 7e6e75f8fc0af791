package com.parkingrules.engine.geometry;

import com.parkingrules.engine.model.StreetSide;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

/**
 * Builds a synthetic curb line parallel to a centerline, for sides that have no surveyed
 * blockface geometry.
 *
 * Each vertex moves along the averaged normal of its adjacent edges, computed in a local
 * metric projection so the offset is a true distance in meters.
 */
public class CurbOffsetGenerator {

    private final double offsetMeters;

    public CurbOffsetGenerator(double offsetMeters) {
        if (offsetMeters <= 0.0) {
            throw new IllegalArgumentException("Curb offset must be positive: " + offsetMeters);
        }
        this.offsetMeters = offsetMeters;
    }

    public double offsetMeters() {
        return offsetMeters;
    }

    /**
     * @param centerline WGS84 centerline
     * @param side       side to offset towards, relative to the centerline direction
     * @return WGS84 line with the same vertex count, offset {@link #offsetMeters()} to that side
     */
    public LineString offset(LineString centerline, StreetSide side) {
        GeometryUtils.requireValidLine(centerline);
        Coordinate first = centerline.getCoordinateN(0);
        LocalProjection projection = new LocalProjection(first.x, first.y);
        LineString projected = projection.project(centerline);

        Coordinate[] source = projected.getCoordinates();
        Coordinate[] shifted = new Coordinate[source.length];
        double sign = side == StreetSide.LEFT ? 1.0 : -1.0;

        for (int i = 0; i < source.length; i++) {
            double[] normal = vertexNormal(source, i);
            shifted[i] = new Coordinate(
                source[i].x + sign * normal[0] * offsetMeters,
                source[i].y + sign * normal[1] * offsetMeters);
        }

        LineString offsetLine = centerline.getFactory().createLineString(shifted);
        return projection.unproject(offsetLine);
    }

    // Left-pointing unit normal at vertex i, averaged over the edges that meet there.
    private static double[] vertexNormal(Coordinate[] coords, int i) {
        double nx = 0.0;
        double ny = 0.0;
        if (i > 0) {
            double[] n = edgeNormal(coords[i - 1], coords[i]);
            nx += n[0];
            ny += n[1];
        }
        if (i < coords.length - 1) {
            double[] n = edgeNormal(coords[i], coords[i + 1]);
            nx += n[0];
            ny += n[1];
        }
        double length = Math.hypot(nx, ny);
        if (length == 0.0) {
            // hairpin or repeated vertex: fall back to the incoming edge
            return i > 0 ? edgeNormal(coords[i - 1], coords[i]) : new double[] {0.0, 0.0};
        }
        return new double[] {nx / length, ny / length};
    }

    private static double[] edgeNormal(Coordinate a, Coordinate b) {
        double dx = b.x - a.x;
        double dy = b.y - a.y;
        double length = Math.hypot(dx, dy);
        if (length == 0.0) {
            return new double[] {0.0, 0.0};
        }
        return new double[] {-dy / length, dx / length};
    }
}
