package com.parkingrules.engine.matching;

import com.parkingrules.engine.geometry.GeometryUtils;
import com.parkingrules.engine.geometry.LocalProjection;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.linearref.LengthIndexedLine;

import java.util.List;

/**
 * Decides which side of a centerline a candidate geometry lies on by multi-point voting.
 *
 * Flow:
 * 1. Project the centerline and the candidate into local meters
 * 2. Sample the candidate at 0.25, 0.5 and 0.75 of its length (centroid for non-lines)
 * 3. For each sample, find the nearest centerline position and the local tangent there
 *    by a small forward/backward finite difference
 * 4. Cross the tangent with the vector from that position to the sample:
 *    positive votes LEFT, negative votes RIGHT, zero abstains
 * 5. Two or more votes for one side win; anything else is INDETERMINATE
 *
 * Single-point sampling misreads curved or noisy polylines near their ends; the majority
 * vote does not.
 */
@Slf4j
public class SideDeterminer {

    public static final double DEFAULT_TANGENT_DELTA_METERS = 0.5;

    private static final int MAJORITY = 2;

    private final double tangentDeltaMeters;

    public SideDeterminer() {
        this(DEFAULT_TANGENT_DELTA_METERS);
    }

    public SideDeterminer(double tangentDeltaMeters) {
        if (tangentDeltaMeters <= 0.0) {
            throw new IllegalArgumentException("Tangent delta must be positive: " + tangentDeltaMeters);
        }
        this.tangentDeltaMeters = tangentDeltaMeters;
    }

    /**
     * @param centerline WGS84 reference centerline, directed from its first vertex
     * @param candidate  WGS84 regulation line, blockface or parcel geometry
     * @return side label, or {@link SideVerdict#INDETERMINATE} without a two-vote majority
     */
    public SideVerdict determineSide(LineString centerline, Geometry candidate) {
        GeometryUtils.requireValidLine(centerline);
        Coordinate origin = centerline.getCoordinateN(0);
        LocalProjection projection = new LocalProjection(origin.x, origin.y);

        LineString projectedCenterline = projection.project(centerline);
        Geometry projectedCandidate = projection.project(candidate);
        return vote(projectedCenterline, GeometryUtils.samplePoints(projectedCandidate));
    }

    private SideVerdict vote(LineString centerline, List<Coordinate> samples) {
        LengthIndexedLine indexed = new LengthIndexedLine(centerline);
        double startIndex = indexed.getStartIndex();
        double endIndex = indexed.getEndIndex();

        int left = 0;
        int right = 0;
        for (Coordinate sample : samples) {
            double index = indexed.project(sample);
            Coordinate behind = indexed.extractPoint(Math.max(startIndex, index - tangentDeltaMeters));
            Coordinate ahead = indexed.extractPoint(Math.min(endIndex, index + tangentDeltaMeters));
            Coordinate foot = indexed.extractPoint(index);

            double tx = ahead.x - behind.x;
            double ty = ahead.y - behind.y;
            if (tx == 0.0 && ty == 0.0) {
                continue;
            }

            Coordinate direction = new Coordinate(foot.x + tx, foot.y + ty);
            int sign = GeometryUtils.crossProductSide(foot, direction, sample);
            if (sign > 0) {
                left++;
            } else if (sign < 0) {
                right++;
            }
        }

        log.trace("Side votes: left={}, right={}", left, right);
        if (left >= MAJORITY) {
            return SideVerdict.LEFT;
        }
        if (right >= MAJORITY) {
            return SideVerdict.RIGHT;
        }
        return SideVerdict.INDETERMINATE;
    }
}
