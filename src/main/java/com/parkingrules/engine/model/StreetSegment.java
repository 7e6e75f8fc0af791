package com.parkingrules.engine.model;

import lombok.Builder;
import org.locationtech.jts.geom.LineString;

import java.util.List;
import java.util.Objects;

/**
 * One physical side of one street centerline, the unit rules attach to.
 *
 * Identity is {@code (centerlineId, side)}. The side is assigned once when the segment is
 * created and never recomputed. Rules and meters are held as immutable lists; the ingestion
 * store builds a new instance when it freezes a run.
 *
 * @param key               centerline id and side
 * @param streetName        street name
 * @param fromStreet        first cross street, if known
 * @param toStreet          last cross street, if known
 * @param addressRange      address interval on this side, if known
 * @param centerline        WGS84 centerline geometry, at least two vertices
 * @param curbGeometry      refined curb-offset geometry, if any
 * @param cardinalDirection display label for the side, e.g. {@code North}
 * @param rules             attached rules, order-independent
 * @param meters            attached meter schedules
 */
@Builder(toBuilder = true)
public record StreetSegment(
    SegmentKey key,
    String streetName,
    String fromStreet,
    String toStreet,
    AddressRange addressRange,
    LineString centerline,
    LineString curbGeometry,
    String cardinalDirection,
    List<Rule> rules,
    List<MeterSchedule> meters
) {

    public StreetSegment {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(centerline, "centerline");
        if (centerline.getNumPoints() < 2) {
            throw new IllegalArgumentException("Centerline of " + key + " needs at least two vertices");
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        meters = meters == null ? List.of() : List.copyOf(meters);
    }

    public String centerlineId() {
        return key.centerlineId();
    }

    public StreetSide side() {
        return key.side();
    }

    /**
     * Line the side's distances are measured against: the curb geometry when present,
     * otherwise the centerline.
     */
    public LineString referenceLine() {
        return curbGeometry != null ? curbGeometry : centerline;
    }

    public boolean hasRules() {
        return !rules.isEmpty() || !meters.isEmpty();
    }
}
