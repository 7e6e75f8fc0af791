package com.parkingrules.engine.store;

import com.parkingrules.engine.geometry.LocalProjection;
import com.parkingrules.engine.matching.AddressRangeMatcher;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.StreetSide;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.STRtree;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Finished, immutable segment collection served read-only to the query path.
 *
 * Lookups by key, by centerline, by street and by radius. Readers never see a partially
 * built snapshot: a new one replaces the old in {@link SnapshotRegistry} in a single swap.
 */
public final class SegmentSnapshot {

    private static final SegmentSnapshot EMPTY = new SegmentSnapshot(List.of(), Instant.EPOCH);

    private final Map<SegmentKey, StreetSegment> segments;
    private final Map<String, List<StreetSegment>> byCenterline;
    private final Map<String, List<StreetSegment>> byStreet;
    private final STRtree spatialIndex;
    private final Instant builtAt;
    private final int ruleCount;
    private final int meterCount;

    public SegmentSnapshot(Collection<StreetSegment> segmentList, Instant builtAt) {
        Map<SegmentKey, StreetSegment> byKey = new TreeMap<>();
        Map<String, List<StreetSegment>> centerlines = new HashMap<>();
        Map<String, List<StreetSegment>> streets = new HashMap<>();
        STRtree index = new STRtree();
        int rules = 0;
        int meters = 0;

        for (StreetSegment segment : segmentList) {
            if (byKey.put(segment.key(), segment) != null) {
                throw new IllegalArgumentException("Duplicate segment: " + segment.key());
            }
            rules += segment.rules().size();
            meters += segment.meters().size();
        }
        for (StreetSegment segment : byKey.values()) {
            centerlines.computeIfAbsent(segment.centerlineId(), id -> new ArrayList<>()).add(segment);
            streets.computeIfAbsent(AddressRangeMatcher.normalizeStreetName(segment.streetName()),
                name -> new ArrayList<>()).add(segment);
            Envelope envelope = new Envelope(segment.centerline().getEnvelopeInternal());
            envelope.expandToInclude(segment.referenceLine().getEnvelopeInternal());
            index.insert(envelope, segment);
        }
        index.build();

        this.segments = Collections.unmodifiableMap(byKey);
        this.byCenterline = freeze(centerlines);
        this.byStreet = freeze(streets);
        this.spatialIndex = index;
        this.builtAt = builtAt;
        this.ruleCount = rules;
        this.meterCount = meters;
    }

    public static SegmentSnapshot empty() {
        return EMPTY;
    }

    public Optional<StreetSegment> find(SegmentKey key) {
        return Optional.ofNullable(segments.get(key));
    }

    public Optional<StreetSegment> find(String centerlineId, StreetSide side) {
        return find(SegmentKey.of(centerlineId, side));
    }

    public List<StreetSegment> sidesOf(String centerlineId) {
        return byCenterline.getOrDefault(centerlineId, List.of());
    }

    public List<StreetSegment> onStreet(String streetName) {
        return byStreet.getOrDefault(AddressRangeMatcher.normalizeStreetName(streetName), List.of());
    }

    public Collection<StreetSegment> segments() {
        return segments.values();
    }

    /**
     * Segments whose reference line (curb geometry, else centerline) lies within
     * {@code radiusMeters} of a WGS84 point, nearest first.
     */
    public List<NearbySegment> findNear(double lat, double lon, double radiusMeters) {
        if (radiusMeters < 0) {
            throw new IllegalArgumentException("Radius cannot be negative: " + radiusMeters);
        }
        LocalProjection projection = new LocalProjection(lon, lat);
        double dLat = LocalProjection.metersToLatDegrees(radiusMeters);
        double dLon = projection.metersToLonDegrees(radiusMeters);
        Envelope searchEnv = new Envelope(lon - dLon, lon + dLon, lat - dLat, lat + dLat);

        @SuppressWarnings("unchecked")
        List<StreetSegment> hits = spatialIndex.query(searchEnv);

        List<NearbySegment> nearby = new ArrayList<>();
        for (StreetSegment segment : hits) {
            LineString reference = projection.project(segment.referenceLine());
            Point origin = reference.getFactory().createPoint(new Coordinate(0.0, 0.0));
            double distance = reference.distance(origin);
            if (distance <= radiusMeters) {
                nearby.add(new NearbySegment(segment, distance));
            }
        }
        nearby.sort(Comparator.comparingDouble(NearbySegment::distanceMeters)
            .thenComparing(found -> found.segment().key()));
        return nearby;
    }

    public int size() {
        return segments.size();
    }

    public int centerlineCount() {
        return byCenterline.size();
    }

    public int ruleCount() {
        return ruleCount;
    }

    public int meterCount() {
        return meterCount;
    }

    public Instant builtAt() {
        return builtAt;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    private static Map<String, List<StreetSegment>> freeze(Map<String, List<StreetSegment>> source) {
        Map<String, List<StreetSegment>> frozen = new HashMap<>();
        source.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }
}
