package com.parkingrules.engine.matching;

import com.parkingrules.engine.geometry.LocalProjection;
import com.parkingrules.engine.model.Parcel;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSegment;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only view of everything a join needs: the segment skeleton of the run, its projected
 * reference lines, a centerline search tree, a by-street index and the parcel overlay.
 *
 * Built once before the join phase and shared by every worker; nothing in it changes after
 * construction.
 */
public final class JoinContext {

    private final LocalProjection projection;
    private final Map<SegmentKey, StreetSegment> segments;
    private final Map<SegmentKey, LineString> projectedReferenceLines;
    private final Map<String, List<StreetSegment>> sidesByCenterline;
    private final Map<String, List<StreetSegment>> segmentsByStreet;
    private final STRtree centerlineIndex;
    private final ParcelIndex parcels;

    private JoinContext(Collection<StreetSegment> segmentSkeleton, ParcelIndex parcels) {
        Envelope extent = new Envelope();
        for (StreetSegment segment : segmentSkeleton) {
            extent.expandToInclude(segment.centerline().getEnvelopeInternal());
        }
        this.projection = LocalProjection.centredOn(extent);

        Map<SegmentKey, StreetSegment> byKey = new TreeMap<>();
        for (StreetSegment segment : segmentSkeleton) {
            if (byKey.put(segment.key(), segment) != null) {
                throw new IllegalArgumentException("Duplicate segment: " + segment.key());
            }
        }

        Map<SegmentKey, LineString> projected = new HashMap<>();
        Map<String, List<StreetSegment>> byCenterline = new LinkedHashMap<>();
        Map<String, List<StreetSegment>> byStreet = new HashMap<>();
        Map<String, Envelope> centerlineEnvelopes = new TreeMap<>();

        for (StreetSegment segment : byKey.values()) {
            LineString reference = projection.project(segment.referenceLine());
            projected.put(segment.key(), reference);

            byCenterline.computeIfAbsent(segment.centerlineId(), id -> new ArrayList<>()).add(segment);
            byStreet.computeIfAbsent(AddressRangeMatcher.normalizeStreetName(segment.streetName()),
                name -> new ArrayList<>()).add(segment);

            Envelope envelope = centerlineEnvelopes.computeIfAbsent(segment.centerlineId(), id -> new Envelope());
            envelope.expandToInclude(reference.getEnvelopeInternal());
            envelope.expandToInclude(projection.project(segment.centerline()).getEnvelopeInternal());
        }

        this.centerlineIndex = new STRtree();
        centerlineEnvelopes.forEach((id, envelope) -> centerlineIndex.insert(envelope, id));
        centerlineIndex.build();

        this.segments = Collections.unmodifiableMap(byKey);
        this.projectedReferenceLines = Collections.unmodifiableMap(projected);
        this.sidesByCenterline = freeze(byCenterline);
        this.segmentsByStreet = freeze(byStreet);
        this.parcels = parcels;
    }

    public static JoinContext of(Collection<StreetSegment> segmentSkeleton, Collection<Parcel> parcels) {
        return new JoinContext(segmentSkeleton, new ParcelIndex(parcels));
    }

    public static JoinContext of(Collection<StreetSegment> segmentSkeleton, ParcelIndex parcels) {
        return new JoinContext(segmentSkeleton, parcels);
    }

    public LocalProjection projection() {
        return projection;
    }

    public ParcelIndex parcels() {
        return parcels;
    }

    public Optional<StreetSegment> segment(SegmentKey key) {
        return Optional.ofNullable(segments.get(key));
    }

    public Collection<StreetSegment> segments() {
        return segments.values();
    }

    /**
     * Both sides of a centerline, LEFT before RIGHT; empty for an unknown id.
     */
    public List<StreetSegment> sidesOf(String centerlineId) {
        return sidesByCenterline.getOrDefault(centerlineId, List.of());
    }

    public List<StreetSegment> segmentsOnStreet(String streetName) {
        return segmentsByStreet.getOrDefault(AddressRangeMatcher.normalizeStreetName(streetName), List.of());
    }

    /**
     * Reference line of a side in this context's projection (meters).
     */
    public LineString projectedReferenceLine(SegmentKey key) {
        LineString line = projectedReferenceLines.get(key);
        if (line == null) {
            throw new IllegalArgumentException("Unknown segment: " + key);
        }
        return line;
    }

    /**
     * Centerline ids with at least one side within {@code radiusMeters} of a projected
     * geometry, in id order.
     */
    public List<String> candidateCenterlines(Geometry projectedGeometry, double radiusMeters) {
        Envelope searchEnv = new Envelope(projectedGeometry.getEnvelopeInternal());
        searchEnv.expandBy(radiusMeters);

        @SuppressWarnings("unchecked")
        List<String> hits = centerlineIndex.query(searchEnv);

        TreeSet<String> candidates = new TreeSet<>();
        for (String centerlineId : hits) {
            for (StreetSegment side : sidesOf(centerlineId)) {
                if (projectedReferenceLine(side.key()).isWithinDistance(projectedGeometry, radiusMeters)) {
                    candidates.add(centerlineId);
                    break;
                }
            }
        }
        return new ArrayList<>(candidates);
    }

    private static Map<String, List<StreetSegment>> freeze(Map<String, List<StreetSegment>> source) {
        Map<String, List<StreetSegment>> frozen = new HashMap<>();
        source.forEach((key, list) -> {
            List<StreetSegment> sorted = new ArrayList<>(list);
            sorted.sort(Comparator.comparing(StreetSegment::key));
            frozen.put(key, List.copyOf(sorted));
        });
        return Collections.unmodifiableMap(frozen);
    }
}
