package com.parkingrules.engine.matching;

import com.parkingrules.engine.model.Parcel;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.parkingrules.engine.geometry.GeometryUtils.WGS84;

/**
 * Point-in-polygon lookup over the administrative parcel overlay. The tree is built once
 * and read concurrently by join workers.
 */
public final class ParcelIndex {

    private static final ParcelIndex EMPTY = new ParcelIndex(List.of());

    private final STRtree index;
    private final int size;

    public ParcelIndex(Collection<Parcel> parcels) {
        this.index = new STRtree();
        int count = 0;
        for (Parcel parcel : parcels) {
            if (parcel == null) {
                throw new IllegalArgumentException("parcel cannot be null");
            }
            Envelope envelope = parcel.geometry().getEnvelopeInternal();
            index.insert(envelope, new IndexedParcel(parcel, PreparedGeometryFactory.prepare(parcel.geometry())));
            count++;
        }
        index.build();
        this.size = count;
    }

    public static ParcelIndex empty() {
        return EMPTY;
    }

    public int size() {
        return size;
    }

    /**
     * Parcel covering a WGS84 point. When overlays overlap, the lowest parcel id wins.
     */
    public Optional<Parcel> findContaining(Coordinate lonLat) {
        Envelope searchEnv = new Envelope(lonLat);

        @SuppressWarnings("unchecked")
        List<IndexedParcel> candidates = index.query(searchEnv);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Point point = WGS84.createPoint(lonLat);
        return candidates.stream()
            .filter(candidate -> candidate.prepared().covers(point))
            .map(IndexedParcel::parcel)
            .min(Comparator.comparing(Parcel::id));
    }

    private record IndexedParcel(Parcel parcel, PreparedGeometry prepared) {
    }
}
