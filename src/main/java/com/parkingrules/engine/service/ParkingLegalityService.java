package com.parkingrules.engine.service;

import com.parkingrules.engine.dto.SegmentLegalityRecord;
import com.parkingrules.engine.dto.SegmentView;
import com.parkingrules.engine.dto.SnapshotStatsRecord;
import com.parkingrules.engine.ingest.IngestionReport;
import com.parkingrules.engine.model.LegalityResult;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.rules.InterpretationLookup;
import com.parkingrules.engine.rules.LegalityRuleEngine;
import com.parkingrules.engine.store.NearbySegment;
import com.parkingrules.engine.store.SegmentSnapshot;
import com.parkingrules.engine.store.SnapshotRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Query path: resolves segments in the current snapshot and evaluates legality.
 *
 * Each call reads the snapshot once, so a request never mixes two ingestion runs even when
 * a new snapshot is published mid-request. Nothing is cached; answers are computed per call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkingLegalityService {

    private final SnapshotRegistry snapshotRegistry;
    private final LegalityRuleEngine legalityRuleEngine;
    private final InterpretationLookup interpretationLookup;
    private final Clock parkingClock;

    public SnapshotStatsRecord snapshotStats(IngestionReport lastRun) {
        SegmentSnapshot snapshot = snapshotRegistry.current();
        return new SnapshotStatsRecord(snapshotRegistry.hasSnapshot(), snapshot.builtAt(),
            snapshot.centerlineCount(), snapshot.size(), snapshot.ruleCount(), snapshot.meterCount(), lastRun);
    }

    public Optional<SegmentView> findSegment(String centerlineId, StreetSide side) {
        return snapshotRegistry.current().find(centerlineId, side).map(SegmentView::from);
    }

    /**
     * @param at local start of the stay, or {@code null} for now
     */
    public Optional<SegmentLegalityRecord> evaluate(String centerlineId, StreetSide side, LocalDateTime at,
                                                    int durationMinutes) {
        LocalDateTime checkTime = at != null ? at : LocalDateTime.now(parkingClock);
        return snapshotRegistry.current().find(centerlineId, side)
            .map(segment -> toRecord(segment, null, checkTime, durationMinutes));
    }

    public List<SegmentLegalityRecord> evaluateNearby(double lat, double lon, double radiusMeters,
                                                      LocalDateTime at, int durationMinutes) {
        LocalDateTime checkTime = at != null ? at : LocalDateTime.now(parkingClock);
        SegmentSnapshot snapshot = snapshotRegistry.current();

        List<NearbySegment> nearby = snapshot.findNear(lat, lon, radiusMeters);
        log.debug("Found {} segments within {}m of ({}, {})", nearby.size(), radiusMeters, lat, lon);

        List<SegmentLegalityRecord> results = new ArrayList<>(nearby.size());
        for (NearbySegment found : nearby) {
            results.add(toRecord(found.segment(), found.distanceMeters(), checkTime, durationMinutes));
        }
        return results;
    }

    private SegmentLegalityRecord toRecord(StreetSegment segment, Double distance, LocalDateTime checkTime,
                                           int durationMinutes) {
        LegalityResult result = legalityRuleEngine.evaluate(segment, checkTime, durationMinutes,
            interpretationLookup);
        return SegmentLegalityRecord.of(segment, distance, checkTime, durationMinutes, result);
    }
}
