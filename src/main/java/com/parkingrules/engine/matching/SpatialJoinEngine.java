package com.parkingrules.engine.matching;

import com.parkingrules.engine.geometry.GeometryUtils;
import com.parkingrules.engine.model.MatchConfidence;
import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Regulation;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.SweepingSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a side-less regulation into zero, one or two segment attachments.
 *
 * Flow:
 * 1. If the regulation carries a street address, try the address ranges first
 * 2. Find candidate centerlines within the search radius, in id order
 * 3. Measure each side by the median sample distance to its reference line (meters)
 * 4. Classify each side CLEAR / BOUNDARY / OUT_OF_RANGE
 * 5. Decide:
 *    - some side CLEAR: the nearest such centerline wins and all its CLEAR sides attach,
 *      so a full-width stroke lands on both curbs
 *    - no side CLEAR: each BOUNDARY side goes to the {@link BoundaryConflictResolver}
 *      and only confirmed sides attach
 *    - nothing: unmatched, dropped
 *
 * Stateless apart from its settings; safe to call from many join workers at once.
 */
@Slf4j
@RequiredArgsConstructor
public class SpatialJoinEngine {

    private final JoinSettings settings;
    private final AddressRangeMatcher addressRangeMatcher;
    private final BoundaryConflictResolver boundaryConflictResolver;

    public JoinSettings settings() {
        return settings;
    }

    public List<SegmentAttachment> joinRegulationToSegments(Regulation regulation, JoinContext context) {
        if (regulation.hasAddress()) {
            Optional<StreetSegment> byAddress = addressRangeMatcher.matchByAddress(
                regulation.streetName(), regulation.addressNumber(),
                context.segmentsOnStreet(regulation.streetName()));
            if (byAddress.isPresent()) {
                log.debug("Regulation {} matched by address to {}", regulation.id(), byAddress.get().key());
                return List.of(new SegmentAttachment(byAddress.get().key(), MatchConfidence.ADDRESS_MATCHED));
            }
        }

        Geometry projected = context.projection().project(regulation.geometry());
        List<String> centerlineIds = context.candidateCenterlines(projected, settings.searchRadiusMeters());

        List<SideCandidate> clear = new ArrayList<>();
        List<SideCandidate> boundary = new ArrayList<>();
        String nearestClearCenterline = null;
        double nearestClearDistance = Double.MAX_VALUE;

        for (String centerlineId : centerlineIds) {
            for (StreetSegment side : context.sidesOf(centerlineId)) {
                double distance = GeometryUtils.medianSampledDistance(
                    projected, context.projectedReferenceLine(side.key()));
                ProximityTier tier = ProximityTier.classify(distance, settings);
                log.trace("Regulation {} -> {}: {}m {}", regulation.id(), side.key(),
                    String.format("%.2f", distance), tier);

                if (tier == ProximityTier.CLEAR) {
                    clear.add(new SideCandidate(side, distance));
                    if (distance < nearestClearDistance) {
                        nearestClearDistance = distance;
                        nearestClearCenterline = centerlineId;
                    }
                } else if (tier == ProximityTier.BOUNDARY) {
                    boundary.add(new SideCandidate(side, distance));
                }
            }
        }

        List<SegmentAttachment> attachments = new ArrayList<>();
        if (nearestClearCenterline != null) {
            for (SideCandidate candidate : clear) {
                if (candidate.segment().centerlineId().equals(nearestClearCenterline)) {
                    attachments.add(new SegmentAttachment(candidate.segment().key(), MatchConfidence.CLEAR));
                }
            }
        } else {
            for (SideCandidate candidate : boundary) {
                BoundaryOutcome outcome = boundaryConflictResolver.evaluate(regulation, candidate.segment(), context);
                if (outcome.isConfirmed()) {
                    attachments.add(new SegmentAttachment(candidate.segment().key(), MatchConfidence.BOUNDARY_RESOLVED));
                }
            }
        }

        if (attachments.isEmpty()) {
            log.debug("Regulation {} unmatched ({} candidate centerlines, {} boundary sides)",
                regulation.id(), centerlineIds.size(), boundary.size());
        }
        return attachments;
    }

    /**
     * Sides a meter schedule covers: the named side, or both sides when it names none.
     */
    public List<SegmentKey> meterTargets(MeterSchedule meter, JoinContext context) {
        List<SegmentKey> targets = new ArrayList<>();
        for (StreetSegment side : context.sidesOf(meter.centerlineId())) {
            if (meter.coversBothSides() || side.side() == meter.side()) {
                targets.add(side.key());
            }
        }
        return targets;
    }

    /**
     * Sweeping schedules are keyed by the source; they attach only when that side exists.
     */
    public Optional<SegmentKey> sweepingTarget(SweepingSchedule sweeping, JoinContext context) {
        return context.segment(sweeping.key()).map(StreetSegment::key);
    }

    private record SideCandidate(StreetSegment segment, double distanceMeters) {
    }
}
