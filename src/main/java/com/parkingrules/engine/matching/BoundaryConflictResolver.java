package com.parkingrules.engine.matching;

import com.parkingrules.engine.geometry.GeometryUtils;
import com.parkingrules.engine.model.Parcel;
import com.parkingrules.engine.model.Regulation;
import com.parkingrules.engine.model.StreetSegment;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;

import java.util.Locale;
import java.util.Optional;

/**
 * Breaks BOUNDARY ties with the administrative overlay.
 *
 * Flow:
 * 1. Reject a regulation that lacks neighborhood or district
 * 2. Look up the parcel at the midpoint of the candidate side's reference line
 * 3. Confirm only when both neighborhood and district match, case-insensitively
 *
 * No parcel, or any mismatch, rejects the attachment (fail closed).
 */
@Slf4j
public class BoundaryConflictResolver {

    public boolean resolveBoundary(Regulation regulation, StreetSegment candidateSide, JoinContext context) {
        return evaluate(regulation, candidateSide, context).isConfirmed();
    }

    public BoundaryOutcome evaluate(Regulation regulation, StreetSegment candidateSide, JoinContext context) {
        if (isBlank(regulation.neighborhood()) || isBlank(regulation.district())) {
            log.debug("Regulation {} has no neighborhood/district, rejecting boundary side {}",
                regulation.id(), candidateSide.key());
            return BoundaryOutcome.MISSING_ATTRIBUTES;
        }

        Coordinate midpoint = GeometryUtils.midpoint(candidateSide.referenceLine());
        Optional<Parcel> parcel = context.parcels().findContaining(midpoint);
        if (parcel.isEmpty()) {
            log.debug("No parcel at midpoint of {} for regulation {}", candidateSide.key(), regulation.id());
            return BoundaryOutcome.PARCEL_NOT_FOUND;
        }

        Parcel found = parcel.get();
        boolean matches = sameValue(regulation.neighborhood(), found.neighborhood())
            && sameValue(regulation.district(), found.district());
        if (!matches) {
            log.debug("Parcel {} ({}/{}) does not match regulation {} ({}/{})",
                found.id(), found.neighborhood(), found.district(),
                regulation.id(), regulation.neighborhood(), regulation.district());
            return BoundaryOutcome.ATTRIBUTE_MISMATCH;
        }
        return BoundaryOutcome.CONFIRMED;
    }

    private static boolean sameValue(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return a.trim().toLowerCase(Locale.ROOT).equals(b.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
