package com.parkingrules.engine.dto;

import com.parkingrules.engine.model.LegalityResult;
import com.parkingrules.engine.model.LegalityStatus;
import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.UpcomingRestriction;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Legality answer for one segment side, as returned by the API.
 *
 * @param centerlineId    centerline id
 * @param side            {@code L} or {@code R}
 * @param streetName      street name
 * @param cardinalDirection side label
 * @param distanceMeters  distance from the query point, only for nearby searches
 * @param checkedAt       start of the stay, local time
 * @param durationMinutes length of the stay
 * @param status          legal or illegal
 * @param explanation     why
 * @param costEstimate    meter cost, if metered
 * @param nextRestriction next hard restriction after the stay, if any
 * @param applicableRules rules active during the stay
 */
public record SegmentLegalityRecord(
    String centerlineId,
    String side,
    String streetName,
    String cardinalDirection,
    Double distanceMeters,
    LocalDateTime checkedAt,
    int durationMinutes,
    LegalityStatus status,
    String explanation,
    BigDecimal costEstimate,
    UpcomingRestriction nextRestriction,
    List<Rule> applicableRules
) {

    public static SegmentLegalityRecord of(StreetSegment segment, Double distanceMeters, LocalDateTime checkedAt,
                                           int durationMinutes, LegalityResult result) {
        return new SegmentLegalityRecord(
            segment.centerlineId(),
            segment.side().code(),
            segment.streetName(),
            segment.cardinalDirection(),
            distanceMeters,
            checkedAt,
            durationMinutes,
            result.status(),
            result.explanation(),
            result.costEstimate(),
            result.nextRestriction(),
            result.applicableRules()
        );
    }
}
