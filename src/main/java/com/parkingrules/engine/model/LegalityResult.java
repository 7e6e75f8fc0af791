package com.parkingrules.engine.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Query-time answer for one segment, time and duration. Computed fresh per query.
 *
 * @param status          legal or illegal
 * @param explanation     human-readable reason
 * @param costEstimate    meter cost for the stay, if metered
 * @param nextRestriction next hard restriction after the stay, if any within the lookahead
 * @param applicableRules rules whose windows intersect the stay
 */
public record LegalityResult(
    LegalityStatus status,
    String explanation,
    BigDecimal costEstimate,
    UpcomingRestriction nextRestriction,
    List<Rule> applicableRules
) {

    public LegalityResult {
        applicableRules = applicableRules == null ? List.of() : List.copyOf(applicableRules);
    }

    public boolean isLegal() {
        return status == LegalityStatus.LEGAL;
    }
}
