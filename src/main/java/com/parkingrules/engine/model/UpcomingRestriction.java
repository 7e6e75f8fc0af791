package com.parkingrules.engine.model;

import java.time.LocalDateTime;

/**
 * Next hard-blocking restriction after a requested stay.
 *
 * @param kind        kind of the restriction
 * @param startsAt    local start time
 * @param description what the restriction is
 */
public record UpcomingRestriction(RuleKind kind, LocalDateTime startsAt, String description) {
}
