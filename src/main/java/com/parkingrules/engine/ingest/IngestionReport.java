package com.parkingrules.engine.ingest;

import lombok.Builder;

import java.time.Instant;

/**
 * Counters of one ingestion run.
 */
@Builder
public record IngestionReport(
    Instant completedAt,
    long durationMillis,
    int centerlines,
    int segments,
    int regulations,
    int regulationsMatched,
    int regulationsUnmatched,
    int clearAttachments,
    int boundaryResolvedAttachments,
    int addressMatchedAttachments,
    int sweepingAttached,
    int sweepingUnmatched,
    int metersAttached,
    int metersUnmatched,
    int blockfacesAssigned,
    int blockfacesIndeterminate,
    int skippedInvalid
) {
}
