package com.parkingrules.engine.dto;

import com.parkingrules.engine.ingest.IngestionReport;

import java.time.Instant;

/**
 * Statistics of the snapshot currently served, plus the report of the last ingestion run.
 */
public record SnapshotStatsRecord(
    boolean published,
    Instant builtAt,
    int centerlines,
    int segments,
    int rules,
    int meters,
    IngestionReport lastRun
) {
}
