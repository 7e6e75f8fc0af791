package com.parkingrules.engine.ingest;

import com.parkingrules.engine.store.SegmentSnapshot;

public record IngestionResult(SegmentSnapshot snapshot, IngestionReport report) {
}
