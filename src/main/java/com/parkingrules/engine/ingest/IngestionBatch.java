package com.parkingrules.engine.ingest;

import com.parkingrules.engine.dto.BlockfaceRecord;
import com.parkingrules.engine.dto.CenterlineRecord;
import com.parkingrules.engine.dto.MeterRecord;
import com.parkingrules.engine.dto.ParcelRecord;
import com.parkingrules.engine.dto.RegulationRecord;
import com.parkingrules.engine.dto.SweepingRecord;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw input of one ingestion run, fully loaded into memory before the join starts.
 * Lists are copied as given, so a null entry from a malformed dataset reaches ingestion.
 */
@Builder
public record IngestionBatch(
    List<CenterlineRecord> centerlines,
    List<RegulationRecord> regulations,
    List<MeterRecord> meters,
    List<ParcelRecord> parcels,
    List<SweepingRecord> sweeping,
    List<BlockfaceRecord> blockfaces
) {

    public IngestionBatch {
        centerlines = copyOf(centerlines);
        regulations = copyOf(regulations);
        meters = copyOf(meters);
        parcels = copyOf(parcels);
        sweeping = copyOf(sweeping);
        blockfaces = copyOf(blockfaces);
    }

    private static <T> List<T> copyOf(List<T> records) {
        return records == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(records));
    }
}
