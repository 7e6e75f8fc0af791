package com.parkingrules.engine.ingest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkingrules.engine.dto.BlockfaceRecord;
import com.parkingrules.engine.dto.CenterlineRecord;
import com.parkingrules.engine.dto.MeterRecord;
import com.parkingrules.engine.dto.ParcelRecord;
import com.parkingrules.engine.dto.RegulationRecord;
import com.parkingrules.engine.dto.SweepingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the datasets from JSON arrays in one directory:
 * {@code centerlines.json} (required), {@code regulations.json}, {@code meters.json},
 * {@code parcels.json}, {@code sweeping.json} and {@code blockfaces.json} (each optional).
 */
@Slf4j
@RequiredArgsConstructor
public class JsonDatasetSource implements DatasetSource {

    public static final String CENTERLINES = "centerlines.json";
    public static final String REGULATIONS = "regulations.json";
    public static final String METERS = "meters.json";
    public static final String PARCELS = "parcels.json";
    public static final String SWEEPING = "sweeping.json";
    public static final String BLOCKFACES = "blockfaces.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Override
    public IngestionBatch load() {
        if (!Files.isDirectory(directory)) {
            throw new IngestionFailedException("Dataset directory not found: " + directory);
        }
        if (!Files.isRegularFile(directory.resolve(CENTERLINES))) {
            throw new IngestionFailedException("Required dataset missing: " + directory.resolve(CENTERLINES));
        }

        return IngestionBatch.builder()
            .centerlines(read(CENTERLINES, new TypeReference<List<CenterlineRecord>>() { }))
            .regulations(read(REGULATIONS, new TypeReference<List<RegulationRecord>>() { }))
            .meters(read(METERS, new TypeReference<List<MeterRecord>>() { }))
            .parcels(read(PARCELS, new TypeReference<List<ParcelRecord>>() { }))
            .sweeping(read(SWEEPING, new TypeReference<List<SweepingRecord>>() { }))
            .blockfaces(read(BLOCKFACES, new TypeReference<List<BlockfaceRecord>>() { }))
            .build();
    }

    @Override
    public String describe() {
        return directory.toAbsolutePath().toString();
    }

    private <T> List<T> read(String fileName, TypeReference<List<T>> type) {
        Path file = directory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            log.info("Optional dataset {} not present, using none", fileName);
            return List.of();
        }
        try {
            List<T> records = objectMapper.readValue(file.toFile(), type);
            log.debug("Loaded {} records from {}", records == null ? 0 : records.size(), file);
            return records == null ? List.of() : records;
        } catch (IOException e) {
            throw new IngestionFailedException("Failed to read dataset " + file + ": " + e.getMessage(), e);
        }
    }
}
