package com.parkingrules.engine.service;

import com.parkingrules.engine.config.ParkingProperties;
import com.parkingrules.engine.ingest.DatasetSource;
import com.parkingrules.engine.ingest.IngestionBatch;
import com.parkingrules.engine.ingest.IngestionFailedException;
import com.parkingrules.engine.ingest.IngestionReport;
import com.parkingrules.engine.ingest.IngestionResult;
import com.parkingrules.engine.ingest.IngestionService;
import com.parkingrules.engine.store.SnapshotRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Drives ingestion runs and publishes their snapshots.
 *
 * Triggers:
 * - Application startup (parking.ingestion.run-on-startup)
 * - Nightly cron (parking.ingestion.cron)
 * - Manual refresh through the REST API
 *
 * Runs never overlap. A failed run leaves the previously published snapshot in place.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionJob {

    private final DatasetSource datasetSource;
    private final IngestionService ingestionService;
    private final SnapshotRegistry snapshotRegistry;
    private final SnapshotPersistenceService persistenceService;
    private final ParkingProperties properties;

    private volatile IngestionReport lastReport;

    @PostConstruct
    public void onStartup() {
        if (!properties.getIngestion().isRunOnStartup()) {
            log.info("Startup ingestion disabled, serving an empty snapshot until the first run");
            return;
        }
        try {
            runIngestion();
        } catch (IngestionFailedException e) {
            log.error("Startup ingestion failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${parking.ingestion.cron:0 0 3 * * *}")
    public void scheduledRun() {
        log.info("Scheduled ingestion starting");
        try {
            runIngestion();
        } catch (IngestionFailedException e) {
            log.error("Scheduled ingestion failed, keeping the current snapshot: {}", e.getMessage(), e);
        }
    }

    @Async
    public CompletableFuture<IngestionReport> refreshAsync() {
        try {
            return CompletableFuture.completedFuture(runIngestion());
        } catch (IngestionFailedException e) {
            log.error("Manual ingestion failed: {}", e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Load, ingest, publish, then persist. Persistence failures are logged; the snapshot stays
     * published because readers are served from memory.
     *
     * @throws IngestionFailedException when the datasets cannot be loaded or the run aborts
     */
    public synchronized IngestionReport runIngestion() {
        log.info("Loading datasets from {}", datasetSource.describe());
        IngestionBatch batch = datasetSource.load();

        IngestionResult result;
        try {
            result = ingestionService.ingest(batch);
        } catch (IngestionFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IngestionFailedException("Ingestion aborted: " + e.getMessage(), e);
        }

        snapshotRegistry.publish(result.snapshot());
        lastReport = result.report();

        try {
            persistenceService.persist(result.snapshot());
        } catch (RuntimeException e) {
            log.error("Failed to persist snapshot built at {}: {}", result.snapshot().builtAt(), e.getMessage(), e);
        }
        return result.report();
    }

    public Optional<IngestionReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }
}
