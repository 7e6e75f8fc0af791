package com.parkingrules.engine.service;

import com.parkingrules.engine.config.ParkingProperties;
import com.parkingrules.engine.ingest.DatasetSource;
import com.parkingrules.engine.ingest.IngestionBatch;
import com.parkingrules.engine.ingest.IngestionFailedException;
import com.parkingrules.engine.ingest.IngestionReport;
import com.parkingrules.engine.ingest.IngestionResult;
import com.parkingrules.engine.ingest.IngestionService;
import com.parkingrules.engine.store.SegmentSnapshot;
import com.parkingrules.engine.store.SnapshotRegistry;
import com.parkingrules.engine.testutil.TestGeometries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionJobTest {

    @Mock
    private DatasetSource datasetSource;

    @Mock
    private IngestionService ingestionService;

    @Mock
    private SnapshotPersistenceService persistenceService;

    private final SnapshotRegistry snapshotRegistry = new SnapshotRegistry();
    private final ParkingProperties properties = new ParkingProperties();

    private IngestionJob job;

    private static final IngestionBatch BATCH = IngestionBatch.builder().build();

    private static final SegmentSnapshot SNAPSHOT = new SegmentSnapshot(
        TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0), Instant.parse("2024-01-01T11:00:00Z"));

    private static final IngestionReport REPORT = IngestionReport.builder()
        .completedAt(Instant.parse("2024-01-01T11:00:00Z"))
        .centerlines(1)
        .segments(2)
        .build();

    @BeforeEach
    void setUp() {
        job = new IngestionJob(datasetSource, ingestionService, snapshotRegistry, persistenceService, properties);
    }

    @Test
    void shouldPublishSnapshotAndRememberReport() {
        when(datasetSource.load()).thenReturn(BATCH);
        when(ingestionService.ingest(BATCH)).thenReturn(new IngestionResult(SNAPSHOT, REPORT));

        IngestionReport report = job.runIngestion();

        assertThat(report).isEqualTo(REPORT);
        assertThat(snapshotRegistry.current()).isSameAs(SNAPSHOT);
        assertThat(job.lastReport()).contains(REPORT);
        verify(persistenceService).persist(SNAPSHOT);
    }

    @Test
    void shouldKeepPreviousSnapshotWhenIngestionAborts() {
        when(datasetSource.load()).thenReturn(BATCH);
        when(ingestionService.ingest(BATCH)).thenThrow(new IllegalStateException("worker died"));

        assertThatThrownBy(() -> job.runIngestion())
            .isInstanceOf(IngestionFailedException.class)
            .hasMessageContaining("worker died");

        assertThat(snapshotRegistry.hasSnapshot()).isFalse();
        assertThat(job.lastReport()).isEmpty();
        verifyNoInteractions(persistenceService);
    }

    @Test
    void shouldKeepPreviousSnapshotWhenDatasetsCannotBeLoaded() {
        snapshotRegistry.publish(SNAPSHOT);
        when(datasetSource.load()).thenThrow(new IngestionFailedException("Dataset directory not found: ./data"));

        job.scheduledRun();

        assertThat(snapshotRegistry.current()).isSameAs(SNAPSHOT);
        verify(ingestionService, never()).ingest(any());
    }

    @Test
    void shouldStayPublishedWhenPersistenceFails() {
        when(datasetSource.load()).thenReturn(BATCH);
        when(ingestionService.ingest(BATCH)).thenReturn(new IngestionResult(SNAPSHOT, REPORT));
        when(persistenceService.persist(SNAPSHOT)).thenThrow(new IllegalStateException("database down"));

        IngestionReport report = job.runIngestion();

        assertThat(report).isEqualTo(REPORT);
        assertThat(snapshotRegistry.current()).isSameAs(SNAPSHOT);
    }

    @Test
    void shouldSkipStartupIngestionWhenDisabled() {
        properties.getIngestion().setRunOnStartup(false);

        job.onStartup();

        verifyNoInteractions(datasetSource, ingestionService, persistenceService);
        assertThat(snapshotRegistry.hasSnapshot()).isFalse();
    }

    @Test
    void shouldNotFailStartupWhenIngestionFails() {
        when(datasetSource.load()).thenThrow(new IngestionFailedException("Required dataset missing"));

        job.onStartup();

        assertThat(snapshotRegistry.hasSnapshot()).isFalse();
    }

    @Test
    void shouldCompleteRefreshFutureExceptionallyOnFailure() {
        when(datasetSource.load()).thenThrow(new IngestionFailedException("Required dataset missing"));

        CompletableFuture<IngestionReport> future = job.refreshAsync();

        assertThat(future).isCompletedExceptionally();
    }
}
