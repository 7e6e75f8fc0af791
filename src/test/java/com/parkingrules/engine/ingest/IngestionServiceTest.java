package com.parkingrules.engine.ingest;

import com.parkingrules.engine.dto.BlockfaceRecord;
import com.parkingrules.engine.dto.CenterlineRecord;
import com.parkingrules.engine.dto.MeterRecord;
import com.parkingrules.engine.dto.ParcelRecord;
import com.parkingrules.engine.dto.RegulationRecord;
import com.parkingrules.engine.dto.SweepingRecord;
import com.parkingrules.engine.geometry.CurbOffsetGenerator;
import com.parkingrules.engine.matching.AddressRangeMatcher;
import com.parkingrules.engine.matching.BoundaryConflictResolver;
import com.parkingrules.engine.matching.JoinSettings;
import com.parkingrules.engine.matching.SideDeterminer;
import com.parkingrules.engine.matching.SpatialJoinEngine;
import com.parkingrules.engine.model.MatchConfidence;
import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.RuleKind;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.normalize.RecordNormalizer;
import com.parkingrules.engine.store.SegmentSnapshot;
import com.parkingrules.engine.testutil.TestGeometries;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.LineString;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T03:00:00Z");

    private static final LineString BLOCKFACE = TestGeometries.eastbound(206, 0, 100);

    private static IngestionService service(int parallelism) {
        return new IngestionService(
            new RecordNormalizer(),
            new SideDeterminer(),
            new SpatialJoinEngine(JoinSettings.defaults(), new AddressRangeMatcher(), new BoundaryConflictResolver()),
            new CurbOffsetGenerator(5.0),
            parallelism,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RegulationRecord regulation(String id, LineString geometry, String type, String days,
                                               String hours, String hourLimit) {
        return new RegulationRecord(id, TestGeometries.wkt(geometry), type, null, days, hours, null, null,
            hourLimit, null, null, null, null, null, null);
    }

    private static IngestionBatch batch() {
        String main = TestGeometries.wkt(TestGeometries.eastbound(0, 0, 100));
        String oak = TestGeometries.wkt(TestGeometries.eastbound(200, 0, 100));
        return IngestionBatch.builder()
            .centerlines(List.of(
                new CenterlineRecord("CNN-1", "MAIN ST", main, 100, 198, 101, 199),
                new CenterlineRecord("CNN-2", "OAK ST", oak, null, null, null, null),
                new CenterlineRecord("CNN-1", "MAIN ST", main, null, null, null, null),
                new CenterlineRecord("CNN-3", "BROKEN ST", "LINESTRING (nope)", null, null, null, null)))
            .regulations(List.of(
                regulation("REG-1", TestGeometries.eastbound(0, 10, 90), "No parking", "Daily", "Anytime", null),
                regulation("REG-2", TestGeometries.eastbound(5, 10, 90), "Time limited", "M-F", "800-1800", "2"),
                regulation("REG-3", TestGeometries.eastbound(5, 10, 90), "Time limited", "Funday", null, "2"),
                regulation("REG-4", TestGeometries.eastbound(1000, 10, 90), "No parking", "Daily", null, null)))
            .meters(List.of(
                new MeterRecord("CNN-1", null, new BigDecimal("3.50"), "M-Sa", "900", "1800"),
                new MeterRecord("CNN-9", null, new BigDecimal("2.00"), null, null, null)))
            .sweeping(List.of(
                new SweepingRecord("CNN-1", "L", "Tues", "9", "11", List.of(), "York St - Bryant St", "N"),
                new SweepingRecord("CNN-9", "R", "Wed", "9", "11", null, null, null)))
            .blockfaces(List.of(
                new BlockfaceRecord("BF-1", "CNN-2", TestGeometries.wkt(BLOCKFACE)),
                new BlockfaceRecord("BF-2", "CNN-2", oak)))
            .parcels(List.<ParcelRecord>of())
            .build();
    }

    @Test
    void shouldBuildBothSidesOfEveryValidCenterline() {
        SegmentSnapshot snapshot = service(2).ingest(batch()).snapshot();

        assertThat(snapshot.size()).isEqualTo(4);
        assertThat(snapshot.sidesOf("CNN-1")).extracting(StreetSegment::side)
            .containsExactly(StreetSide.LEFT, StreetSide.RIGHT);
        assertThat(snapshot.sidesOf("CNN-3")).isEmpty();
        assertThat(snapshot.builtAt()).isEqualTo(NOW);
    }

    @Test
    void shouldMergeSweepingRegulationsAndMeters() {
        SegmentSnapshot snapshot = service(2).ingest(batch()).snapshot();

        StreetSegment left = snapshot.find("CNN-1", StreetSide.LEFT).orElseThrow();
        StreetSegment right = snapshot.find("CNN-1", StreetSide.RIGHT).orElseThrow();

        assertThat(left.rules()).extracting(Rule::kind)
            .containsExactly(RuleKind.SWEEPING, RuleKind.NO_PARKING, RuleKind.TIME_LIMIT);
        assertThat(right.rules()).extracting(Rule::sourceId).containsExactly("REG-1");
        assertThat(right.rules().get(0).confidence()).isEqualTo(MatchConfidence.CLEAR);
        assertThat(left.meters()).hasSize(1);
        assertThat(right.meters()).hasSize(1);

        assertThat(left.cardinalDirection()).isEqualTo("North");
        assertThat(right.cardinalDirection()).isEqualTo("South");
        assertThat(left.fromStreet()).isEqualTo("York St");
        assertThat(left.toStreet()).isEqualTo("Bryant St");
        assertThat(left.addressRange().fromAddress()).isEqualTo(100);
    }

    @Test
    void shouldUseSurveyedBlockfaceAsCurbWhenAvailable() {
        SegmentSnapshot snapshot = service(2).ingest(batch()).snapshot();

        StreetSegment oakLeft = snapshot.find("CNN-2", StreetSide.LEFT).orElseThrow();
        StreetSegment oakRight = snapshot.find("CNN-2", StreetSide.RIGHT).orElseThrow();

        assertThat(oakLeft.curbGeometry().equalsExact(BLOCKFACE, 1e-9)).isTrue();
        assertThat(oakRight.curbGeometry()).isNotNull();
        assertThat(oakRight.curbGeometry().equalsExact(BLOCKFACE, 1e-9)).isFalse();
    }

    @Test
    void shouldReportWhatHappenedToEveryRecord() {
        IngestionReport report = service(2).ingest(batch()).report();

        assertThat(report.centerlines()).isEqualTo(2);
        assertThat(report.segments()).isEqualTo(4);
        assertThat(report.regulations()).isEqualTo(3);
        assertThat(report.regulationsMatched()).isEqualTo(2);
        assertThat(report.regulationsUnmatched()).isEqualTo(1);
        assertThat(report.clearAttachments()).isEqualTo(3);
        assertThat(report.sweepingAttached()).isEqualTo(1);
        assertThat(report.sweepingUnmatched()).isEqualTo(1);
        assertThat(report.metersAttached()).isEqualTo(1);
        assertThat(report.metersUnmatched()).isEqualTo(1);
        assertThat(report.blockfacesAssigned()).isEqualTo(1);
        assertThat(report.blockfacesIndeterminate()).isEqualTo(1);
        // duplicate centerline, broken centerline geometry, unreadable days
        assertThat(report.skippedInvalid()).isEqualTo(3);
        assertThat(report.completedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldProduceIdenticalSnapshotsForIdenticalInput() {
        IngestionResult sequential = service(1).ingest(batch());
        IngestionResult parallel = service(4).ingest(batch());
        IngestionResult again = service(4).ingest(batch());

        assertThat(new ArrayList<>(parallel.snapshot().segments()))
            .containsExactlyElementsOf(sequential.snapshot().segments())
            .containsExactlyElementsOf(again.snapshot().segments());
        assertThat(parallel.report()).isEqualTo(sequential.report());
    }

    @Test
    void shouldSkipRegulationWithOutOfRangeTimeLimitAndKeepTheRest() {
        IngestionBatch batch = IngestionBatch.builder()
            .centerlines(List.of(new CenterlineRecord("CNN-1", "MAIN ST",
                TestGeometries.wkt(TestGeometries.eastbound(0, 0, 100)), null, null, null, null)))
            .regulations(List.of(
                regulation("REG-OK", TestGeometries.eastbound(5, 10, 90), "Time limited", "M-F", "800-1800", "2"),
                regulation("REG-HUGE", TestGeometries.eastbound(5, 10, 90), "Time limited", "M-F", "800-1800",
                    "99999999")))
            .build();

        IngestionResult result = service(2).ingest(batch);

        assertThat(result.report().regulations()).isEqualTo(1);
        assertThat(result.report().regulationsMatched()).isEqualTo(1);
        assertThat(result.report().skippedInvalid()).isEqualTo(1);
        assertThat(result.snapshot().find("CNN-1", StreetSide.LEFT).orElseThrow().rules())
            .extracting(Rule::sourceId).containsExactly("REG-OK");
    }

    @Test
    void shouldSkipNullEntriesInEveryDataset() {
        String main = TestGeometries.wkt(TestGeometries.eastbound(0, 0, 100));
        IngestionBatch batch = IngestionBatch.builder()
            .centerlines(Arrays.asList(null, new CenterlineRecord("CNN-1", "MAIN ST", main, null, null, null, null)))
            .regulations(Arrays.asList(
                regulation("REG-1", TestGeometries.eastbound(0, 10, 90), "No parking", "Daily", "Anytime", null),
                null))
            .meters(Arrays.asList((MeterRecord) null))
            .parcels(Arrays.asList((ParcelRecord) null))
            .sweeping(Arrays.asList((SweepingRecord) null))
            .blockfaces(Arrays.asList((BlockfaceRecord) null))
            .build();

        IngestionResult result = service(2).ingest(batch);

        assertThat(result.report().skippedInvalid()).isEqualTo(6);
        assertThat(result.report().centerlines()).isEqualTo(1);
        assertThat(result.report().regulationsMatched()).isEqualTo(1);
        assertThat(result.snapshot().find("CNN-1", StreetSide.RIGHT).orElseThrow().rules())
            .extracting(Rule::sourceId).containsExactly("REG-1");
    }

    @Test
    void shouldIngestEmptyBatch() {
        IngestionResult result = service(1).ingest(IngestionBatch.builder().build());

        assertThat(result.snapshot().isEmpty()).isTrue();
        assertThat(result.report().segments()).isZero();
    }
}
