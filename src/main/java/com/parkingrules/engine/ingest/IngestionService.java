package com.parkingrules.engine.ingest;

import com.parkingrules.engine.dto.BlockfaceRecord;
import com.parkingrules.engine.dto.CenterlineRecord;
import com.parkingrules.engine.dto.MeterRecord;
import com.parkingrules.engine.dto.ParcelRecord;
import com.parkingrules.engine.dto.RegulationRecord;
import com.parkingrules.engine.dto.SweepingRecord;
import com.parkingrules.engine.geometry.CurbOffsetGenerator;
import com.parkingrules.engine.geometry.GeometryException;
import com.parkingrules.engine.geometry.GeometryUtils;
import com.parkingrules.engine.matching.JoinContext;
import com.parkingrules.engine.matching.SegmentAttachment;
import com.parkingrules.engine.matching.SideDeterminer;
import com.parkingrules.engine.matching.SideVerdict;
import com.parkingrules.engine.matching.SpatialJoinEngine;
import com.parkingrules.engine.model.Centerline;
import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Parcel;
import com.parkingrules.engine.model.Regulation;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.model.SweepingSchedule;
import com.parkingrules.engine.normalize.InvalidRecordException;
import com.parkingrules.engine.normalize.RecordNormalizer;
import com.parkingrules.engine.store.SegmentRuleStore;
import com.parkingrules.engine.store.SegmentSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.LineString;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one ingestion pass: raw datasets in, immutable segment snapshot out.
 *
 * Flow:
 * 1. Normalize every dataset; invalid records are logged and skipped
 * 2. Assign surveyed blockfaces to sides by voting
 * 3. Create two segments per centerline, each with a curb line (surveyed or offset)
 * 4. Build the read-only join context
 * 5. Join regulations in parallel on a dedicated pool, keeping input order
 * 6. Merge sweeping, regulation and meter attachments into a fresh store, in input order
 * 7. Freeze the store into a snapshot
 *
 * The same batch always yields the same snapshot. Publishing is left to the caller, so a run
 * that throws never reaches readers.
 */
@Slf4j
public class IngestionService {

    private final RecordNormalizer normalizer;
    private final SideDeterminer sideDeterminer;
    private final SpatialJoinEngine joinEngine;
    private final CurbOffsetGenerator curbOffsetGenerator;
    private final int parallelism;
    private final Clock clock;

    public IngestionService(RecordNormalizer normalizer, SideDeterminer sideDeterminer,
                            SpatialJoinEngine joinEngine, CurbOffsetGenerator curbOffsetGenerator,
                            int parallelism, Clock clock) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        this.normalizer = normalizer;
        this.sideDeterminer = sideDeterminer;
        this.joinEngine = joinEngine;
        this.curbOffsetGenerator = curbOffsetGenerator;
        this.parallelism = parallelism;
        this.clock = clock;
    }

    public IngestionResult ingest(IngestionBatch batch) {
        long startTime = clock.millis();
        Counters counters = new Counters();
        log.info("Starting ingestion: {} centerlines, {} regulations, {} meters, {} parcels, {} sweeping, {} blockfaces",
            batch.centerlines().size(), batch.regulations().size(), batch.meters().size(),
            batch.parcels().size(), batch.sweeping().size(), batch.blockfaces().size());

        Map<String, Centerline> centerlines = normalizeCenterlines(batch.centerlines(), counters);
        List<SweepingSchedule> sweeping = normalizeAll(batch.sweeping(), normalizer::toSweeping,
            SweepingRecord::centerlineId, "sweeping", counters);
        Map<SegmentKey, LineString> curbs = assignBlockfaces(batch.blockfaces(), centerlines, counters);

        List<StreetSegment> skeleton = buildSkeleton(centerlines, sweeping, curbs, counters);
        List<Parcel> parcels = normalizeAll(batch.parcels(), normalizer::toParcel,
            ParcelRecord::id, "parcel", counters);
        JoinContext context = JoinContext.of(skeleton, parcels);

        List<Regulation> regulations = normalizeAll(batch.regulations(), normalizer::toRegulation,
            RegulationRecord::id, "regulation", counters);
        List<MeterSchedule> meters = normalizeAll(batch.meters(), normalizer::toMeter,
            MeterRecord::centerlineId, "meter", counters);

        List<RegulationJoin> joins = joinInParallel(regulations, context, counters);

        SegmentRuleStore store = new SegmentRuleStore(skeleton);
        mergeSweeping(store, sweeping, context, counters);
        mergeRegulations(store, joins, counters);
        mergeMeters(store, meters, context, counters);

        Instant completedAt = clock.instant();
        SegmentSnapshot snapshot = store.toSnapshot(completedAt);
        IngestionReport report = counters.toReport(completedAt, clock.millis() - startTime,
            centerlines.size(), snapshot.size(), regulations.size());

        log.info("Ingestion completed in {}ms: {} segments, {}/{} regulations matched, {} skipped as invalid",
            report.durationMillis(), report.segments(), report.regulationsMatched(), report.regulations(),
            report.skippedInvalid());
        return new IngestionResult(snapshot, report);
    }

    private Map<String, Centerline> normalizeCenterlines(List<CenterlineRecord> records, Counters counters) {
        Map<String, Centerline> centerlines = new LinkedHashMap<>();
        for (Centerline centerline : normalizeAll(records, normalizer::toCenterline,
                CenterlineRecord::id, "centerline", counters)) {
            if (centerlines.putIfAbsent(centerline.id(), centerline) != null) {
                log.warn("Skipping duplicate centerline {}", centerline.id());
                counters.skippedInvalid++;
            }
        }
        return centerlines;
    }

    private Map<SegmentKey, LineString> assignBlockfaces(List<BlockfaceRecord> records,
                                                        Map<String, Centerline> centerlines,
                                                        Counters counters) {
        Map<SegmentKey, LineString> curbs = new LinkedHashMap<>();
        for (BlockfaceRecord record : records) {
            if (record == null) {
                log.warn("Skipping null blockface record");
                counters.skippedInvalid++;
                continue;
            }
            LineString curb;
            try {
                curb = normalizer.toBlockfaceLine(record);
            } catch (RuntimeException e) {
                log.warn("Skipping invalid blockface {}: {}", record.id(), e.getMessage());
                counters.skippedInvalid++;
                continue;
            }
            Centerline centerline = centerlines.get(record.centerlineId().trim());
            if (centerline == null) {
                log.debug("Blockface {} references unknown centerline {}", record.id(), record.centerlineId());
                counters.blockfacesIndeterminate++;
                continue;
            }

            SideVerdict verdict;
            try {
                verdict = sideDeterminer.determineSide(centerline.geometry(), curb);
            } catch (RuntimeException e) {
                log.warn("Skipping blockface {}: side determination failed: {}", record.id(), e.getMessage());
                counters.skippedInvalid++;
                continue;
            }
            Optional<StreetSide> side = verdict.toSide();
            if (side.isEmpty()) {
                log.debug("Blockface {} side indeterminate against centerline {}", record.id(), centerline.id());
                counters.blockfacesIndeterminate++;
                continue;
            }
            SegmentKey key = SegmentKey.of(centerline.id(), side.get());
            if (curbs.putIfAbsent(key, curb) != null) {
                log.debug("Blockface {} ignored, {} already has a curb line", record.id(), key);
                continue;
            }
            counters.blockfacesAssigned++;
        }
        return curbs;
    }

    private List<StreetSegment> buildSkeleton(Map<String, Centerline> centerlines, List<SweepingSchedule> sweeping,
                                              Map<SegmentKey, LineString> curbs, Counters counters) {
        Map<SegmentKey, SweepingSchedule> sideDetails = new LinkedHashMap<>();
        for (SweepingSchedule schedule : sweeping) {
            sideDetails.putIfAbsent(schedule.key(), schedule);
        }

        List<StreetSegment> skeleton = new ArrayList<>(centerlines.size() * 2);
        for (Centerline centerline : centerlines.values()) {
            double bearing = GeometryUtils.bearing(centerline.geometry());
            for (StreetSide side : StreetSide.values()) {
                SegmentKey key = SegmentKey.of(centerline.id(), side);
                SweepingSchedule details = sideDetails.get(key);

                LineString curb = curbs.get(key);
                if (curb == null) {
                    curb = curbOffsetGenerator.offset(centerline.geometry(), side);
                }
                String cardinal = details != null && details.cardinalDirection() != null
                    ? details.cardinalDirection()
                    : GeometryUtils.sideCardinal(bearing, side);

                skeleton.add(StreetSegment.builder()
                    .key(key)
                    .streetName(centerline.streetName())
                    .fromStreet(details != null ? details.fromStreet() : null)
                    .toStreet(details != null ? details.toStreet() : null)
                    .addressRange(centerline.addressRange(side))
                    .centerline(centerline.geometry())
                    .curbGeometry(curb)
                    .cardinalDirection(cardinal)
                    .build());
            }
        }
        log.debug("Created {} segments from {} centerlines", skeleton.size(), centerlines.size());
        return skeleton;
    }

    private List<RegulationJoin> joinInParallel(List<Regulation> regulations, JoinContext context,
                                                Counters counters) {
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            List<RegulationJoin> joins = pool.submit(() -> regulations.parallelStream()
                    .map(regulation -> joinOne(regulation, context))
                    .collect(Collectors.toList()))
                .get();
            for (RegulationJoin join : joins) {
                if (join.failure() != null) {
                    log.warn("Skipping regulation {}: {}", join.regulation().id(), join.failure());
                    counters.skippedInvalid++;
                }
            }
            return joins;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionFailedException("Interrupted while joining regulations", e);
        } catch (ExecutionException e) {
            throw new IngestionFailedException("Regulation join failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private RegulationJoin joinOne(Regulation regulation, JoinContext context) {
        try {
            return new RegulationJoin(regulation, joinEngine.joinRegulationToSegments(regulation, context), null);
        } catch (RuntimeException e) {
            return new RegulationJoin(regulation, List.of(), e.getMessage());
        }
    }

    private void mergeSweeping(SegmentRuleStore store, List<SweepingSchedule> sweeping, JoinContext context,
                               Counters counters) {
        for (SweepingSchedule schedule : sweeping) {
            Optional<SegmentKey> target = joinEngine.sweepingTarget(schedule, context);
            if (target.isPresent()) {
                store.attach(target.get(), schedule.rule());
                counters.sweepingAttached++;
            } else {
                log.debug("Sweeping schedule for unknown segment {}", schedule.key());
                counters.sweepingUnmatched++;
            }
        }
    }

    private void mergeRegulations(SegmentRuleStore store, List<RegulationJoin> joins, Counters counters) {
        for (RegulationJoin join : joins) {
            if (join.failure() != null) {
                continue;
            }
            if (join.attachments().isEmpty()) {
                counters.regulationsUnmatched++;
                continue;
            }
            counters.regulationsMatched++;
            for (SegmentAttachment attachment : join.attachments()) {
                store.attach(attachment.key(), join.regulation().toRule(attachment.confidence()));
                switch (attachment.confidence()) {
                    case CLEAR:
                        counters.clearAttachments++;
                        break;
                    case BOUNDARY_RESOLVED:
                        counters.boundaryResolvedAttachments++;
                        break;
                    case ADDRESS_MATCHED:
                        counters.addressMatchedAttachments++;
                        break;
                    default:
                        break;
                }
            }
        }
    }

    private void mergeMeters(SegmentRuleStore store, List<MeterSchedule> meters, JoinContext context,
                             Counters counters) {
        for (MeterSchedule meter : meters) {
            List<SegmentKey> targets = joinEngine.meterTargets(meter, context);
            if (targets.isEmpty()) {
                log.debug("Meter schedule for unknown centerline {}", meter.centerlineId());
                counters.metersUnmatched++;
                continue;
            }
            for (SegmentKey key : targets) {
                store.attachMeter(key, meter);
            }
            counters.metersAttached++;
        }
    }

    private <R, T> List<T> normalizeAll(List<R> records, Function<R, T> normalize, Function<R, String> idOf,
                                        String what, Counters counters) {
        List<T> normalized = new ArrayList<>(records.size());
        for (R record : records) {
            if (record == null) {
                log.warn("Skipping null {} record", what);
                counters.skippedInvalid++;
                continue;
            }
            try {
                normalized.add(normalize.apply(record));
            } catch (InvalidRecordException | GeometryException e) {
                log.warn("Skipping invalid {} {}: {}", what, idOf.apply(record), e.getMessage());
                counters.skippedInvalid++;
            } catch (RuntimeException e) {
                log.warn("Skipping malformed {} {}: {}", what, idOf.apply(record), e.toString());
                counters.skippedInvalid++;
            }
        }
        return normalized;
    }

    private record RegulationJoin(Regulation regulation, List<SegmentAttachment> attachments, String failure) {
    }

    private static final class Counters {
        int regulationsMatched;
        int regulationsUnmatched;
        int clearAttachments;
        int boundaryResolvedAttachments;
        int addressMatchedAttachments;
        int sweepingAttached;
        int sweepingUnmatched;
        int metersAttached;
        int metersUnmatched;
        int blockfacesAssigned;
        int blockfacesIndeterminate;
        int skippedInvalid;

        IngestionReport toReport(Instant completedAt, long durationMillis, int centerlines, int segments,
                                 int regulations) {
            return IngestionReport.builder()
                .completedAt(completedAt)
                .durationMillis(durationMillis)
                .centerlines(centerlines)
                .segments(segments)
                .regulations(regulations)
                .regulationsMatched(regulationsMatched)
                .regulationsUnmatched(regulationsUnmatched)
                .clearAttachments(clearAttachments)
                .boundaryResolvedAttachments(boundaryResolvedAttachments)
                .addressMatchedAttachments(addressMatchedAttachments)
                .sweepingAttached(sweepingAttached)
                .sweepingUnmatched(sweepingUnmatched)
                .metersAttached(metersAttached)
                .metersUnmatched(metersUnmatched)
                .blockfacesAssigned(blockfacesAssigned)
                .blockfacesIndeterminate(blockfacesIndeterminate)
                .skippedInvalid(skippedInvalid)
                .build();
        }
    }
}
