package com.parkingrules.engine.normalize;

import com.parkingrules.engine.dto.BlockfaceRecord;
import com.parkingrules.engine.dto.CenterlineRecord;
import com.parkingrules.engine.dto.MeterRecord;
import com.parkingrules.engine.dto.ParcelRecord;
import com.parkingrules.engine.dto.RegulationRecord;
import com.parkingrules.engine.dto.SweepingRecord;
import com.parkingrules.engine.geometry.GeometryUtils;
import com.parkingrules.engine.model.AddressRange;
import com.parkingrules.engine.model.Centerline;
import com.parkingrules.engine.model.DaySet;
import com.parkingrules.engine.model.MatchConfidence;
import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Parcel;
import com.parkingrules.engine.model.Regulation;
import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.RuleKind;
import com.parkingrules.engine.model.Schedule;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.model.SweepingSchedule;
import com.parkingrules.engine.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Normalization stage: converts every raw dataset record into its canonical model shape
 * before any join or evaluation code runs.
 *
 * Geometry arrives as WKT in lon/lat and leaves as JTS geometry with SRID 4326. Day and hour
 * text leaves as a {@link Schedule}. Anything unreadable raises {@link InvalidRecordException}
 * (or {@link com.parkingrules.engine.geometry.GeometryException} for a degenerate line) for
 * that one record.
 */
@RequiredArgsConstructor
public class RecordNormalizer {

    private final ScheduleParser scheduleParser;
    private final RuleKindClassifier ruleKindClassifier;

    public RecordNormalizer() {
        this(new ScheduleParser(), new RuleKindClassifier());
    }

    public Centerline toCenterline(CenterlineRecord record) {
        String id = require(record.id(), "centerline id");
        LineString line = GeometryUtils.requireValidLine(readLine(record.geometry(), "centerline " + id));
        return new Centerline(
            id,
            trimToNull(record.streetName()),
            line,
            addressRange(record.leftFromAddress(), record.leftToAddress()),
            addressRange(record.rightFromAddress(), record.rightToAddress()));
    }

    public Regulation toRegulation(RegulationRecord record) {
        String id = require(record.id(), "regulation id");
        Geometry geometry = readGeometry(record.geometry(), "regulation " + id);

        String typeText = record.regulation() != null && !record.regulation().isBlank()
            ? record.regulation()
            : record.description();
        RuleKind kind = ruleKindClassifier.classify(typeText, record.permitZone());

        Optional<TimeWindow> window = hasText(record.fromTime()) || hasText(record.toTime())
            ? scheduleParser.parseWindow(record.fromTime(), record.toTime())
            : scheduleParser.parseHours(record.hours());
        Schedule schedule = Schedule.of(scheduleParser.parseDays(record.days()), window.orElse(null));

        return Regulation.builder()
            .id(id)
            .geometry(geometry)
            .kind(kind)
            .schedule(schedule)
            .durationLimitMinutes(scheduleParser.parseDurationMinutes(record.hourLimit()))
            .permitZone(trimToNull(record.permitZone()))
            .description(DescriptionFormatter.describeRegulation(typeText, record.description(), schedule))
            .neighborhood(trimToNull(record.neighborhood()))
            .district(trimToNull(record.district()))
            .streetName(trimToNull(record.streetName()))
            .addressNumber(record.addressNumber())
            .interpretationKey(CanonicalKeys.regulationKey(record))
            .build();
    }

    public MeterSchedule toMeter(MeterRecord record) {
        String centerlineId = require(record.centerlineId(), "meter centerline id");
        if (record.ratePerHour() == null || record.ratePerHour().signum() < 0) {
            throw new InvalidRecordException("Meter on " + centerlineId + " has no valid rate");
        }
        StreetSide side = hasText(record.side()) ? side(record.side(), "meter on " + centerlineId) : null;
        Schedule schedule = Schedule.of(
            scheduleParser.parseDays(record.days()),
            scheduleParser.parseWindow(record.fromTime(), record.toTime()).orElse(null));
        return new MeterSchedule(centerlineId, side, record.ratePerHour(), schedule);
    }

    public Parcel toParcel(ParcelRecord record) {
        String id = require(record.id(), "parcel id");
        Geometry geometry = readGeometry(record.geometry(), "parcel " + id);
        if (!(geometry instanceof Polygonal)) {
            throw new InvalidRecordException("Parcel " + id + " is not a polygon: " + geometry.getGeometryType());
        }
        return new Parcel(id, geometry, trimToNull(record.neighborhood()), trimToNull(record.district()));
    }

    public SweepingSchedule toSweeping(SweepingRecord record) {
        String centerlineId = require(record.centerlineId(), "sweeping centerline id");
        StreetSide side = side(require(record.side(), "sweeping side"), "sweeping on " + centerlineId);
        if (!hasText(record.weekday())) {
            throw new InvalidRecordException("Sweeping on " + centerlineId + " has no weekday");
        }
        DaySet days = scheduleParser.parseDays(record.weekday());
        TimeWindow window = scheduleParser.parseWindow(record.fromHour(), record.toHour())
            .orElseThrow(() -> new InvalidRecordException("Sweeping on " + centerlineId + " has no hours"));
        List<Integer> weeks = record.weeksOfMonth() == null ? List.of() : record.weeksOfMonth();
        Schedule schedule;
        try {
            schedule = new Schedule(days, window, new HashSet<>(weeks));
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("Sweeping on " + centerlineId + ": " + e.getMessage(), e);
        }

        SegmentKey key = SegmentKey.of(centerlineId, side);
        Rule rule = Rule.builder()
            .kind(RuleKind.SWEEPING)
            .schedule(schedule)
            .description(DescriptionFormatter.describeSweeping(schedule))
            .confidence(MatchConfidence.DIRECT)
            .sourceId("sweeping:" + key + ":" + days + ":" + window)
            .build();

        String[] limits = splitLimits(record.limits());
        return new SweepingSchedule(key, rule, limits[0], limits[1],
            DescriptionFormatter.normalizeCardinal(record.blockside()));
    }

    public LineString toBlockfaceLine(BlockfaceRecord record) {
        String id = require(record.id(), "blockface id");
        require(record.centerlineId(), "blockface centerline id");
        return GeometryUtils.requireValidLine(readLine(record.geometry(), "blockface " + id));
    }

    /**
     * {@code York St - Bryant St} into its two cross streets; either may be null.
     */
    static String[] splitLimits(String limits) {
        if (!hasText(limits)) {
            return new String[] {null, null};
        }
        String[] parts = limits.split("\\s+-\\s+|\\s+to\\s+", 2);
        if (parts.length < 2) {
            return new String[] {limits.trim(), null};
        }
        return new String[] {trimToNull(parts[0]), trimToNull(parts[1])};
    }

    private LineString readLine(String wkt, String what) {
        Geometry geometry = readGeometry(wkt, what);
        if (geometry instanceof LineString) {
            return (LineString) geometry;
        }
        if (geometry instanceof MultiLineString && geometry.getNumGeometries() == 1) {
            return (LineString) geometry.getGeometryN(0);
        }
        throw new InvalidRecordException("Expected a line for " + what + ", got " + geometry.getGeometryType());
    }

    private Geometry readGeometry(String wkt, String what) {
        if (!hasText(wkt)) {
            throw new InvalidRecordException("Missing geometry for " + what);
        }
        try {
            Geometry geometry = new WKTReader(GeometryUtils.WGS84).read(wkt);
            if (geometry.isEmpty()) {
                throw new InvalidRecordException("Empty geometry for " + what);
            }
            return geometry;
        } catch (ParseException e) {
            throw new InvalidRecordException("Unparseable geometry for " + what + ": " + e.getMessage(), e);
        }
    }

    private static StreetSide side(String code, String what) {
        try {
            return StreetSide.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("Invalid side '" + code + "' for " + what, e);
        }
    }

    private static AddressRange addressRange(Integer from, Integer to) {
        if (from == null || to == null || (from == 0 && to == 0) || from < 0 || to < 0) {
            return null;
        }
        return new AddressRange(from, to);
    }

    private static String require(String value, String what) {
        if (!hasText(value)) {
            throw new InvalidRecordException("Missing " + what);
        }
        return value.trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }
}
