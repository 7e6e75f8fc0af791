package com.parkingrules.engine.normalize;

import com.parkingrules.engine.dto.BlockfaceRecord;
import com.parkingrules.engine.dto.CenterlineRecord;
import com.parkingrules.engine.dto.MeterRecord;
import com.parkingrules.engine.dto.ParcelRecord;
import com.parkingrules.engine.dto.RegulationRecord;
import com.parkingrules.engine.dto.SweepingRecord;
import com.parkingrules.engine.geometry.GeometryException;
import com.parkingrules.engine.model.AddressRange;
import com.parkingrules.engine.model.Centerline;
import com.parkingrules.engine.model.MatchConfidence;
import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Regulation;
import com.parkingrules.engine.model.RuleKind;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.model.SweepingSchedule;
import com.parkingrules.engine.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordNormalizerTest {

    private static final String LINE = "LINESTRING (-122.42 37.77, -122.419 37.77)";

    private final RecordNormalizer normalizer = new RecordNormalizer();

    private static RegulationRecord regulation(String type, String description, String days, String hours,
                                               String hourLimit, String permitZone) {
        return new RegulationRecord("REG-1", LINE, type, description, days, hours, null, null, hourLimit,
            permitZone, null, "Mission", "9", null, null);
    }

    @Test
    void shouldNormalizeCenterlineWithAddressRanges() {
        Centerline centerline = normalizer.toCenterline(
            new CenterlineRecord(" CNN-1 ", "MAIN ST", LINE, 100, 198, 0, 0));

        assertThat(centerline.id()).isEqualTo("CNN-1");
        assertThat(centerline.geometry().getSRID()).isEqualTo(4326);
        assertThat(centerline.addressRange(StreetSide.LEFT)).isEqualTo(new AddressRange(100, 198));
        assertThat(centerline.addressRange(StreetSide.RIGHT)).isNull();
    }

    @Test
    void shouldRejectBrokenCenterlineGeometry() {
        assertThatThrownBy(() -> normalizer.toCenterline(
            new CenterlineRecord("CNN-1", "MAIN ST", "LINESTRING (oops)", null, null, null, null)))
            .isInstanceOf(InvalidRecordException.class);
        assertThatThrownBy(() -> normalizer.toCenterline(
            new CenterlineRecord("CNN-1", "MAIN ST", "LINESTRING (-122.42 37.77, -122.42 37.77)", null, null, null, null)))
            .isInstanceOf(GeometryException.class);
        assertThatThrownBy(() -> normalizer.toCenterline(
            new CenterlineRecord("CNN-1", "MAIN ST", "POINT (-122.42 37.77)", null, null, null, null)))
            .isInstanceOf(InvalidRecordException.class);
    }

    @Test
    void shouldNormalizeTimeLimitedRegulation() {
        RegulationRecord record = regulation("Time limited", null, "M-F", "800-1800", "2", null);

        Regulation regulation = normalizer.toRegulation(record);

        assertThat(regulation.kind()).isEqualTo(RuleKind.TIME_LIMIT);
        assertThat(regulation.durationLimitMinutes()).isEqualTo(120);
        assertThat(regulation.schedule().window()).isEqualTo(TimeWindow.of(480, 1080));
        assertThat(regulation.schedule().days().days()).hasSize(5);
        assertThat(regulation.description()).isEqualTo("Time limited Mon,Tue,Wed,Thu,Fri 08:00-18:00");
        assertThat(regulation.interpretationKey()).isEqualTo(CanonicalKeys.regulationKey(record)).hasSize(32);
        assertThat(regulation.neighborhood()).isEqualTo("Mission");
    }

    @Test
    void shouldTreatTimeLimitInsidePermitAreaAsRpp() {
        Regulation regulation = normalizer.toRegulation(
            regulation("Time limited", "2 hour visitor parking", "M-F", "800-1800", "2", "S"));

        assertThat(regulation.kind()).isEqualTo(RuleKind.RPP_ZONE);
        assertThat(regulation.permitZone()).isEqualTo("S");
        assertThat(regulation.description()).isEqualTo("2 hour visitor parking");
    }

    @Test
    void shouldFallBackToDescriptionForTheKind() {
        Regulation regulation = normalizer.toRegulation(regulation(null, "Tow-away zone", "Daily", "Anytime", null, null));

        assertThat(regulation.kind()).isEqualTo(RuleKind.TOW_AWAY);
        assertThat(regulation.schedule().isAllDay()).isTrue();
        assertThat(regulation.durationLimitMinutes()).isNull();
    }

    @Test
    void shouldPreferSeparateTimeFields() {
        RegulationRecord record = new RegulationRecord("REG-2", LINE, "No parking", null, "Sat", "800-1800",
            "7pm", "7am", null, null, null, null, null, null, null);

        assertThat(normalizer.toRegulation(record).schedule().window()).isEqualTo(TimeWindow.of(1140, 420));
    }

    @Test
    void shouldRejectUnknownRegulationKind() {
        assertThatThrownBy(() -> normalizer.toRegulation(regulation("Loading zone", null, "M-F", null, null, null)))
            .isInstanceOf(InvalidRecordException.class)
            .hasMessageContaining("Loading zone");
    }

    @Test
    void shouldNormalizeSweepingSchedule() {
        SweepingSchedule sweeping = normalizer.toSweeping(new SweepingRecord(
            "CNN-1", "L", "Tues", "9", "11", List.of(3, 1), "York St - Bryant St", "N"));

        assertThat(sweeping.key()).isEqualTo(SegmentKey.of("CNN-1", StreetSide.LEFT));
        assertThat(sweeping.rule().kind()).isEqualTo(RuleKind.SWEEPING);
        assertThat(sweeping.rule().confidence()).isEqualTo(MatchConfidence.DIRECT);
        assertThat(sweeping.rule().description())
            .isEqualTo("Street cleaning Tue 09:00-11:00 (1st & 3rd week of month)");
        assertThat(sweeping.fromStreet()).isEqualTo("York St");
        assertThat(sweeping.toStreet()).isEqualTo("Bryant St");
        assertThat(sweeping.cardinalDirection()).isEqualTo("North");
    }

    @Test
    void shouldRejectSweepingWithBadWeekOfMonth() {
        assertThatThrownBy(() -> normalizer.toSweeping(new SweepingRecord(
            "CNN-1", "R", "Mon", "8", "10", List.of(6), null, null)))
            .isInstanceOf(InvalidRecordException.class);
    }

    @Test
    void shouldNormalizeMeters() {
        MeterSchedule both = normalizer.toMeter(
            new MeterRecord("CNN-1", null, new BigDecimal("3.50"), "M-Sa", "900", "1800"));
        MeterSchedule left = normalizer.toMeter(
            new MeterRecord("CNN-1", "Left", new BigDecimal("2.00"), null, null, null));

        assertThat(both.coversBothSides()).isTrue();
        assertThat(both.schedule().days().days()).hasSize(6);
        assertThat(left.side()).isEqualTo(StreetSide.LEFT);
        assertThat(left.schedule().isAllDay()).isTrue();
        assertThatThrownBy(() -> normalizer.toMeter(
            new MeterRecord("CNN-1", "X", BigDecimal.ONE, null, null, null)))
            .isInstanceOf(InvalidRecordException.class);
    }

    @Test
    void shouldRequirePolygonalParcels() {
        assertThat(normalizer.toParcel(new ParcelRecord("P-1",
            "POLYGON ((-122.42 37.77, -122.41 37.77, -122.41 37.78, -122.42 37.77))", "Mission", "9")).district())
            .isEqualTo("9");
        assertThatThrownBy(() -> normalizer.toParcel(new ParcelRecord("P-2", LINE, "Mission", "9")))
            .isInstanceOf(InvalidRecordException.class);
    }

    @Test
    void shouldReadBlockfaceLines() {
        assertThat(normalizer.toBlockfaceLine(new BlockfaceRecord("BF-1", "CNN-1", LINE)).getNumPoints())
            .isEqualTo(2);
        assertThatThrownBy(() -> normalizer.toBlockfaceLine(new BlockfaceRecord("BF-2", null, LINE)))
            .isInstanceOf(InvalidRecordException.class);
    }

    @Test
    void shouldShareCanonicalKeyAcrossCaseAndWhitespace() {
        String upper = CanonicalKeys.regulationKey(regulation("TIME LIMITED", null, "M-F", "800-1800", "2", null));
        String lower = CanonicalKeys.regulationKey(regulation(" time limited ", null, "m-f", "800-1800", "2", null));
        String other = CanonicalKeys.regulationKey(regulation("Time limited", null, "M-F", "800-1800", "4", null));

        assertThat(upper).isEqualTo(lower).isNotEqualTo(other);
    }
}
