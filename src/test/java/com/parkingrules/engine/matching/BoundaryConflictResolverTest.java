package com.parkingrules.engine.matching;

import com.parkingrules.engine.model.Parcel;
import com.parkingrules.engine.model.Regulation;
import com.parkingrules.engine.model.RuleKind;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.testutil.TestGeometries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BoundaryConflictResolverTest {

    private final BoundaryConflictResolver resolver = new BoundaryConflictResolver();

    private final List<StreetSegment> sides = TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0);

    // covers the left curb (north 5) but not the right one (north -5)
    private final Parcel northParcel = new Parcel("P-N", TestGeometries.box(0, 0, 100, 20), "Mission", "9");

    private Regulation regulation(String neighborhood, String district) {
        return Regulation.builder()
            .id("REG-1")
            .geometry(TestGeometries.eastbound(13, 10, 90))
            .kind(RuleKind.TIME_LIMIT)
            .neighborhood(neighborhood)
            .district(district)
            .build();
    }

    @Test
    void shouldConfirmWhenNeighborhoodAndDistrictMatch() {
        JoinContext context = JoinContext.of(sides, List.of(northParcel));

        assertThat(resolver.evaluate(regulation("MISSION", "9"), sides.get(0), context))
            .isEqualTo(BoundaryOutcome.CONFIRMED);
        assertThat(resolver.resolveBoundary(regulation("Mission", " 9 "), sides.get(0), context)).isTrue();
    }

    @Test
    void shouldFailClosedWithoutParcel() {
        JoinContext context = JoinContext.of(sides, List.of(northParcel));

        assertThat(resolver.evaluate(regulation("Mission", "9"), sides.get(1), context))
            .isEqualTo(BoundaryOutcome.PARCEL_NOT_FOUND);
    }

    @Test
    void shouldRejectOnAnyMismatch() {
        JoinContext context = JoinContext.of(sides, List.of(northParcel));

        assertThat(resolver.evaluate(regulation("Mission", "10"), sides.get(0), context))
            .isEqualTo(BoundaryOutcome.ATTRIBUTE_MISMATCH);
        assertThat(resolver.evaluate(regulation("Noe Valley", "9"), sides.get(0), context))
            .isEqualTo(BoundaryOutcome.ATTRIBUTE_MISMATCH);
    }

    @Test
    void shouldRejectRegulationWithoutAttributes() {
        JoinContext context = JoinContext.of(sides, List.of(northParcel));

        assertThat(resolver.evaluate(regulation(null, "9"), sides.get(0), context))
            .isEqualTo(BoundaryOutcome.MISSING_ATTRIBUTES);
        assertThat(resolver.resolveBoundary(regulation("Mission", " "), sides.get(0), context)).isFalse();
    }

    @Test
    void shouldPickLowestParcelIdWhenOverlaysOverlap() {
        Parcel other = new Parcel("P-A", TestGeometries.box(0, 0, 100, 20), "Bernal Heights", "9");
        JoinContext context = JoinContext.of(sides, List.of(northParcel, other));

        assertThat(context.parcels().findContaining(TestGeometries.at(50, 5)))
            .map(Parcel::id)
            .contains("P-A");
        assertThat(resolver.evaluate(regulation("Mission", "9"), sides.get(0), context))
            .isEqualTo(BoundaryOutcome.ATTRIBUTE_MISMATCH);
    }
}
