package com.parkingrules.engine.store;

import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.RuleKind;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.testutil.TestGeometries;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SegmentSnapshotTest {

    private SegmentSnapshot snapshot() {
        List<StreetSegment> segments = new ArrayList<>(TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0));
        segments.addAll(TestGeometries.eastboundSides("CNN-2", "Main St.", 200));
        return new SegmentSnapshot(segments, Instant.parse("2024-01-01T03:00:00Z"));
    }

    @Test
    void shouldFindSegmentsByKeyCenterlineAndStreet() {
        SegmentSnapshot snapshot = snapshot();

        assertThat(snapshot.find("CNN-1", StreetSide.RIGHT)).isPresent();
        assertThat(snapshot.find("CNN-9", StreetSide.RIGHT)).isEmpty();
        assertThat(snapshot.sidesOf("CNN-2")).extracting(StreetSegment::side)
            .containsExactly(StreetSide.LEFT, StreetSide.RIGHT);
        assertThat(snapshot.onStreet("main st")).hasSize(4);
        assertThat(snapshot.centerlineCount()).isEqualTo(2);
        assertThat(snapshot.size()).isEqualTo(4);
    }

    @Test
    void shouldFindNearbySidesNearestFirst() {
        SegmentSnapshot snapshot = snapshot();
        // 3 m from CNN-1's left curb, 13 m from its right curb
        Coordinate query = TestGeometries.at(50, 8);

        List<NearbySegment> close = snapshot.findNear(query.y, query.x, 10);
        List<NearbySegment> wider = snapshot.findNear(query.y, query.x, 20);

        assertThat(close).hasSize(1);
        assertThat(close.get(0).segment().side()).isEqualTo(StreetSide.LEFT);
        assertThat(close.get(0).distanceMeters()).isCloseTo(3.0, within(0.05));
        assertThat(wider).extracting(found -> found.segment().key().toString())
            .containsExactly("CNN-1:L", "CNN-1:R");
    }

    @Test
    void shouldCountRulesAcrossSegments() {
        Rule rule = Rule.builder().kind(RuleKind.TOW_AWAY).build();
        StreetSegment withRule = TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0).get(0)
            .toBuilder().rules(List.of(rule, rule)).build();

        SegmentSnapshot snapshot = new SegmentSnapshot(List.of(withRule), Instant.EPOCH);

        assertThat(snapshot.ruleCount()).isEqualTo(2);
        assertThat(snapshot.isEmpty()).isFalse();
        assertThat(SegmentSnapshot.empty().isEmpty()).isTrue();
        assertThat(SegmentSnapshot.empty().findNear(37.77, -122.42, 50)).isEmpty();
    }
}
