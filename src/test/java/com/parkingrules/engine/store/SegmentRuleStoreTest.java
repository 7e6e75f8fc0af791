package com.parkingrules.engine.store;

import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.RuleKind;
import com.parkingrules.engine.model.Schedule;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSegment;
import com.parkingrules.engine.model.StreetSide;
import com.parkingrules.engine.testutil.TestGeometries;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmentRuleStoreTest {

    private static final SegmentKey LEFT = SegmentKey.of("CNN-1", StreetSide.LEFT);
    private static final SegmentKey RIGHT = SegmentKey.of("CNN-1", StreetSide.RIGHT);

    private static Rule rule(String sourceId) {
        return Rule.builder().kind(RuleKind.NO_PARKING).description("No parking").sourceId(sourceId).build();
    }

    @Test
    void shouldAppendWithoutDeduplicating() {
        SegmentRuleStore store = new SegmentRuleStore(TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0));

        store.attach(LEFT, rule("R-1"));
        store.attach(LEFT, rule("R-1"));
        store.attach(RIGHT, rule("R-2"));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.rulesOf(LEFT)).hasSize(2);
        assertThat(store.rulesOf(RIGHT)).extracting(Rule::sourceId).containsExactly("R-2");
    }

    @Test
    void shouldRejectUnknownSegments() {
        SegmentRuleStore store = new SegmentRuleStore(TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0));

        assertThat(store.contains(SegmentKey.of("CNN-2", StreetSide.LEFT))).isFalse();
        assertThatThrownBy(() -> store.attach(SegmentKey.of("CNN-2", StreetSide.LEFT), rule("R-1")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFreezeIntoSnapshotAndRefuseLaterWrites() {
        SegmentRuleStore store = new SegmentRuleStore(TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0));
        store.attach(LEFT, rule("R-1"));
        store.attachMeter(RIGHT, new MeterSchedule("CNN-1", StreetSide.RIGHT, BigDecimal.ONE, Schedule.always()));
        Instant builtAt = Instant.parse("2024-01-01T03:00:00Z");

        SegmentSnapshot snapshot = store.toSnapshot(builtAt);

        assertThat(snapshot.size()).isEqualTo(2);
        assertThat(snapshot.ruleCount()).isEqualTo(1);
        assertThat(snapshot.meterCount()).isEqualTo(1);
        assertThat(snapshot.builtAt()).isEqualTo(builtAt);
        assertThat(snapshot.find(LEFT)).map(StreetSegment::rules).hasValueSatisfying(rules -> assertThat(rules).hasSize(1));
        assertThatThrownBy(() -> store.attach(LEFT, rule("R-2")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldAcceptConcurrentWriters() throws Exception {
        SegmentRuleStore store = new SegmentRuleStore(TestGeometries.eastboundSides("CNN-1", "MAIN ST", 0));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                SegmentKey key = i % 2 == 0 ? LEFT : RIGHT;
                String id = "R-" + i;
                futures.add(executor.submit(() -> store.attach(key, rule(id))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }

        assertThat(store.rulesOf(LEFT)).hasSize(200);
        assertThat(store.rulesOf(RIGHT)).hasSize(200);
    }
}
