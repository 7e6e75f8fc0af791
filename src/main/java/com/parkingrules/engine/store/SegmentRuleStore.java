package com.parkingrules.engine.store;

import com.parkingrules.engine.model.MeterSchedule;
import com.parkingrules.engine.model.Rule;
import com.parkingrules.engine.model.SegmentKey;
import com.parkingrules.engine.model.StreetSegment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accumulates the rules of one ingestion run.
 *
 * One fresh store per run, seeded with the segment skeleton (two sides per centerline, no
 * rules). {@link #attach} appends without deduplication; precedence is a query-time concern.
 * {@link #toSnapshot} freezes the run into an immutable {@link SegmentSnapshot}; the store
 * refuses further writes after that.
 *
 * Writers may call {@code attach} concurrently; each segment has its own lock.
 */
public class SegmentRuleStore {

    private final Map<SegmentKey, Accumulator> accumulators;
    private volatile boolean frozen;

    public SegmentRuleStore(Collection<StreetSegment> skeleton) {
        Map<SegmentKey, Accumulator> byKey = new TreeMap<>();
        for (StreetSegment segment : skeleton) {
            if (byKey.put(segment.key(), new Accumulator(segment)) != null) {
                throw new IllegalArgumentException("Duplicate segment: " + segment.key());
            }
        }
        this.accumulators = byKey;
    }

    public void attach(SegmentKey key, Rule rule) {
        accumulator(key).addRule(rule);
    }

    public void attachMeter(SegmentKey key, MeterSchedule meter) {
        accumulator(key).addMeter(meter);
    }

    public boolean contains(SegmentKey key) {
        return accumulators.containsKey(key);
    }

    public int size() {
        return accumulators.size();
    }

    /**
     * Rules attached to one segment so far, in attach order.
     */
    public List<Rule> rulesOf(SegmentKey key) {
        return accumulator(key).rules();
    }

    public SegmentSnapshot toSnapshot(Instant builtAt) {
        frozen = true;
        List<StreetSegment> segments = new ArrayList<>(accumulators.size());
        for (Accumulator accumulator : accumulators.values()) {
            segments.add(accumulator.freeze());
        }
        return new SegmentSnapshot(segments, builtAt);
    }

    private Accumulator accumulator(SegmentKey key) {
        if (frozen) {
            throw new IllegalStateException("Store already frozen into a snapshot");
        }
        Accumulator accumulator = accumulators.get(key);
        if (accumulator == null) {
            throw new IllegalArgumentException("Unknown segment: " + key);
        }
        return accumulator;
    }

    private static final class Accumulator {

        private final StreetSegment base;
        private final List<Rule> rules = new ArrayList<>();
        private final List<MeterSchedule> meters = new ArrayList<>();

        private Accumulator(StreetSegment base) {
            this.base = base;
            rules.addAll(base.rules());
            meters.addAll(base.meters());
        }

        synchronized void addRule(Rule rule) {
            rules.add(rule);
        }

        synchronized void addMeter(MeterSchedule meter) {
            meters.add(meter);
        }

        synchronized List<Rule> rules() {
            return List.copyOf(rules);
        }

        synchronized StreetSegment freeze() {
            return base.toBuilder().rules(rules).meters(meters).build();
        }
    }
}
