package com.parkingrules.engine.store;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the snapshot currently served to readers and swaps in a new one atomically.
 * Readers keep whatever snapshot they fetched for the length of their request.
 */
@Slf4j
public class SnapshotRegistry {

    private final AtomicReference<SegmentSnapshot> current = new AtomicReference<>(SegmentSnapshot.empty());

    public SegmentSnapshot current() {
        return current.get();
    }

    /**
     * @return the snapshot that was being served before
     */
    public SegmentSnapshot publish(SegmentSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        SegmentSnapshot previous = current.getAndSet(snapshot);
        log.info("Published snapshot built at {}: {} segments, {} rules, {} meters (replaced {} segments)",
            snapshot.builtAt(), snapshot.size(), snapshot.ruleCount(), snapshot.meterCount(), previous.size());
        return previous;
    }

    public boolean hasSnapshot() {
        return current.get() != SegmentSnapshot.empty();
    }
}
