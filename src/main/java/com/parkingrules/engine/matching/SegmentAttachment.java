package com.parkingrules.engine.matching;

import com.parkingrules.engine.model.MatchConfidence;
import com.parkingrules.engine.model.SegmentKey;

/**
 * One resolved (segment side, confidence) pair produced by the join.
 */
public record SegmentAttachment(SegmentKey key, MatchConfidence confidence) {
}
