package com.parkingrules.engine.rules;

import com.parkingrules.engine.model.InterpretedSummary;

import java.util.Optional;

/**
 * Read-only access to summaries produced by the external regulation annotator, keyed by
 * the canonical regulation key. The engine only consumes it.
 */
@FunctionalInterface
public interface InterpretationLookup {

    InterpretationLookup NONE = key -> Optional.empty();

    Optional<InterpretedSummary> interpretation(String canonicalKey);
}
