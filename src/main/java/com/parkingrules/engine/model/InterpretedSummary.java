package com.parkingrules.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Plain-language summary of a regulation produced by the external annotator.
 *
 * @param summary    display text
 * @param confidence annotator confidence, 0..1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InterpretedSummary(String summary, double confidence) {

    @JsonIgnore
    public boolean isUsable() {
        return summary != null && !summary.isBlank();
    }
}
