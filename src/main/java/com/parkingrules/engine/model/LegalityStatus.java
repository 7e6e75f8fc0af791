package com.parkingrules.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LegalityStatus {
    LEGAL("legal"),
    ILLEGAL("illegal");

    private final String label;

    LegalityStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
