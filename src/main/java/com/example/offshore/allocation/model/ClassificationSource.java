package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassificationSource {
    LEDGER("ledger"),
    FALLBACK("fallback");

    private final String label;

    ClassificationSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
