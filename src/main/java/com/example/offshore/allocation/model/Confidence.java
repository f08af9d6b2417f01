package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
