package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LocationActivity {
    DRILLING("drilling"),
    PRODUCTION("production"),
    MIXED("mixed"),
    UNKNOWN("unknown");

    private final String label;

    LocationActivity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
