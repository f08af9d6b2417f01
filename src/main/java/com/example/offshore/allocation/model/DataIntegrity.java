package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DataIntegrity {
    VALID("Valid"),
    INFERRED("Inferred"),
    INVALID("Invalid");

    private final String label;

    DataIntegrity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
