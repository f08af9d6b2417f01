package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MappingStatus {
    LC_MAPPED("LC Mapped"),
    LOCATION_INFERRED("Location Inferred"),
    ERROR_DEFAULTS("Error - Default Values");

    private final String label;

    MappingStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
