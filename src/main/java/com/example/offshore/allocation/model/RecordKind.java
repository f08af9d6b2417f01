package com.example.offshore.allocation.model;

import java.util.Locale;

public enum RecordKind {
    VOYAGE_EVENT("voyage-events", "voyage_events"),
    MANIFEST_LINE("manifests", "vessel_manifests");

    private final String parameter;
    private final String collectionName;

    RecordKind(String parameter, String collectionName) {
        this.parameter = parameter;
        this.collectionName = collectionName;
    }

    public String parameter() {
        return parameter;
    }

    public String collectionName() {
        return collectionName;
    }

    public static RecordKind fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return VOYAGE_EVENT;
        }
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        for (RecordKind kind : values()) {
            if (kind.parameter.equals(wanted) || kind.collectionName.equals(wanted)
                    || kind.name().toLowerCase(Locale.ROOT).equals(wanted)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown record kind '%s', expected voyage-events or manifests".formatted(value));
    }
}
