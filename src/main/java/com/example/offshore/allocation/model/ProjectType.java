package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ProjectType {
    DRILLING("Drilling"),
    COMPLETIONS("Completions"),
    PRODUCTION("Production"),
    MAINTENANCE("Maintenance"),
    OPERATOR_SHARING("Operator Sharing"),
    UNKNOWN("unknown");

    private final String label;

    ProjectType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isDrillingWork() {
        return this == DRILLING || this == COMPLETIONS;
    }

    public boolean isProductionWork() {
        return this == PRODUCTION || this == MAINTENANCE;
    }

    /**
     * Lenient lookup: "Operator Sharing", "operatorsharing" and "OPERATOR_SHARING" all resolve.
     * Anything unrecognised is {@link #UNKNOWN}.
     */
    public static ProjectType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String wanted = compact(label);
        for (ProjectType type : values()) {
            if (compact(type.label).equals(wanted) || compact(type.name()).equals(wanted)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    private static String compact(String value) {
        return value.replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
    }
}
