package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Department {
    DRILLING("Drilling"),
    PRODUCTION("Production"),
    LOGISTICS("Logistics"),
    MAINTENANCE("Maintenance"),
    OPERATIONS("Operations"),
    MIXED("Mixed");

    private final String label;

    Department(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a stored department label, ignoring case and surrounding whitespace.
     *
     * @return the department, or {@code null} when the label is blank or unrecognised
     */
    public static Department fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        for (Department department : values()) {
            if (department.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                return department;
            }
        }
        return null;
    }
}
