package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.Department;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Keyword rules used when a record has no ledger match. Rules run in a fixed order and the first
 * match wins; new rules go after the existing ones.
 */
@Component
public class FallbackClassifier {

    private static final List<String> SUPPLY_BASE_KEYWORDS = List.of("fourchon", "base");

    private final LocationNormalizer normalizer;

    public FallbackClassifier(LocationNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public Department classify(String location, String parentEvent, String event, String remarks, String portType) {
        String rawLocation = lower(location);
        String normalizedLocation = lower(normalizer.normalize(location));
        String parent = lower(parentEvent);
        String activity = lower(event);
        String note = lower(remarks);
        String port = lower(portType).trim();

        if (normalizedLocation.contains("thunder horse") || normalizedLocation.contains("mad dog")) {
            if (parent.contains("drill") || activity.contains("drill") || note.contains("drill")) {
                return Department.DRILLING;
            }
            return Department.PRODUCTION;
        }

        if (port.equals("rig") || rawLocation.contains("rig")) {
            return Department.DRILLING;
        }

        if (port.equals("base") || SUPPLY_BASE_KEYWORDS.stream().anyMatch(rawLocation::contains)) {
            if (parent.contains("cargo") || activity.contains("cargo") || parent.contains("supply")) {
                return Department.LOGISTICS;
            }
        }

        if (parent.contains("drill") || activity.contains("drill")) {
            return Department.DRILLING;
        }
        if (parent.contains("production") || activity.contains("production")) {
            return Department.PRODUCTION;
        }
        if (parent.contains("cargo") || parent.contains("supply") || parent.contains("transport")) {
            return Department.LOGISTICS;
        }

        return Department.OPERATIONS;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
