package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.LedgerEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookups over the cost-allocation ledger, built once per processing run.
 */
public final class LedgerIndex {

    private final Map<String, List<LedgerEntry>> byLc;
    private final Map<String, List<LedgerEntry>> byLocation;
    private final int ledgerSize;

    private LedgerIndex(Map<String, List<LedgerEntry>> byLc, Map<String, List<LedgerEntry>> byLocation, int ledgerSize) {
        this.byLc = byLc;
        this.byLocation = byLocation;
        this.ledgerSize = ledgerSize;
    }

    public static LedgerIndex build(List<LedgerEntry> entries, LocationNormalizer normalizer) {
        Map<String, List<LedgerEntry>> byLc = new LinkedHashMap<>();
        Map<String, List<LedgerEntry>> byLocation = new LinkedHashMap<>();

        for (LedgerEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            String lcKey = lcKey(entry.getLcNumber());
            if (!lcKey.isEmpty() && entry.resolvedDepartment() != null) {
                byLc.computeIfAbsent(lcKey, key -> new ArrayList<>()).add(entry);
            }

            String location = normalizer.normalize(entry.locationText());
            if (normalizer.isKnown(location)) {
                byLocation.computeIfAbsent(location, key -> new ArrayList<>()).add(entry);
            }
        }

        byLc.replaceAll((key, list) -> List.copyOf(list));
        byLocation.replaceAll((key, list) -> List.copyOf(list));
        return new LedgerIndex(Collections.unmodifiableMap(byLc), Collections.unmodifiableMap(byLocation),
                entries.size());
    }

    public static LedgerIndex empty() {
        return new LedgerIndex(Map.of(), Map.of(), 0);
    }

    public List<LedgerEntry> findByLc(String lcNumber) {
        return byLc.getOrDefault(lcKey(lcNumber), List.of());
    }

    public List<LedgerEntry> findByLocation(String canonicalLocation) {
        if (canonicalLocation == null) {
            return List.of();
        }
        return byLocation.getOrDefault(canonicalLocation, List.of());
    }

    /**
     * Location keys in ledger order; the fuzzy tier walks them and takes the first hit.
     */
    public Set<Map.Entry<String, List<LedgerEntry>>> locationEntries() {
        return byLocation.entrySet();
    }

    public int lcCount() {
        return byLc.size();
    }

    public int locationCount() {
        return byLocation.size();
    }

    public int ledgerSize() {
        return ledgerSize;
    }

    static String lcKey(String lcNumber) {
        return lcNumber == null ? "" : lcNumber.trim().toUpperCase(Locale.ROOT);
    }
}
