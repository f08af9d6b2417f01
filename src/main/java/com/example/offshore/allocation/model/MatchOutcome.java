package com.example.offshore.allocation.model;

import java.util.List;

/**
 * Everything the matcher decided for one record. {@code matchedEntry} is the first ledger row
 * behind the primary classification, or {@code null} for fallback-only outcomes.
 */
public record MatchOutcome(List<Classification> classifications, MatchTier tier, LedgerEntry matchedEntry) {

    public MatchOutcome {
        if (classifications == null || classifications.isEmpty()) {
            throw new IllegalArgumentException("A match outcome needs at least one classification");
        }
        classifications = List.copyOf(classifications);
    }

    public Classification primary() {
        return classifications.get(0);
    }

    public double totalPercentage() {
        return classifications.stream().mapToDouble(Classification::allocationPercentage).sum();
    }
}
