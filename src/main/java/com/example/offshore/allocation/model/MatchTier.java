package com.example.offshore.allocation.model;

/**
 * Matching strategy that produced a record's classification, in priority order.
 * {@link #NONE} marks records whose derived fields could not be computed.
 */
public enum MatchTier {
    EXACT_LC,
    LOCATION,
    FUZZY_LOCATION,
    FALLBACK,
    NONE
}
