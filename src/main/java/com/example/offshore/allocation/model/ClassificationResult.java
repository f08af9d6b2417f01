package com.example.offshore.allocation.model;

import java.time.Instant;

/**
 * Either a successful classification with its derived hour fields, or the error that forces the
 * record onto default values. Exactly one of {@code outcome} and {@code error} is set.
 */
public record ClassificationResult(
        String recordId,
        MatchOutcome outcome,
        Double baseHours,
        Instant eventDate,
        ClassificationError error) {

    public static ClassificationResult success(String recordId, MatchOutcome outcome, Double baseHours,
            Instant eventDate) {
        return new ClassificationResult(recordId, outcome, baseHours, eventDate, null);
    }

    public static ClassificationResult failure(String recordId, String message) {
        return new ClassificationResult(recordId, null, null, null, new ClassificationError(recordId, message));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
