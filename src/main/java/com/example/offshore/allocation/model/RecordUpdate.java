package com.example.offshore.allocation.model;

import java.time.Instant;

/**
 * Classification fields written back onto one operational record by a backfill batch.
 * {@code finalHours} and {@code eventDate} are {@code null} for manifest lines.
 */
public record RecordUpdate(
        String recordId,
        String department,
        String lcNumber,
        double lcPercentage,
        String mappedLocation,
        String mappingStatus,
        String dataIntegrity,
        Double finalHours,
        Instant eventDate,
        int allocationCount,
        Instant backfilledAt,
        String error) {
}
