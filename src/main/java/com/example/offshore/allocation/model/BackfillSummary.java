package com.example.offshore.allocation.model;

public record BackfillSummary(
        String runId,
        RecordKind recordKind,
        BackfillState state,
        long candidateRecords,
        long processedRecords,
        long errorRecords,
        long remainingRecords,
        int batchesCompleted,
        String backupFile,
        long durationMillis,
        String failureMessage) {

    public boolean failed() {
        return state == BackfillState.FAILED;
    }

    public boolean hasRemainingRecords() {
        return remainingRecords > 0;
    }
}
