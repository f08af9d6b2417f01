package com.example.offshore.allocation.model;

import java.time.Instant;

public record BackfillRunResponse(
        String runId,
        RecordKind recordKind,
        BackfillState state,
        int batchSize,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        long candidateRecords,
        long processedRecords,
        long errorRecords,
        long remainingRecords,
        int batchesCompleted,
        int progressPercent,
        String backupFile,
        String errorMessage) {

    public static BackfillRunResponse from(BackfillRun run) {
        return new BackfillRunResponse(
                run.getId(),
                run.getRecordKind(),
                run.getState(),
                run.getBatchSize(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getCompletedAt(),
                run.getCandidateRecords(),
                run.getProcessedRecords(),
                run.getErrorRecords(),
                run.getRemainingRecords(),
                run.getBatchesCompleted(),
                run.getProgressPercent(),
                run.getBackupFile(),
                run.getErrorMessage());
    }
}
