package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.BackfillProgress;
import com.example.offshore.allocation.model.BackfillState;
import com.example.offshore.allocation.model.BackfillSummary;
import com.example.offshore.allocation.model.Classification;
import com.example.offshore.allocation.model.ClassificationResult;
import com.example.offshore.allocation.model.DataIntegrity;
import com.example.offshore.allocation.model.Department;
import com.example.offshore.allocation.model.LedgerEntry;
import com.example.offshore.allocation.model.MappingStatus;
import com.example.offshore.allocation.model.MatchAttempt;
import com.example.offshore.allocation.model.MatchOutcome;
import com.example.offshore.allocation.model.MatchTier;
import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.RecordUpdate;
import com.example.offshore.allocation.model.VoyageEventDocument;
import com.example.offshore.allocation.store.OperationalRecordStore;
import com.example.offshore.allocation.support.AllocationProcessingException;
import com.example.offshore.allocation.support.BatchWriteException;
import com.example.offshore.allocation.support.RecordBackupWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * One backfill run over one record collection. Records whose department is still unset are classified in
 * batches; every batch (record updates plus match attempts) commits atomically, so an interrupted run can
 * simply be started again.
 */
@Slf4j
class BackfillPipeline {

    private static final double FULL = 100.0;

    private final OperationalRecordStore store;
    private final RecordBackupWriter backupWriter;
    private final LedgerService ledgerService;
    private final RecordMatcher matcher;
    private final BackfillSchedule schedule;
    private final int backupPageSize;
    private final Clock clock;

    private BackfillState state = BackfillState.NOT_STARTED;

    BackfillPipeline(OperationalRecordStore store,
            RecordBackupWriter backupWriter,
            LedgerService ledgerService,
            RecordMatcher matcher,
            BackfillSchedule schedule,
            int backupPageSize,
            Clock clock) {
        this.store = store;
        this.backupWriter = backupWriter;
        this.ledgerService = ledgerService;
        this.matcher = matcher;
        this.schedule = schedule;
        this.backupPageSize = Math.max(1, backupPageSize);
        this.clock = clock;
    }

    BackfillSummary run(String runId, BackfillProgressListener listener) {
        Instant start = clock.instant();
        String collection = store.kind().collectionName();
        long candidates = 0;
        long processed = 0;
        long errors = 0;
        int batches = 0;
        Path backupFile = null;

        try {
            candidates = store.countUnclassified();
            log.info("Backfill run={} collection={} total={} unclassified={} batchSize={}",
                    runId, collection, store.countAll(), candidates, schedule.batchSize());
            if (candidates == 0) {
                log.info("No {} records need classification", collection);
                transition(BackfillState.DONE, listener);
                return summary(runId, candidates, 0, 0, 0, 0, null, start, null);
            }

            transition(BackfillState.BACKING_UP, listener);
            backupFile = backupWriter.writeBackup(store, backupPageSize);

            transition(BackfillState.LOADING_LEDGER, listener);
            LedgerIndex index = ledgerService.loadIndex();

            transition(BackfillState.PROCESSING, listener);
            while (processed < candidates) {
                List<OperationalRecord> batch = store.findUnclassified(schedule.batchSize());
                if (batch.isEmpty()) {
                    break;
                }
                batches++;
                long batchErrors = processBatch(runId, batches, batch, index);
                processed += batch.size();
                errors += batchErrors;

                BackfillProgress progress = new BackfillProgress(batches, candidates, processed, errors);
                log.info("Completed batch={} collection={} processed={}/{} errors={} progress={}%",
                        batches, collection, processed, candidates, errors, progress.percentComplete());
                listener.onBatchCompleted(progress);
                if (processed < candidates) {
                    pause(schedule.interBatchDelay());
                }
            }

            transition(BackfillState.VERIFYING, listener);
            long remaining = store.countUnclassified();
            if (remaining > 0) {
                log.warn("{} {} records are still unclassified after backfill run={}", remaining, collection, runId);
            } else {
                log.info("All {} records are classified", collection);
            }
            transition(BackfillState.DONE, listener);
            return summary(runId, candidates, processed, errors, remaining, batches, backupFile, start, null);
        } catch (RuntimeException ex) {
            log.error("Backfill run={} failed in state={}: {}", runId, state, ex.getMessage(), ex);
            if (state.canTransitionTo(BackfillState.FAILED)) {
                transition(BackfillState.FAILED, listener);
            }
            long remaining = Math.max(0, candidates - processed);
            return summary(runId, candidates, processed, errors, remaining, batches, backupFile, start, ex.getMessage());
        }
    }

    BackfillState state() {
        return state;
    }

    private long processBatch(String runId, int batchNumber, List<OperationalRecord> batch, LedgerIndex index) {
        Instant now = clock.instant();
        List<RecordUpdate> updates = new ArrayList<>(batch.size());
        List<MatchAttempt> attempts = new ArrayList<>(batch.size());
        long errors = 0;

        for (OperationalRecord record : batch) {
            ClassificationResult result = classify(record, index, now);
            if (!result.isSuccess()) {
                errors++;
            }
            updates.add(toUpdate(record, result, now));
            attempts.add(toAttempt(runId, record, result, now));
        }

        writeWithRetry(batchNumber, updates, attempts);
        return errors;
    }

    private ClassificationResult classify(OperationalRecord record, LedgerIndex index, Instant now) {
        EventHours hours = EventHours.derive(record, now);
        if (!hours.isValid()) {
            log.warn("Record {} falls back to default values: {}", record.getId(), hours.error());
            return ClassificationResult.failure(record.getId(), hours.error());
        }
        try {
            MatchOutcome outcome = matcher.match(record, index);
            return ClassificationResult.success(record.getId(), outcome, hours.baseHours(), hours.eventDate());
        } catch (RuntimeException ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            log.warn("Record {} could not be matched, writing default values: {}", record.getId(), message, ex);
            return ClassificationResult.failure(record.getId(), message);
        }
    }

    private static RecordUpdate toUpdate(OperationalRecord record, ClassificationResult result, Instant now) {
        if (!result.isSuccess()) {
            return defaultUpdate(record, result.error().message(), now);
        }
        MatchOutcome outcome = result.outcome();
        Classification primary = outcome.primary();
        Double finalHours = result.baseHours() == null
                ? null
                : EventHours.round(result.baseHours() * primary.allocationPercentage() / FULL);
        return new RecordUpdate(
                record.getId(),
                primary.department().label(),
                primary.lcNumber(),
                primary.allocationPercentage(),
                primary.mappedLocation(),
                primary.mappingStatus().label(),
                primary.dataIntegrity().label(),
                finalHours,
                result.eventDate(),
                outcome.classifications().size(),
                now,
                null);
    }

    private static RecordUpdate defaultUpdate(OperationalRecord record, String error, Instant now) {
        Double finalHours = null;
        Instant eventDate = null;
        if (record instanceof VoyageEventDocument event) {
            finalHours = event.getHours() == null ? 0.0 : event.getHours();
            eventDate = now;
        }
        return new RecordUpdate(
                record.getId(),
                Department.OPERATIONS.label(),
                null,
                FULL,
                recordLocation(record),
                MappingStatus.ERROR_DEFAULTS.label(),
                DataIntegrity.INVALID.label(),
                finalHours,
                eventDate,
                1,
                now,
                error);
    }

    private static String recordLocation(OperationalRecord record) {
        return MatchRequest.from(record).location();
    }

    private static MatchAttempt toAttempt(String runId, OperationalRecord record, ClassificationResult result,
            Instant now) {
        MatchAttempt.MatchAttemptBuilder attempt = MatchAttempt.builder()
                .id(UUID.randomUUID().toString())
                .runId(runId)
                .recordId(record.getId())
                .recordKind(record.kind())
                .attemptedAt(now);
        if (!result.isSuccess()) {
            return attempt.tier(MatchTier.NONE).error(result.error().message()).build();
        }
        MatchOutcome outcome = result.outcome();
        LedgerEntry matched = outcome.matchedEntry();
        return attempt
                .tier(outcome.tier())
                .ledgerEntryId(matched == null ? null : matched.getId())
                .lcNumber(outcome.primary().lcNumber())
                .build();
    }

    private void writeWithRetry(int batchNumber, List<RecordUpdate> updates, List<MatchAttempt> attempts) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= schedule.maxBatchAttempts(); attempt++) {
            try {
                store.applyBatch(updates, attempts);
                return;
            } catch (RuntimeException ex) {
                lastFailure = ex;
                log.warn("Batch {} write attempt {}/{} failed: {}",
                        batchNumber, attempt, schedule.maxBatchAttempts(), ex.getMessage());
                if (attempt < schedule.maxBatchAttempts()) {
                    pause(schedule.interBatchDelay());
                }
            }
        }
        throw new BatchWriteException("Batch %d could not be written after %d attempts"
                .formatted(batchNumber, schedule.maxBatchAttempts()), lastFailure);
    }

    private void transition(BackfillState next, BackfillProgressListener listener) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal backfill transition %s -> %s".formatted(state, next));
        }
        log.debug("Backfill state {} -> {}", state, next);
        state = next;
        listener.onStateChange(next);
    }

    private static void pause(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AllocationProcessingException("Backfill interrupted between batches", ex);
        }
    }

    private BackfillSummary summary(String runId, long candidates, long processed, long errors, long remaining,
            int batches, Path backupFile, Instant start, String failureMessage) {
        return new BackfillSummary(
                runId,
                store.kind(),
                state,
                candidates,
                processed,
                errors,
                remaining,
                batches,
                backupFile == null ? null : backupFile.toString(),
                Duration.between(start, clock.instant()).toMillis(),
                failureMessage);
    }
}
