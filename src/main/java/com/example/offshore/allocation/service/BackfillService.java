package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.BackfillProgress;
import com.example.offshore.allocation.model.BackfillRun;
import com.example.offshore.allocation.model.BackfillState;
import com.example.offshore.allocation.model.BackfillStatusReport;
import com.example.offshore.allocation.model.BackfillSummary;
import com.example.offshore.allocation.model.MatchOutcome;
import com.example.offshore.allocation.model.MatchTier;
import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.RecordPreview;
import com.example.offshore.allocation.store.OperationalRecordStore;
import com.example.offshore.allocation.support.RecordBackupWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class BackfillService {

    private static final int MAX_PREVIEW_SIZE = 100;

    private final MongoTemplate mongoTemplate;
    private final Map<RecordKind, OperationalRecordStore> stores;
    private final RecordBackupWriter backupWriter;
    private final LedgerService ledgerService;
    private final RecordMatcher matcher;
    private final ExecutorService executor;
    private final Clock clock;
    private final BackfillSchedule schedule;
    private final int backupPageSize;
    private final AtomicBoolean running = new AtomicBoolean();

    public BackfillService(MongoTemplate mongoTemplate,
            List<OperationalRecordStore> stores,
            RecordBackupWriter backupWriter,
            LedgerService ledgerService,
            RecordMatcher matcher,
            ExecutorService backfillExecutor,
            Clock clock,
            @Value("${app.backfill.batch-size:1000}") int batchSize,
            @Value("${app.backfill.inter-batch-delay:100ms}") Duration interBatchDelay,
            @Value("${app.backfill.max-batch-attempts:3}") int maxBatchAttempts,
            @Value("${app.backfill.backup-page-size:1000}") int backupPageSize) {
        this.mongoTemplate = mongoTemplate;
        this.stores = new EnumMap<>(RecordKind.class);
        for (OperationalRecordStore store : stores) {
            this.stores.put(store.kind(), store);
        }
        this.backupWriter = backupWriter;
        this.ledgerService = ledgerService;
        this.matcher = matcher;
        this.executor = backfillExecutor;
        this.clock = clock;
        this.schedule = new BackfillSchedule(Math.max(1, batchSize), interBatchDelay, maxBatchAttempts);
        this.backupPageSize = Math.max(1, backupPageSize);
    }

    /**
     * Starts a run on the backfill executor and returns its pending record immediately.
     *
     * @throws IllegalStateException when another run is still in progress
     */
    public BackfillRun enqueue(RecordKind kind, Integer batchSize) {
        OperationalRecordStore store = storeFor(kind);
        BackfillSchedule runSchedule = scheduleFor(batchSize);
        acquire();
        try {
            BackfillRun run = createPendingRun(kind, runSchedule);
            mongoTemplate.save(run);
            executor.submit(() -> executeInBackground(run, store, runSchedule));
            return run;
        } catch (RuntimeException ex) {
            running.set(false);
            throw ex;
        }
    }

    /**
     * Runs a backfill on the calling thread.
     *
     * @throws IllegalStateException when another run is still in progress
     */
    public BackfillSummary runNow(RecordKind kind, Integer batchSize) {
        OperationalRecordStore store = storeFor(kind);
        BackfillSchedule runSchedule = scheduleFor(batchSize);
        acquire();
        try {
            BackfillRun run = createPendingRun(kind, runSchedule);
            mongoTemplate.save(run);
            return executeRun(run, store, runSchedule);
        } catch (RuntimeException ex) {
            running.set(false);
            throw ex;
        }
    }

    public BackfillRun findRun(String runId) {
        return mongoTemplate.findById(runId, BackfillRun.class);
    }

    public boolean isRunning() {
        return running.get();
    }

    public BackfillStatusReport statusReport(RecordKind kind) {
        OperationalRecordStore store = storeFor(kind);
        long total = store.countAll();
        long unclassified = store.countUnclassified();
        double unclassifiedPercent = total == 0 ? 0 : EventHours.round(unclassified * 100.0 / total);
        return new BackfillStatusReport(
                kind,
                total,
                total - unclassified,
                unclassified,
                unclassifiedPercent,
                store.countByDepartment(),
                store.countByMappingStatus());
    }

    /**
     * Classifies up to {@code sampleSize} unclassified records without writing anything.
     */
    public List<RecordPreview> preview(RecordKind kind, int sampleSize) {
        OperationalRecordStore store = storeFor(kind);
        int limit = Math.min(MAX_PREVIEW_SIZE, Math.max(1, sampleSize));
        List<OperationalRecord> sample = store.findUnclassified(limit);
        if (sample.isEmpty()) {
            return List.of();
        }

        LedgerIndex index = ledgerService.loadIndex();
        List<RecordPreview> previews = new ArrayList<>(sample.size());
        for (OperationalRecord record : sample) {
            previews.add(previewRecord(record, index));
        }
        log.info("Previewed {} unclassified {} records", previews.size(), kind.collectionName());
        return previews;
    }

    private RecordPreview previewRecord(OperationalRecord record, LedgerIndex index) {
        EventHours hours = EventHours.derive(record, clock.instant());
        if (!hours.isValid()) {
            return new RecordPreview(record.getId(), MatchTier.NONE, List.of(), null, hours.error());
        }
        MatchOutcome outcome = matcher.match(record, index);
        return new RecordPreview(record.getId(), outcome.tier(), outcome.classifications(),
                hours.scaled(outcome.primary().allocationPercentage()), null);
    }

    private void executeInBackground(BackfillRun run, OperationalRecordStore store, BackfillSchedule runSchedule) {
        try {
            executeRun(run, store, runSchedule);
        } catch (RuntimeException ex) {
            log.error("Backfill run {} could not be tracked: {}", run.getId(), ex.getMessage(), ex);
        }
    }

    private BackfillSummary executeRun(BackfillRun run, OperationalRecordStore store, BackfillSchedule runSchedule) {
        try {
            run.setStartedAt(clock.instant());
            mongoTemplate.save(run);

            BackfillPipeline pipeline = new BackfillPipeline(store, backupWriter, ledgerService, matcher,
                    runSchedule, backupPageSize, clock);
            BackfillSummary summary = pipeline.run(run.getId(), new RunTracker(run));

            run.setState(summary.state());
            run.setCompletedAt(clock.instant());
            run.setCandidateRecords(summary.candidateRecords());
            run.setProcessedRecords(summary.processedRecords());
            run.setErrorRecords(summary.errorRecords());
            run.setRemainingRecords(summary.remainingRecords());
            run.setBatchesCompleted(summary.batchesCompleted());
            run.setBackupFile(summary.backupFile());
            run.setErrorMessage(summary.failureMessage());
            if (!summary.failed()) {
                run.setProgressPercent(100);
            }
            mongoTemplate.save(run);

            log.info("Backfill run={} finished state={} processed={} errors={} remaining={} durationMs={}",
                    run.getId(), summary.state(), summary.processedRecords(), summary.errorRecords(),
                    summary.remainingRecords(), summary.durationMillis());
            return summary;
        } finally {
            running.set(false);
        }
    }

    private BackfillRun createPendingRun(RecordKind kind, BackfillSchedule runSchedule) {
        BackfillRun run = new BackfillRun();
        run.setId(UUID.randomUUID().toString());
        run.setRecordKind(kind);
        run.setState(BackfillState.NOT_STARTED);
        run.setBatchSize(runSchedule.batchSize());
        run.setCreatedAt(clock.instant());
        return run;
    }

    private void acquire() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Rejecting backfill request because another run is in progress");
            throw new IllegalStateException("A backfill run is already in progress. Please wait for it to finish.");
        }
    }

    private BackfillSchedule scheduleFor(Integer batchSize) {
        if (batchSize == null) {
            return schedule;
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive but was " + batchSize);
        }
        return schedule.withBatchSize(batchSize);
    }

    private OperationalRecordStore storeFor(RecordKind kind) {
        OperationalRecordStore store = stores.get(kind);
        if (store == null) {
            throw new IllegalArgumentException("No record store registered for " + kind);
        }
        return store;
    }

    /**
     * Mirrors pipeline progress onto the persisted run document.
     */
    private final class RunTracker implements BackfillProgressListener {

        private final BackfillRun run;

        private RunTracker(BackfillRun run) {
            this.run = run;
        }

        @Override
        public void onStateChange(BackfillState state) {
            run.setState(state);
            mongoTemplate.save(run);
        }

        @Override
        public void onBatchCompleted(BackfillProgress progress) {
            run.setCandidateRecords(progress.candidates());
            run.setProcessedRecords(progress.processed());
            run.setErrorRecords(progress.errors());
            run.setRemainingRecords(Math.max(0, progress.candidates() - progress.processed()));
            run.setBatchesCompleted(progress.batchNumber());
            run.setProgressPercent(progress.percentComplete());
            mongoTemplate.save(run);
        }
    }
}
