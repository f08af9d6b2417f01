package com.example.offshore.allocation.cli;

import com.example.offshore.allocation.model.BackfillStatusReport;
import com.example.offshore.allocation.model.BackfillSummary;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.service.BackfillService;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Interactive backfill entry point, active under the {@code backfill} profile.
 * <p>
 * Options: {@code --batch-size=<n>} and {@code --kind=voyage-events|manifests}. The exit code is 1 when the
 * run failed (backup, ledger load, batch write) or could not start, 0 otherwise, including a declined prompt.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.backfill.cli.enabled", havingValue = "true")
public class BackfillCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final BackfillService backfillService;
    private final ConfirmationPrompt confirmationPrompt;
    private final int defaultBatchSize;
    private volatile int exitCode = EXIT_OK;

    public BackfillCommandLineRunner(BackfillService backfillService,
            ConfirmationPrompt confirmationPrompt,
            @Value("${app.backfill.batch-size:1000}") int defaultBatchSize) {
        this.backfillService = backfillService;
        this.confirmationPrompt = confirmationPrompt;
        this.defaultBatchSize = defaultBatchSize;
    }

    @Override
    public void run(ApplicationArguments args) {
        RecordKind kind;
        int batchSize;
        try {
            kind = RecordKind.fromParameter(option(args, "kind"));
            batchSize = batchSize(option(args, "batch-size"));
        } catch (IllegalArgumentException ex) {
            log.error("Invalid backfill arguments: {}", ex.getMessage());
            exitCode = EXIT_FAILURE;
            return;
        }

        try {
            BackfillStatusReport status = backfillService.statusReport(kind);
            log.info("Backfill requested for {}: total={} unclassified={} batchSize={}",
                    kind.collectionName(), status.totalRecords(), status.unclassifiedRecords(), batchSize);

            String question = "This will back up %s and classify %d unclassified records in batches of %d. Continue?"
                    .formatted(kind.collectionName(), status.unclassifiedRecords(), batchSize);
            if (!confirmationPrompt.confirm(question)) {
                log.info("Backfill cancelled by operator");
                exitCode = EXIT_OK;
                return;
            }

            BackfillSummary summary = backfillService.runNow(kind, batchSize);
            report(summary);
            exitCode = summary.failed() ? EXIT_FAILURE : EXIT_OK;
        } catch (RuntimeException ex) {
            log.error("Backfill could not run: {}", ex.getMessage(), ex);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void report(BackfillSummary summary) {
        log.info("Backfill run={} state={} candidates={} processed={} errors={} remaining={} batches={} durationMs={}",
                summary.runId(), summary.state(), summary.candidateRecords(), summary.processedRecords(),
                summary.errorRecords(), summary.remainingRecords(), summary.batchesCompleted(),
                summary.durationMillis());
        if (summary.backupFile() != null) {
            log.info("Backup file: {}", summary.backupFile());
        }
        if (summary.failed()) {
            log.error("Backfill failed: {}", summary.failureMessage());
        } else if (summary.hasRemainingRecords()) {
            log.warn("{} records remain unclassified; rerun the backfill to resume", summary.remainingRecords());
        }
    }

    private int batchSize(String value) {
        if (value == null || value.isBlank()) {
            return defaultBatchSize;
        }
        int size;
        try {
            size = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--batch-size must be a whole number but was '%s'".formatted(value), ex);
        }
        if (size < 1) {
            throw new IllegalArgumentException("--batch-size must be positive but was " + size);
        }
        return size;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
