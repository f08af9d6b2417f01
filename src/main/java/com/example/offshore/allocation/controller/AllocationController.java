package com.example.offshore.allocation.controller;

import com.example.offshore.allocation.model.BackfillRun;
import com.example.offshore.allocation.model.BackfillRunResponse;
import com.example.offshore.allocation.model.BackfillStatusReport;
import com.example.offshore.allocation.model.ClassificationRequest;
import com.example.offshore.allocation.model.DrillingSummary;
import com.example.offshore.allocation.model.MatchOutcome;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.RecordPreview;
import com.example.offshore.allocation.service.BackfillService;
import com.example.offshore.allocation.service.ClassificationService;
import com.example.offshore.allocation.support.AllocationProcessingException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AllocationController {

    private final BackfillService backfillService;
    private final ClassificationService classificationService;

    @PostMapping("/backfills")
    public ResponseEntity<BackfillRunResponse> startBackfill(
            @RequestParam(value = "kind", required = false) String kind,
            @RequestParam(value = "batchSize", required = false) Integer batchSize) {
        BackfillRun run = backfillService.enqueue(RecordKind.fromParameter(kind), batchSize);
        log.info("Accepted backfill run={} collection={} batchSize={}",
                run.getId(), run.getRecordKind().collectionName(), run.getBatchSize());

        return ResponseEntity.accepted()
            .location(ServletUriComponentsBuilder.fromCurrentRequest()
                .replaceQuery(null)
                .path("/{runId}")
                .buildAndExpand(run.getId())
                .toUri())
            .body(BackfillRunResponse.from(run));
    }

    @GetMapping("/backfills/{runId}")
    public ResponseEntity<BackfillRunResponse> getRun(@PathVariable String runId) {
        BackfillRun run = backfillService.findRun(runId);
        if (run == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(BackfillRunResponse.from(run));
    }

    @GetMapping("/backfills/status")
    public BackfillStatusReport status(@RequestParam(value = "kind", required = false) String kind) {
        return backfillService.statusReport(RecordKind.fromParameter(kind));
    }

    @GetMapping("/backfills/preview")
    public List<RecordPreview> preview(@RequestParam(value = "kind", required = false) String kind,
                                       @RequestParam(value = "sampleSize", defaultValue = "10") int sampleSize) {
        return backfillService.preview(RecordKind.fromParameter(kind), sampleSize);
    }

    @PostMapping("/classifications")
    public MatchOutcome classify(@RequestBody ClassificationRequest request) {
        return classificationService.classify(request);
    }

    @GetMapping("/demand-summary")
    public DrillingSummary demandSummary(@RequestParam(value = "kind", required = false) String kind) {
        return classificationService.demandSummary(RecordKind.fromParameter(kind));
    }

    @ExceptionHandler({AllocationProcessingException.class, IllegalArgumentException.class})
    public ResponseEntity<String> handleBadRequest(RuntimeException exception) {
        log.warn("Allocation request rejected: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(exception.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> handleConflict(IllegalStateException exception) {
        log.warn("Allocation request conflicts with current state: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(exception.getMessage());
    }
}
