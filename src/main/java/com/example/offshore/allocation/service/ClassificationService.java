package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.Classification;
import com.example.offshore.allocation.model.ClassificationRequest;
import com.example.offshore.allocation.model.DrillingSummary;
import com.example.offshore.allocation.model.MatchOutcome;
import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.store.OperationalRecordStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ClassificationService {

    private final LedgerService ledgerService;
    private final RecordMatcher matcher;
    private final DemandAggregator aggregator;
    private final Map<RecordKind, OperationalRecordStore> stores;
    private final Clock clock;

    public ClassificationService(LedgerService ledgerService,
            RecordMatcher matcher,
            DemandAggregator aggregator,
            List<OperationalRecordStore> stores,
            Clock clock) {
        this.ledgerService = ledgerService;
        this.matcher = matcher;
        this.aggregator = aggregator;
        this.clock = clock;
        this.stores = new EnumMap<>(RecordKind.class);
        for (OperationalRecordStore store : stores) {
            this.stores.put(store.kind(), store);
        }
    }

    public MatchOutcome classify(ClassificationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("A record to classify is required");
        }
        MatchRequest matchRequest = new MatchRequest(
                RecordKind.fromParameter(request.kind()),
                request.recordId(),
                request.location(),
                request.chargeCode(),
                request.parentEvent(),
                request.event(),
                request.remarks(),
                request.portType());
        MatchOutcome outcome = matcher.match(matchRequest, ledgerService.loadIndex());
        log.debug("Classified record={} tier={} department={}", request.recordId(), outcome.tier(),
                outcome.primary().department());
        return outcome;
    }

    /**
     * Classifies every record of one collection against the current ledger and rolls the result up by location.
     * Nothing is written back.
     */
    public DrillingSummary demandSummary(RecordKind kind) {
        OperationalRecordStore store = stores.get(kind);
        if (store == null) {
            throw new IllegalArgumentException("No record store registered for " + kind);
        }
        Instant start = clock.instant();
        LedgerIndex index = ledgerService.loadIndex();
        List<OperationalRecord> records = store.findAll();

        List<List<Classification>> classified = new ArrayList<>(records.size());
        for (OperationalRecord record : records) {
            classified.add(matcher.match(record, index).classifications());
        }
        DrillingSummary summary = aggregator.summarize(aggregator.groupByLocation(classified));
        log.info("Demand summary collection={} records={} locations={} drilling={} production={} durationMs={}",
                kind.collectionName(),
                records.size(),
                summary.locations().size(),
                summary.totalDrillingDemand(),
                summary.totalProductionDemand(),
                Duration.between(start, clock.instant()).toMillis());
        return summary;
    }
}
