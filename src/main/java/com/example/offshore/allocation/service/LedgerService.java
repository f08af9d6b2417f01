package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.LedgerEntry;
import com.example.offshore.allocation.store.LedgerSource;
import com.example.offshore.allocation.support.LedgerLoadException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    private final LedgerSource ledgerSource;
    private final LocationNormalizer normalizer;
    private final Clock clock;

    public LedgerIndex loadIndex() {
        Instant start = clock.instant();
        List<LedgerEntry> entries;
        try {
            entries = ledgerSource.loadAll();
        } catch (RuntimeException ex) {
            throw new LedgerLoadException("Failed to load cost allocation ledger: %s".formatted(ex.getMessage()), ex);
        }
        if (entries == null) {
            entries = List.of();
        }

        LedgerIndex index = LedgerIndex.build(entries, normalizer);
        if (index.ledgerSize() == 0) {
            log.warn("Cost allocation ledger is empty; every record will use fallback classification");
        }
        log.info("Loaded ledger entries={} lcKeys={} locations={} durationMs={}",
                index.ledgerSize(),
                index.lcCount(),
                index.locationCount(),
                Duration.between(start, clock.instant()).toMillis());
        return index;
    }
}
