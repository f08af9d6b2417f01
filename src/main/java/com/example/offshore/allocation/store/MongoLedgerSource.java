package com.example.offshore.allocation.store;

import com.example.offshore.allocation.model.LedgerEntry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MongoLedgerSource implements LedgerSource {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<LedgerEntry> loadAll() {
        return mongoTemplate.findAll(LedgerEntry.class);
    }
}
