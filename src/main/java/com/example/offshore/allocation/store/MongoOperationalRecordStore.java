package com.example.offshore.allocation.store;

import com.example.offshore.allocation.model.MatchAttempt;
import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.RecordUpdate;
import com.mongodb.bulk.BulkWriteResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.support.TransactionTemplate;

@Slf4j
public class MongoOperationalRecordStore implements OperationalRecordStore {

    private static final String DEPARTMENT = "department";
    private static final String MAPPING_STATUS = "mappingStatus";
    private static final String UNSET = "(unset)";

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final RecordKind kind;
    private final Class<? extends OperationalRecord> documentType;

    public MongoOperationalRecordStore(MongoTemplate mongoTemplate,
            TransactionTemplate transactionTemplate,
            RecordKind kind,
            Class<? extends OperationalRecord> documentType) {
        this.mongoTemplate = mongoTemplate;
        this.transactionTemplate = transactionTemplate;
        this.kind = kind;
        this.documentType = documentType;
    }

    @Override
    public RecordKind kind() {
        return kind;
    }

    @Override
    public long countAll() {
        return mongoTemplate.count(new Query(), documentType);
    }

    @Override
    public long countUnclassified() {
        return mongoTemplate.count(unclassified(), documentType);
    }

    @Override
    public List<OperationalRecord> findUnclassified(int limit) {
        Query query = unclassified().with(Sort.by(Sort.Direction.ASC, "id")).limit(limit);
        return new ArrayList<>(mongoTemplate.find(query, documentType));
    }

    @Override
    public List<OperationalRecord> findAll() {
        return new ArrayList<>(mongoTemplate.findAll(documentType));
    }

    @Override
    public void forEachRecord(int pageSize, Consumer<OperationalRecord> consumer) {
        Query query = new Query().with(Sort.by(Sort.Direction.ASC, "id")).cursorBatchSize(pageSize);
        try (Stream<? extends OperationalRecord> records = mongoTemplate.stream(query, documentType)) {
            records.forEach(consumer);
        }
    }

    @Override
    public void applyBatch(List<RecordUpdate> updates, List<MatchAttempt> attempts) {
        transactionTemplate.executeWithoutResult(status -> {
            if (!updates.isEmpty()) {
                BulkOperations operations = mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, documentType);
                for (RecordUpdate update : updates) {
                    operations.updateOne(Query.query(Criteria.where("id").is(update.recordId())), toUpdate(update));
                }
                BulkWriteResult result = operations.execute();
                if (result.getMatchedCount() != updates.size()) {
                    throw new IllegalStateException("Batch matched %d of %d %s records"
                            .formatted(result.getMatchedCount(), updates.size(), kind.collectionName()));
                }
            }
            if (!attempts.isEmpty()) {
                mongoTemplate.insert(attempts, MatchAttempt.class);
            }
        });
        log.debug("Applied batch to {}: updates={} attempts={}", kind.collectionName(), updates.size(), attempts.size());
    }

    @Override
    public Map<String, Long> countByDepartment() {
        return countBy(DEPARTMENT);
    }

    @Override
    public Map<String, Long> countByMappingStatus() {
        return countBy(MAPPING_STATUS);
    }

    private Map<String, Long> countBy(String field) {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group(field).count().as("count"),
                Aggregation.sort(Sort.Direction.DESC, "count"));
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Document row : mongoTemplate.aggregate(aggregation, kind.collectionName(), Document.class)) {
            Object key = row.get("_id");
            counts.put(key == null ? UNSET : key.toString(), ((Number) row.get("count")).longValue());
        }
        return counts;
    }

    private static Query unclassified() {
        return Query.query(Criteria.where(DEPARTMENT).is(null));
    }

    private static Update toUpdate(RecordUpdate update) {
        Update mongoUpdate = new Update()
                .set(DEPARTMENT, update.department())
                .set("lcNumber", update.lcNumber())
                .set("lcPercentage", update.lcPercentage())
                .set("mappedLocation", update.mappedLocation())
                .set(MAPPING_STATUS, update.mappingStatus())
                .set("dataIntegrity", update.dataIntegrity())
                .set("allocationCount", update.allocationCount())
                .set("backfilledAt", update.backfilledAt())
                .set("backfillError", update.error());
        if (update.finalHours() != null) {
            mongoUpdate.set("finalHours", update.finalHours());
        }
        if (update.eventDate() != null) {
            mongoUpdate.set("eventDate", update.eventDate());
        }
        return mongoUpdate;
    }
}
