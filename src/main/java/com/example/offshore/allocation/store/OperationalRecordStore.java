package com.example.offshore.allocation.store;

import com.example.offshore.allocation.model.MatchAttempt;
import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.RecordKind;
import com.example.offshore.allocation.model.RecordUpdate;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Read/write access to one collection of operational records. "Unclassified" means the department
 * field is unset.
 */
public interface OperationalRecordStore {

    RecordKind kind();

    long countAll();

    long countUnclassified();

    /**
     * First {@code limit} records still missing a department, in a stable order.
     */
    List<OperationalRecord> findUnclassified(int limit);

    List<OperationalRecord> findAll();

    /**
     * Streams every record, fetching {@code pageSize} at a time.
     */
    void forEachRecord(int pageSize, Consumer<OperationalRecord> consumer);

    /**
     * Applies all updates and appends all attempts atomically: either the whole batch is durable or none of it.
     */
    void applyBatch(List<RecordUpdate> updates, List<MatchAttempt> attempts);

    Map<String, Long> countByDepartment();

    Map<String, Long> countByMappingStatus();
}
