package com.example.offshore.allocation.model;

import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Getter
@Setter
@ToString
@NoArgsConstructor
@Document(collection = "backfill_runs")
public class BackfillRun {

    @Id
    private String id;
    private RecordKind recordKind;
    private BackfillState state;
    private int batchSize;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private long candidateRecords;
    private long processedRecords;
    private long errorRecords;
    private long remainingRecords;
    private int batchesCompleted;
    private int progressPercent;
    private String backupFile;
    private String errorMessage;
}
