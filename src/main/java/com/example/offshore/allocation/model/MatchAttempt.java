package com.example.offshore.allocation.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Append-only audit entry: one per record per backfill run.
 */
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "match_attempts")
public class MatchAttempt {

    @Id
    private String id;
    private String runId;
    private String recordId;
    private RecordKind recordKind;
    private String ledgerEntryId;
    private String lcNumber;
    private MatchTier tier;
    private String error;
    private Instant attemptedAt;
}
