package com.example.offshore.allocation.model;

/**
 * A voyage event or a manifest line awaiting (or carrying) a department classification.
 * The {@link #kind()} tag decides which fields the matcher may read.
 */
public interface OperationalRecord {

    String getId();

    RecordKind kind();

    String getDepartment();

    String[] toBackupRow();
}
