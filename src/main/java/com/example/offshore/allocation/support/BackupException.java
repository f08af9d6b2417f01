package com.example.offshore.allocation.support;

public class BackupException extends AllocationProcessingException {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
