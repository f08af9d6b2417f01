package com.example.offshore.allocation.support;

public class BatchWriteException extends AllocationProcessingException {

    public BatchWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
