package com.example.offshore.allocation.support;

public class LedgerLoadException extends AllocationProcessingException {

    public LedgerLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
