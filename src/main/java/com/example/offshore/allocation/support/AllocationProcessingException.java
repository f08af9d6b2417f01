package com.example.offshore.allocation.support;

public class AllocationProcessingException extends RuntimeException {

    public AllocationProcessingException(String message) {
        super(message);
    }

    public AllocationProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
