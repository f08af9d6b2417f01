package com.example.offshore.allocation.model;

/**
 * A single record submitted for request-time classification. {@code kind} defaults to a voyage event.
 */
public record ClassificationRequest(
        String kind,
        String recordId,
        String location,
        String chargeCode,
        String parentEvent,
        String event,
        String remarks,
        String portType) {
}
