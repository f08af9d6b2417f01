package com.example.offshore.allocation.model;

public record ClassificationError(String recordId, String message) {
}
