package com.example.offshore.allocation.model;

import java.util.Map;

public record BackfillStatusReport(
        RecordKind recordKind,
        long totalRecords,
        long classifiedRecords,
        long unclassifiedRecords,
        double unclassifiedPercent,
        Map<String, Long> departmentDistribution,
        Map<String, Long> mappingStatusDistribution) {
}
