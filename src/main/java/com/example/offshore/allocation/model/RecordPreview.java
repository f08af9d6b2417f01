package com.example.offshore.allocation.model;

import java.util.List;

public record RecordPreview(
        String recordId,
        MatchTier tier,
        List<Classification> classifications,
        Double finalHours,
        String error) {
}
