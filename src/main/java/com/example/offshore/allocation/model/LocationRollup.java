package com.example.offshore.allocation.model;

public record LocationRollup(
        String location,
        String rigCode,
        LocationActivity activity,
        long recordCount,
        double drillingDemand,
        double productionDemand) {
}
