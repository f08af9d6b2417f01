package com.example.offshore.allocation.model;

import java.util.Map;

public record DrillingSummary(
        double totalDrillingDemand,
        double totalProductionDemand,
        int drillingLocationCount,
        int productionLocationCount,
        int mixedLocationCount,
        int unknownLocationCount,
        double drillingToProductionRatio,
        Map<String, LocationRollup> locations) {

    public static final DrillingSummary EMPTY = new DrillingSummary(0, 0, 0, 0, 0, 0, 0, Map.of());
}
