package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.Classification;
import com.example.offshore.allocation.model.ClassificationSource;
import com.example.offshore.allocation.model.DrillingSummary;
import com.example.offshore.allocation.model.LocationActivity;
import com.example.offshore.allocation.model.LocationRollup;
import com.example.offshore.allocation.model.ProjectType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rolls classified records up per location and splits each location's record count into drilling and
 * production demand.
 * <p>
 * Mixed locations use a declared default split of 60% drilling / 40% production
 * ({@code app.allocation.mixed-drilling-share}); it is a business constant, not a derived ratio.
 * Locations with no ledger-backed project type split 50/50.
 */
@Slf4j
@Component
public class DemandAggregator {

    private static final double UNKNOWN_DRILLING_SHARE = 0.5;

    private final LocationNormalizer normalizer;
    private final double mixedDrillingShare;

    public DemandAggregator(LocationNormalizer normalizer,
            @Value("${app.allocation.mixed-drilling-share:0.6}") double mixedDrillingShare) {
        if (mixedDrillingShare < 0 || mixedDrillingShare > 1) {
            throw new IllegalArgumentException("Mixed drilling share must be within [0, 1] but was " + mixedDrillingShare);
        }
        this.normalizer = normalizer;
        this.mixedDrillingShare = mixedDrillingShare;
    }

    /**
     * Groups per-record classification lists by the mapped location of each record's primary classification.
     * Each record counts once, whatever its LC split.
     */
    public Map<String, List<Classification>> groupByLocation(Collection<List<Classification>> recordClassifications) {
        Map<String, List<Classification>> grouped = new LinkedHashMap<>();
        for (List<Classification> classifications : recordClassifications) {
            if (classifications == null || classifications.isEmpty()) {
                continue;
            }
            Classification primary = classifications.get(0);
            String location = normalizer.normalize(primary.mappedLocation());
            if (location.isEmpty()) {
                location = "Unknown";
            }
            grouped.computeIfAbsent(location, key -> new ArrayList<>()).add(primary);
        }
        return grouped;
    }

    public DrillingSummary summarize(Map<String, List<Classification>> byLocation) {
        if (byLocation.isEmpty()) {
            return DrillingSummary.EMPTY;
        }

        Map<String, LocationRollup> rollups = new LinkedHashMap<>();
        double drillingDemand = 0;
        double productionDemand = 0;
        int drillingLocations = 0;
        int productionLocations = 0;
        int mixedLocations = 0;
        int unknownLocations = 0;

        for (Map.Entry<String, List<Classification>> entry : byLocation.entrySet()) {
            List<Classification> classifications = entry.getValue();
            LocationActivity activity = dominantActivity(classifications);
            long records = classifications.size();
            double drillingShare = switch (activity) {
                case DRILLING -> 1.0;
                case PRODUCTION -> 0.0;
                case MIXED -> mixedDrillingShare;
                case UNKNOWN -> UNKNOWN_DRILLING_SHARE;
            };
            double drilling = records * drillingShare;
            double production = records - drilling;

            switch (activity) {
                case DRILLING -> drillingLocations++;
                case PRODUCTION -> productionLocations++;
                case MIXED -> mixedLocations++;
                case UNKNOWN -> unknownLocations++;
            }
            drillingDemand += drilling;
            productionDemand += production;
            rollups.put(entry.getKey(), new LocationRollup(entry.getKey(), normalizer.rigCode(entry.getKey()), activity,
                    records, drilling, production));
        }

        double ratio = productionDemand > 0 ? drillingDemand / productionDemand : 0;
        log.debug("Summarized {} locations: drilling={} production={} ratio={}", rollups.size(), drillingDemand,
                productionDemand, ratio);
        return new DrillingSummary(drillingDemand, productionDemand, drillingLocations, productionLocations,
                mixedLocations, unknownLocations, ratio, Collections.unmodifiableMap(rollups));
    }

    static LocationActivity dominantActivity(List<Classification> classifications) {
        boolean drilling = false;
        boolean production = false;
        for (Classification classification : classifications) {
            if (classification.source() != ClassificationSource.LEDGER) {
                continue;
            }
            for (ProjectType type : classification.projectTypes()) {
                drilling |= type.isDrillingWork();
                production |= type.isProductionWork();
            }
        }
        if (drilling && production) {
            return LocationActivity.MIXED;
        }
        if (drilling) {
            return LocationActivity.DRILLING;
        }
        if (production) {
            return LocationActivity.PRODUCTION;
        }
        return LocationActivity.UNKNOWN;
    }
}
