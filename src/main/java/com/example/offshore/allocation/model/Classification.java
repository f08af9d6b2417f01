package com.example.offshore.allocation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One department/LC attribution for a record. {@code projectTypes} holds every known project type among the
 * ledger rows behind it; {@code projectType} is the one that agrees with {@code department}.
 */
public record Classification(
        String lcNumber,
        Department department,
        ProjectType projectType,
        double allocationPercentage,
        String mappedLocation,
        Confidence confidence,
        ClassificationSource source,
        @JsonProperty("isSpecialCase") boolean specialCase,
        MatchTier tier,
        Set<ProjectType> projectTypes) {

    public Classification {
        if (projectTypes == null || projectTypes.isEmpty()) {
            projectTypes = knownTypes(Collections.singleton(projectType));
        } else {
            projectTypes = knownTypes(projectTypes);
        }
    }

    public Classification(String lcNumber, Department department, ProjectType projectType,
            double allocationPercentage, String mappedLocation, Confidence confidence, ClassificationSource source,
            boolean specialCase, MatchTier tier) {
        this(lcNumber, department, projectType, allocationPercentage, mappedLocation, confidence, source, specialCase,
                tier, null);
    }

    public static Classification fallback(String lcNumber, Department department, double percentage,
            String mappedLocation, MatchTier tier) {
        return new Classification(lcNumber, department, ProjectType.UNKNOWN, percentage, mappedLocation,
                Confidence.LOW, ClassificationSource.FALLBACK, false, tier);
    }

    public MappingStatus mappingStatus() {
        return specialCase ? MappingStatus.LC_MAPPED : MappingStatus.LOCATION_INFERRED;
    }

    public DataIntegrity dataIntegrity() {
        return specialCase ? DataIntegrity.VALID : DataIntegrity.INFERRED;
    }

    private static Set<ProjectType> knownTypes(Collection<ProjectType> types) {
        EnumSet<ProjectType> known = EnumSet.noneOf(ProjectType.class);
        for (ProjectType type : types) {
            if (type != null && type != ProjectType.UNKNOWN) {
                known.add(type);
            }
        }
        return Collections.unmodifiableSet(known);
    }
}
