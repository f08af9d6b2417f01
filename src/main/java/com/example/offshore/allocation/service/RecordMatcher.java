package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.Classification;
import com.example.offshore.allocation.model.ClassificationSource;
import com.example.offshore.allocation.model.Confidence;
import com.example.offshore.allocation.model.Department;
import com.example.offshore.allocation.model.LedgerEntry;
import com.example.offshore.allocation.model.MatchOutcome;
import com.example.offshore.allocation.model.MatchTier;
import com.example.offshore.allocation.model.OperationalRecord;
import com.example.offshore.allocation.model.ProjectType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves one record against the ledger. Tiers run in order and the first one that produces a match
 * wins: exact LC, canonical location, fuzzy location, then the keyword fallback.
 * <p>
 * Stateless apart from its configuration; the {@link LedgerIndex} is passed into every call.
 */
@Component
public class RecordMatcher {

    private static final double FULL = 100.0;

    private final LcParser lcParser;
    private final LocationNormalizer normalizer;
    private final FallbackClassifier fallbackClassifier;
    private final double fuzzyMatchPercentage;

    public RecordMatcher(LcParser lcParser,
            LocationNormalizer normalizer,
            FallbackClassifier fallbackClassifier,
            @Value("${app.allocation.fuzzy-match-percentage:30}") double fuzzyMatchPercentage) {
        this.lcParser = lcParser;
        this.normalizer = normalizer;
        this.fallbackClassifier = fallbackClassifier;
        this.fuzzyMatchPercentage = fuzzyMatchPercentage;
    }

    public MatchOutcome match(OperationalRecord record, LedgerIndex index) {
        return match(MatchRequest.from(record), index);
    }

    public MatchOutcome match(MatchRequest request, LedgerIndex index) {
        MatchOutcome exact = matchByLc(request, index);
        if (exact != null) {
            return exact;
        }

        String canonical = normalizer.normalize(request.location());
        MatchOutcome byLocation = matchByLocation(canonical, index);
        if (byLocation != null) {
            return byLocation;
        }

        MatchOutcome fuzzy = matchFuzzy(canonical, index);
        if (fuzzy != null) {
            return fuzzy;
        }

        Department department = fallbackDepartment(request);
        return new MatchOutcome(
                List.of(Classification.fallback(null, department, FULL, request.location(), MatchTier.FALLBACK)),
                MatchTier.FALLBACK,
                null);
    }

    private MatchOutcome matchByLc(MatchRequest request, LedgerIndex index) {
        LcSplit split = lcParser.parse(request.chargeCode());
        if (split.isUnallocated()) {
            return null;
        }

        List<Classification> classifications = new ArrayList<>(split.allocations().size());
        LedgerEntry firstHit = null;
        Department fallback = null;
        for (LcAllocation allocation : split.allocations()) {
            List<LedgerEntry> hits = index.findByLc(allocation.lcNumber());
            if (hits.isEmpty()) {
                if (fallback == null) {
                    fallback = fallbackDepartment(request);
                }
                classifications.add(Classification.fallback(allocation.lcNumber(), fallback, allocation.percentage(),
                        request.location(), MatchTier.FALLBACK));
                continue;
            }

            LedgerEntry entry = hits.get(0);
            if (firstHit == null) {
                firstHit = entry;
            }
            Department department = resolveDepartment(hits);
            classifications.add(new Classification(
                    allocation.lcNumber(),
                    department,
                    representativeType(hits, department),
                    allocation.percentage(),
                    mappedLocation(entry, request.location()),
                    Confidence.HIGH,
                    ClassificationSource.LEDGER,
                    true,
                    MatchTier.EXACT_LC,
                    projectTypes(hits)));
        }

        return firstHit == null ? null : new MatchOutcome(classifications, MatchTier.EXACT_LC, firstHit);
    }

    private MatchOutcome matchByLocation(String canonical, LedgerIndex index) {
        List<LedgerEntry> entries = index.findByLocation(canonical);
        if (entries.isEmpty()) {
            return null;
        }
        double percentage = entries.size() > 1 ? FULL / entries.size() : FULL;
        return ledgerOutcome(entries, canonical, percentage, Confidence.MEDIUM, MatchTier.LOCATION);
    }

    private MatchOutcome matchFuzzy(String canonical, LedgerIndex index) {
        if (canonical.isBlank()) {
            return null;
        }
        String location = canonical.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<LedgerEntry>> candidate : index.locationEntries()) {
            String key = candidate.getKey().toLowerCase(Locale.ROOT);
            if (location.contains(key) || key.contains(location)) {
                return ledgerOutcome(candidate.getValue(), candidate.getKey(), fuzzyMatchPercentage, Confidence.LOW,
                        MatchTier.FUZZY_LOCATION);
            }
        }
        return null;
    }

    private static MatchOutcome ledgerOutcome(List<LedgerEntry> entries, String location, double percentage,
            Confidence confidence, MatchTier tier) {
        LedgerEntry first = entries.get(0);
        Department department = resolveDepartment(entries);
        Classification classification = new Classification(
                first.getLcNumber(),
                department,
                representativeType(entries, department),
                percentage,
                location,
                confidence,
                ClassificationSource.LEDGER,
                true,
                tier,
                projectTypes(entries));
        return new MatchOutcome(List.of(classification), tier, first);
    }

    private Department fallbackDepartment(MatchRequest request) {
        return fallbackClassifier.classify(request.location(), request.parentEvent(), request.event(),
                request.remarks(), request.portType());
    }

    private static String mappedLocation(LedgerEntry entry, String recordLocation) {
        String rigReference = entry.getRigReference();
        return rigReference != null && !rigReference.isBlank() ? rigReference : recordLocation;
    }

    static Set<ProjectType> projectTypes(List<LedgerEntry> entries) {
        return entries.stream()
                .map(LedgerEntry::resolvedProjectType)
                .filter(type -> type != ProjectType.UNKNOWN)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ProjectType.class)));
    }

    /**
     * The project type of the first row that agrees with the resolved department, or of the first row.
     */
    private static ProjectType representativeType(List<LedgerEntry> entries, Department department) {
        for (LedgerEntry entry : entries) {
            ProjectType type = entry.resolvedProjectType();
            boolean agrees = switch (department) {
                case DRILLING -> type.isDrillingWork();
                case PRODUCTION -> type.isProductionWork();
                default -> department == entry.resolvedDepartment();
            };
            if (agrees) {
                return type;
            }
        }
        return entries.get(0).resolvedProjectType();
    }

    /**
     * Department for a group of ledger rows. A single department wins outright; otherwise drilling
     * outranks production, and anything still ambiguous is {@code MIXED}.
     */
    static Department resolveDepartment(List<LedgerEntry> entries) {
        Set<Department> departments = entries.stream()
                .map(LedgerEntry::resolvedDepartment)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Department.class)));
        if (departments.size() == 1) {
            return departments.iterator().next();
        }

        Set<ProjectType> projectTypes = projectTypes(entries);
        if (departments.contains(Department.DRILLING) || projectTypes.stream().anyMatch(ProjectType::isDrillingWork)) {
            return Department.DRILLING;
        }
        if (departments.contains(Department.PRODUCTION)
                || projectTypes.stream().anyMatch(ProjectType::isProductionWork)) {
            return Department.PRODUCTION;
        }
        if (departments.size() > 1 || projectTypes.size() > 1) {
            return Department.MIXED;
        }
        return Department.LOGISTICS;
    }
}
