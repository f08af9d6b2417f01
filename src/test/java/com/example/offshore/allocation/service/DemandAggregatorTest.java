package com.example.offshore.allocation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.offshore.allocation.model.Classification;
import com.example.offshore.allocation.model.ClassificationSource;
import com.example.offshore.allocation.model.Confidence;
import com.example.offshore.allocation.model.Department;
import com.example.offshore.allocation.model.DrillingSummary;
import com.example.offshore.allocation.model.LocationActivity;
import com.example.offshore.allocation.model.LocationRollup;
import com.example.offshore.allocation.model.MatchTier;
import com.example.offshore.allocation.model.ProjectType;
import com.example.offshore.allocation.model.VoyageEventDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DemandAggregator")
class DemandAggregatorTest {

    private final DemandAggregator aggregator = new DemandAggregator(new LocationNormalizer(), 0.6);

    private static Classification ledger(String location, ProjectType type) {
        return new Classification("1", Department.DRILLING, type, 100, location, Confidence.HIGH,
                ClassificationSource.LEDGER, true, MatchTier.EXACT_LC);
    }

    private static Classification fallback(String location) {
        return Classification.fallback(null, Department.OPERATIONS, 100, location, MatchTier.FALLBACK);
    }

    @Test
    @DisplayName("Mixed locations split 60/40, single-typed locations are fully attributed")
    void splitsByDominantType() {
        // Given
        Map<String, List<Classification>> byLocation = new LinkedHashMap<>();
        byLocation.put("Mad Dog", List.of(ledger("Mad Dog", ProjectType.DRILLING), ledger("Mad Dog", ProjectType.MAINTENANCE)));
        byLocation.put("Thunder Horse PDQ", List.of(ledger("Thunder Horse PDQ", ProjectType.COMPLETIONS)));
        byLocation.put("Atlantis PQ", List.of(ledger("Atlantis PQ", ProjectType.PRODUCTION),
                ledger("Atlantis PQ", ProjectType.PRODUCTION), ledger("Atlantis PQ", ProjectType.PRODUCTION)));

        // When
        DrillingSummary summary = aggregator.summarize(byLocation);

        // Then
        assertThat(summary.locations().get("Mad Dog").activity()).isEqualTo(LocationActivity.MIXED);
        assertThat(summary.locations().get("Mad Dog").drillingDemand()).isCloseTo(1.2, within(1e-9));
        assertThat(summary.locations().get("Mad Dog").productionDemand()).isCloseTo(0.8, within(1e-9));
        assertThat(summary.totalDrillingDemand()).isCloseTo(2.2, within(1e-9));
        assertThat(summary.totalProductionDemand()).isCloseTo(3.8, within(1e-9));
        assertThat(summary.mixedLocationCount()).isEqualTo(1);
        assertThat(summary.drillingLocationCount()).isEqualTo(1);
        assertThat(summary.productionLocationCount()).isEqualTo(1);
        assertThat(summary.drillingToProductionRatio()).isCloseTo(2.2 / 3.8, within(1e-9));
        assertThat(summary.locations().get("Mad Dog").rigCode()).isEqualTo("MD");
    }

    @Test
    @DisplayName("Demand is conserved: drilling plus production equals the record count")
    void conservesDemand() {
        Map<String, List<Classification>> byLocation = new LinkedHashMap<>();
        byLocation.put("A", List.of(fallback("A"), fallback("A"), fallback("A")));
        byLocation.put("B", List.of(ledger("B", ProjectType.DRILLING), ledger("B", ProjectType.PRODUCTION)));
        byLocation.put("C", List.of(ledger("C", ProjectType.OPERATOR_SHARING)));

        DrillingSummary summary = aggregator.summarize(byLocation);

        assertThat(summary.totalDrillingDemand() + summary.totalProductionDemand()).isCloseTo(6.0, within(1e-9));
        assertThat(summary.unknownLocationCount()).isEqualTo(2);
        assertThat(summary.locations().get("A").drillingDemand()).isCloseTo(1.5, within(1e-9));
    }

    @Test
    @DisplayName("Fallback classifications never decide the dominant type")
    void ignoresFallbackProjectTypes() {
        Classification fallbackDrilling = new Classification(null, Department.DRILLING, ProjectType.DRILLING, 100,
                "X", Confidence.LOW, ClassificationSource.FALLBACK, false, MatchTier.FALLBACK);

        assertThat(DemandAggregator.dominantActivity(List.of(fallbackDrilling))).isEqualTo(LocationActivity.UNKNOWN);
    }

    @Test
    @DisplayName("Ratio is zero without production demand")
    void ratioWithoutProduction() {
        DrillingSummary summary = aggregator.summarize(
                Map.of("Thunder Horse PDQ", List.of(ledger("Thunder Horse PDQ", ProjectType.DRILLING))));

        assertThat(summary.totalProductionDemand()).isZero();
        assertThat(summary.drillingToProductionRatio()).isZero();
        assertThat(aggregator.summarize(Map.of())).isSameAs(DrillingSummary.EMPTY);
    }

    @Test
    @DisplayName("A location whose ledger rows carry drilling and production work rolls up as mixed")
    void ledgerTypesAreUnioned() {
        // Given
        LocationNormalizer normalizer = new LocationNormalizer();
        RecordMatcher matcher = new RecordMatcher(new LcParser(), normalizer, new FallbackClassifier(normalizer), 30);
        LedgerIndex index = LedgerFixtures.index();
        List<List<Classification>> classified = new ArrayList<>();
        for (String id : List.of("ve-1", "ve-2")) {
            VoyageEventDocument event = VoyageEventDocument.builder().id(id).location("Atlantis").build();
            classified.add(matcher.match(event, index).classifications());
        }

        // When
        DrillingSummary summary = aggregator.summarize(aggregator.groupByLocation(classified));

        // Then
        LocationRollup atlantis = summary.locations().get("Atlantis PQ");
        assertThat(atlantis.activity()).isEqualTo(LocationActivity.MIXED);
        assertThat(atlantis.drillingDemand()).isCloseTo(1.2, within(1e-9));
        assertThat(atlantis.productionDemand()).isCloseTo(0.8, within(1e-9));
        assertThat(summary.mixedLocationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Records are grouped by the canonical location of their primary classification")
    void groupsByPrimaryLocation() {
        // Given
        List<Classification> split = List.of(ledger("mad dog", ProjectType.DRILLING), ledger("Atlantis", ProjectType.PRODUCTION));
        List<Classification> unmapped = List.of(fallback(null));

        // When
        Map<String, List<Classification>> grouped = aggregator.groupByLocation(
                List.of(split, unmapped, List.of(ledger("Mad Dog", ProjectType.PRODUCTION))));

        // Then
        assertThat(grouped).containsOnlyKeys("Mad Dog", "Unknown");
        assertThat(grouped.get("Mad Dog")).hasSize(2);
        assertThat(grouped.get("Unknown")).hasSize(1);
    }

    @Test
    @DisplayName("Mixed share outside [0, 1] is rejected")
    void rejectsInvalidShare() {
        assertThatThrownBy(() -> new DemandAggregator(new LocationNormalizer(), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
