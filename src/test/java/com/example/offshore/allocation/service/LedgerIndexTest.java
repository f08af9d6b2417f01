package com.example.offshore.allocation.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.offshore.allocation.model.LedgerEntry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LedgerIndex")
class LedgerIndexTest {

    private final LocationNormalizer normalizer = new LocationNormalizer();

    @Test
    @DisplayName("LC lookups ignore case and surrounding whitespace")
    void lcLookupIsNormalized() {
        // Given
        LedgerEntry entry = LedgerEntry.builder().id("a").lcNumber(" wbs-9358 ").department("Drilling").build();

        // When
        LedgerIndex index = LedgerIndex.build(List.of(entry), normalizer);

        // Then
        assertThat(index.findByLc("WBS-9358")).containsExactly(entry);
        assertThat(index.findByLc("wbs-9358  ")).containsExactly(entry);
        assertThat(index.findByLc(null)).isEmpty();
    }

    @Test
    @DisplayName("Entries without an LC or a known department are not LC-indexed")
    void skipsIncompleteLcEntries() {
        LedgerEntry noLc = LedgerEntry.builder().id("a").department("Drilling").rigLocation("Mad Dog").build();
        LedgerEntry noDepartment = LedgerEntry.builder().id("b").lcNumber("7777").build();
        LedgerEntry badDepartment = LedgerEntry.builder().id("c").lcNumber("8888").department("Finance").build();

        LedgerIndex index = LedgerIndex.build(List.of(noLc, noDepartment, badDepartment), normalizer);

        assertThat(index.lcCount()).isZero();
        assertThat(index.findByLocation("Mad Dog")).containsExactly(noLc);
        assertThat(index.ledgerSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("Locations are indexed under canonical names, unknown places are skipped")
    void indexesOnlyKnownLocations() {
        LedgerEntry fourchon = LedgerEntry.builder().id("x").lcNumber("1").department("Logistics")
                .rigLocation("Port Fourchon").build();

        LedgerIndex index = LedgerIndex.build(List.of(LedgerFixtures.ATLANTIS_PRODUCTION, fourchon,
                LedgerFixtures.BLACKLION_COMPLETIONS), normalizer);

        assertThat(index.findByLocation("Atlantis PQ")).containsExactly(LedgerFixtures.ATLANTIS_PRODUCTION);
        assertThat(index.findByLocation("Ocean BlackLion")).containsExactly(LedgerFixtures.BLACKLION_COMPLETIONS);
        assertThat(index.findByLocation("Port Fourchon")).isEmpty();
        assertThat(index.locationCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Location keys keep ledger order")
    void keepsLedgerOrder() {
        LedgerIndex index = LedgerFixtures.index();

        assertThat(index.locationEntries()).extracting(Map.Entry::getKey)
                .containsExactly("Thunder Horse PDQ", "Mad Dog", "Atlantis PQ", "Ocean BlackLion");
        assertThat(index.findByLocation("Atlantis PQ"))
                .containsExactly(LedgerFixtures.ATLANTIS_PRODUCTION, LedgerFixtures.ATLANTIS_DRILLING);
    }

    @Test
    @DisplayName("Empty index answers every lookup with nothing")
    void emptyIndex() {
        LedgerIndex index = LedgerIndex.empty();

        assertThat(index.findByLc("9358")).isEmpty();
        assertThat(index.findByLocation("Mad Dog")).isEmpty();
        assertThat(index.locationEntries()).isEmpty();
    }
}
