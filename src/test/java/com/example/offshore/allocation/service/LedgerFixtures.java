package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.LedgerEntry;
import java.util.List;

final class LedgerFixtures {

    static final LedgerEntry THUNDER_HORSE_DRILLING = LedgerEntry.builder()
            .id("ca-1").lcNumber("9358").rigLocation("Thunder Horse PDQ").rigReference("Thunder Horse PDQ")
            .projectType("Drilling").department("Drilling").build();
    static final LedgerEntry MAD_DOG_PRODUCTION = LedgerEntry.builder()
            .id("ca-2").lcNumber("10137").rigLocation("Mad Dog")
            .projectType("Production").department("Production").build();
    static final LedgerEntry ATLANTIS_PRODUCTION = LedgerEntry.builder()
            .id("ca-3").lcNumber("2200").rigLocation("Atlantis")
            .projectType("Production").department("Production").build();
    static final LedgerEntry ATLANTIS_DRILLING = LedgerEntry.builder()
            .id("ca-4").lcNumber("2201").rigLocation("Atlantis")
            .projectType("Drilling").department("Drilling").build();
    static final LedgerEntry BLACKLION_COMPLETIONS = LedgerEntry.builder()
            .id("ca-5").locationReference("Ocean BlackLion")
            .projectType("Completions").department("Drilling").build();

    private LedgerFixtures() {
    }

    static List<LedgerEntry> ledger() {
        return List.of(THUNDER_HORSE_DRILLING, MAD_DOG_PRODUCTION, ATLANTIS_PRODUCTION, ATLANTIS_DRILLING,
                BLACKLION_COMPLETIONS);
    }

    static LedgerIndex index() {
        return LedgerIndex.build(ledger(), new LocationNormalizer());
    }
}
