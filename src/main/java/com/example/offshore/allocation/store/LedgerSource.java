package com.example.offshore.allocation.store;

import com.example.offshore.allocation.model.LedgerEntry;
import java.util.List;

@FunctionalInterface
public interface LedgerSource {

    List<LedgerEntry> loadAll();
}
