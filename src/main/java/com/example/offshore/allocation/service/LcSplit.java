package com.example.offshore.allocation.service;

import java.util.List;

/**
 * Result of parsing one charge-code field. An empty split stands for a single unallocated unit at 100%.
 */
public record LcSplit(List<LcAllocation> allocations) {

    public static final double UNALLOCATED_PERCENTAGE = 100.0;
    public static final LcSplit EMPTY = new LcSplit(List.of());

    public LcSplit {
        allocations = List.copyOf(allocations);
    }

    public boolean isUnallocated() {
        return allocations.isEmpty();
    }

    public List<String> lcNumbers() {
        return allocations.stream().map(LcAllocation::lcNumber).toList();
    }

    public double totalPercentage() {
        if (isUnallocated()) {
            return UNALLOCATED_PERCENTAGE;
        }
        return allocations.stream().mapToDouble(LcAllocation::percentage).sum();
    }
}
