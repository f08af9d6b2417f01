package com.example.offshore.allocation.model;

public record BackfillProgress(int batchNumber, long candidates, long processed, long errors) {

    public int percentComplete() {
        if (candidates <= 0) {
            return 100;
        }
        return (int) Math.min(100, (processed * 100) / candidates);
    }
}
