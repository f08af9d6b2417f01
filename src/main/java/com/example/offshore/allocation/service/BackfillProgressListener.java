package com.example.offshore.allocation.service;

import com.example.offshore.allocation.model.BackfillProgress;
import com.example.offshore.allocation.model.BackfillState;

interface BackfillProgressListener {

    BackfillProgressListener NO_OP = new BackfillProgressListener() {
    };

    default void onStateChange(BackfillState state) {
    }

    default void onBatchCompleted(BackfillProgress progress) {
    }
}
