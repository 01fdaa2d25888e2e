package com.dextrader.core.execution;

import java.time.Instant;
import java.util.List;

public record ReconciliationReport(Instant reconciledAt, List<ReconciliationMismatch> mismatches) {
    public ReconciliationReport {
        mismatches = List.copyOf(mismatches);
    }

    public boolean isClean() {
        return mismatches.isEmpty();
    }
}
