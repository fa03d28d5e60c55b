package com.ratiowatch.backend.modules.ratio.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-entry outcomes of a batch recording, in the order the entries were attempted.
 */
public record SnapshotBatchResult(Map<String, SnapshotOutcome> outcomes) {

    public SnapshotBatchResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public long recordedCount() {
        return countOf(SnapshotOutcome.Status.RECORDED);
    }

    public long duplicateCount() {
        return countOf(SnapshotOutcome.Status.DUPLICATE);
    }

    public long failedCount() {
        return countOf(SnapshotOutcome.Status.FAILED);
    }

    private long countOf(SnapshotOutcome.Status status) {
        return outcomes.values().stream().filter(outcome -> outcome.status() == status).count();
    }
}
