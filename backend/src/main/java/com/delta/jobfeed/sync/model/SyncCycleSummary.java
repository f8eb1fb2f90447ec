package com.delta.jobfeed.sync.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record SyncCycleSummary(
    String cycleId,
    Instant startedAt,
    Instant finishedAt,
    SyncCycleState state,
    String failureReason,
    ReconciliationResult reconciliation,
    List<CollectionFetchResult> collections,
    List<MutationFailure> mutationFailures,
    Set<String> skippedRecords,
    Set<String> carriedForward,
    Set<String> orphansRemoved,
    int duplicatesRemoved,
    List<SyncCycleState> transitions,
    Boolean published
) {
    public boolean succeeded() {
        return state == SyncCycleState.DONE;
    }
}
