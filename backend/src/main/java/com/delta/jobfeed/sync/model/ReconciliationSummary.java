package com.delta.jobfeed.sync.model;

public record ReconciliationSummary(
    int previousCount,
    int currentCount,
    int addedCount,
    int removedCount,
    int modifiedCount
) {
    public int netChange() {
        return currentCount - previousCount;
    }
}
