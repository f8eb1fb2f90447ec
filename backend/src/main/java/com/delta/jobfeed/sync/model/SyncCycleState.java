package com.delta.jobfeed.sync.model;

public enum SyncCycleState {
    FETCHING,
    RECONCILING,
    MUTATING,
    VERIFYING,
    DONE,
    FAILED
}
