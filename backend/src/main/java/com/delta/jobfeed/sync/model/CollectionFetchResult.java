package com.delta.jobfeed.sync.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record CollectionFetchResult(
    long collectionId,
    List<JobRecord> records,
    int associationTotal,
    int searchTotal,
    CrossCheckOutcome crossCheck,
    Set<String> orphanedByAssociation,
    boolean partial,
    Map<String, Integer> errors
) {
    public CollectionFetchResult {
        records = List.copyOf(records);
        orphanedByAssociation = Set.copyOf(orphanedByAssociation);
        errors = Map.copyOf(errors);
    }

    /**
     * Whether records missing from this fetch may be treated as removed from the collection.
     */
    public boolean removalSafe() {
        return !partial && crossCheck != CrossCheckOutcome.ABORTED;
    }
}
