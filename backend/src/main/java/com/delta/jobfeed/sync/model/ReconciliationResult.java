package com.delta.jobfeed.sync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record ReconciliationResult(
    Set<String> added,
    Set<String> removed,
    Map<String, List<FieldChange>> modified,
    ReconciliationSummary summary
) {
    public ReconciliationResult {
        added = Collections.unmodifiableSet(new LinkedHashSet<>(added));
        removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
        modified = Collections.unmodifiableMap(new LinkedHashMap<>(modified));
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !modified.isEmpty();
    }
}
