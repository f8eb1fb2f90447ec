package com.delta.jobfeed.sync.reconcile;

import com.delta.jobfeed.sync.model.FieldChange;
import com.delta.jobfeed.sync.model.JobRecord;
import com.delta.jobfeed.sync.model.ReconciliationResult;
import com.delta.jobfeed.sync.model.ReconciliationSummary;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Diffs two record sets. Only the material fields of {@link JobRecord} take part in change detection;
 * classification labels are not part of a record and so never cause a modification.
 */
@Service
public class ReconciliationEngine {

    public ReconciliationResult reconcile(Collection<JobRecord> previous, Collection<JobRecord> current) {
        Map<String, JobRecord> previousById = index(previous);
        Map<String, JobRecord> currentById = index(current);

        Set<String> added = new LinkedHashSet<>();
        Map<String, List<FieldChange>> modified = new LinkedHashMap<>();
        for (Map.Entry<String, JobRecord> entry : currentById.entrySet()) {
            JobRecord before = previousById.get(entry.getKey());
            if (before == null) {
                added.add(entry.getKey());
                continue;
            }
            List<FieldChange> changes = diff(before, entry.getValue());
            if (!changes.isEmpty()) {
                modified.put(entry.getKey(), changes);
            }
        }

        Set<String> removed = new LinkedHashSet<>();
        for (String id : previousById.keySet()) {
            if (!currentById.containsKey(id)) {
                removed.add(id);
            }
        }

        ReconciliationSummary summary = new ReconciliationSummary(
            previousById.size(),
            currentById.size(),
            added.size(),
            removed.size(),
            modified.size()
        );
        return new ReconciliationResult(added, removed, modified, summary);
    }

    public List<FieldChange> diff(JobRecord before, JobRecord after) {
        Map<String, String> oldValues = before.materialValues();
        Map<String, String> newValues = after.materialValues();
        List<FieldChange> changes = new ArrayList<>();
        for (String field : JobRecord.MATERIAL_FIELDS) {
            String oldValue = normalize(oldValues.get(field));
            String newValue = normalize(newValues.get(field));
            if (!Objects.equals(oldValue, newValue)) {
                changes.add(new FieldChange(field, oldValue, newValue));
            }
        }
        return changes;
    }

    private Map<String, JobRecord> index(Collection<JobRecord> records) {
        Map<String, JobRecord> byId = new LinkedHashMap<>();
        if (records == null) {
            return byId;
        }
        for (JobRecord record : records) {
            if (record != null && record.externalId() != null) {
                byId.putIfAbsent(record.externalId(), record);
            }
        }
        return byId;
    }

    private String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
