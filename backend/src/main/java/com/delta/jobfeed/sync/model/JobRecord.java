package com.delta.jobfeed.sync.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A job listing as held by the remote applicant-tracking system. Fetched fresh every cycle and only
 * persisted as the previous record set used for the next reconciliation.
 */
public record JobRecord(
    String externalId,
    String title,
    String description,
    RecordLocation location,
    String employmentKind,
    String workArrangement,
    String assignedOwnerName,
    Instant lastModifiedAt,
    Instant dateAdded,
    String status,
    boolean active,
    long collectionId
) {
    public static final List<String> MATERIAL_FIELDS = List.of(
        "title",
        "description",
        "city",
        "state",
        "country",
        "employmentKind",
        "workArrangement",
        "assignedOwnerName"
    );

    public JobRecord {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        location = location == null ? RecordLocation.empty() : location;
        employmentKind = employmentKind == null ? "" : employmentKind;
        workArrangement = workArrangement == null ? "" : workArrangement;
        assignedOwnerName = assignedOwnerName == null ? "" : assignedOwnerName;
        status = status == null ? "" : status;
    }

    /**
     * Values of the fields that decide whether a record counts as modified, keyed by the names in
     * {@link #MATERIAL_FIELDS}.
     */
    public Map<String, String> materialValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("title", title);
        values.put("description", description);
        values.put("city", location.city());
        values.put("state", location.state());
        values.put("country", location.country());
        values.put("employmentKind", employmentKind);
        values.put("workArrangement", workArrangement);
        values.put("assignedOwnerName", assignedOwnerName);
        return values;
    }
}
