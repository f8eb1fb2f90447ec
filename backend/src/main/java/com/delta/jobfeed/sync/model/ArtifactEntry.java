package com.delta.jobfeed.sync.model;

import java.time.Instant;

public record ArtifactEntry(
    String externalId,
    String referenceCode,
    String title,
    String company,
    String date,
    String url,
    String description,
    String jobType,
    String city,
    String state,
    String country,
    String category,
    String applyEmail,
    String remoteType,
    String assignedRecruiter,
    String jobFunction,
    String jobIndustries,
    String seniorityLevel,
    Instant lastModifiedAt
) {
    public ArtifactEntry withReferenceCode(String code) {
        return new ArtifactEntry(
            externalId,
            code,
            title,
            company,
            date,
            url,
            description,
            jobType,
            city,
            state,
            country,
            category,
            applyEmail,
            remoteType,
            assignedRecruiter,
            jobFunction,
            jobIndustries,
            seniorityLevel,
            lastModifiedAt
        );
    }
}
