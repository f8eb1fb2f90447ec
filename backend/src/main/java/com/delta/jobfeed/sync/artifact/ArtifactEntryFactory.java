package com.delta.jobfeed.sync.artifact;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.enrich.RecruiterTagDirectory;
import com.delta.jobfeed.sync.model.ArtifactEntry;
import com.delta.jobfeed.sync.model.Classification;
import com.delta.jobfeed.sync.model.JobRecord;
import com.delta.jobfeed.sync.model.MonitoredCollection;
import org.springframework.stereotype.Component;

/**
 * Builds the feed entry for a record from its reference code, its classification and the branding of the
 * collection it was found in.
 */
@Component
public class ArtifactEntryFactory {
    private final FeedSyncProperties properties;
    private final RecruiterTagDirectory recruiterTags;

    public ArtifactEntryFactory(FeedSyncProperties properties, RecruiterTagDirectory recruiterTags) {
        this.properties = properties;
        this.recruiterTags = recruiterTags;
    }

    /**
     * @throws RecordMappingException when the record lacks an id, a title or a reference code
     */
    public ArtifactEntry create(
        JobRecord record,
        String referenceCode,
        Classification classification,
        MonitoredCollection collection
    ) {
        if (record.externalId() == null || record.externalId().isBlank()) {
            throw new RecordMappingException("?", "missing external id");
        }
        if (record.title().isBlank()) {
            throw new RecordMappingException(record.externalId(), "missing title");
        }
        if (referenceCode == null || referenceCode.isBlank()) {
            throw new RecordMappingException(record.externalId(), "missing reference code");
        }
        FeedSyncProperties.Artifact artifact = properties.getArtifact();
        Classification labels = classification != null && classification.success()
            ? classification
            : Classification.failed(null);
        String country = record.location().country().isBlank() ? artifact.getDefaultCountry() : record.location().country();
        return new ArtifactEntry(
            record.externalId(),
            referenceCode,
            record.title().trim(),
            collection.companyName(),
            FieldValueMapper.displayDate(record.dateAdded() != null ? record.dateAdded() : record.lastModifiedAt()),
            FieldValueMapper.applicationUrl(collection.applyDomain(), record.externalId(), record.title()),
            record.description(),
            FieldValueMapper.jobType(record.employmentKind()),
            record.location().city(),
            record.location().state(),
            country,
            "",
            artifact.getApplyEmail(),
            FieldValueMapper.remoteType(record.workArrangement()),
            recruiterTags.format(record.assignedOwnerName()),
            nullToEmpty(labels.jobFunction()),
            nullToEmpty(labels.industries()),
            nullToEmpty(labels.seniorityLevel()),
            record.lastModifiedAt()
        );
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
