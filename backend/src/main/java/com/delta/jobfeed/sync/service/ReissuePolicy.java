package com.delta.jobfeed.sync.service;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.model.FieldChange;
import com.delta.jobfeed.sync.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a modified record gets a fresh reference code. Codes are kept unless one of the configured
 * {@code feedsync.reissue.fields} changed; with nothing configured every code is kept.
 */
@Component
public class ReissuePolicy {
    private static final Logger log = LoggerFactory.getLogger(ReissuePolicy.class);

    private final Set<String> triggerFields = new LinkedHashSet<>();

    public ReissuePolicy(FeedSyncProperties properties) {
        for (String field : properties.getReissue().getFields()) {
            if (field == null || field.isBlank()) {
                continue;
            }
            if (!JobRecord.MATERIAL_FIELDS.contains(field.trim())) {
                log.warn("Ignoring reissue field {}: not one of {}", field, JobRecord.MATERIAL_FIELDS);
                continue;
            }
            triggerFields.add(field.trim());
        }
    }

    public boolean shouldReissue(String externalId, List<FieldChange> changes) {
        if (triggerFields.isEmpty() || changes == null) {
            return false;
        }
        for (FieldChange change : changes) {
            if (triggerFields.contains(change.field())) {
                log.info("Record {} changed {}; a new reference code will be issued", externalId, change.field());
                return true;
            }
        }
        return false;
    }
}
