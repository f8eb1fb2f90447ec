package com.delta.jobfeed.sync.publish;

import com.delta.jobfeed.sync.model.MutationFailure;
import com.delta.jobfeed.sync.model.ReconciliationResult;
import com.delta.jobfeed.sync.model.SyncCycleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void cycleCompleted(SyncCycleSummary summary) {
        ReconciliationResult result = summary.reconciliation();
        if (result == null || !result.hasChanges()) {
            log.info("Sync cycle {} completed with no changes", summary.cycleId());
        } else {
            log.info(
                "Sync cycle {} completed: previous={}, current={}, added={}, removed={}, modified={}, net={}",
                summary.cycleId(),
                result.summary().previousCount(),
                result.summary().currentCount(),
                result.added(),
                result.removed(),
                result.modified().keySet(),
                result.summary().netChange()
            );
        }
        for (MutationFailure failure : summary.mutationFailures()) {
            log.warn("Sync cycle {}: {} of {} failed: {}", summary.cycleId(), failure.operation(), failure.externalId(), failure.reason());
        }
        if (!summary.skippedRecords().isEmpty()) {
            log.warn("Sync cycle {} skipped unmappable records {}", summary.cycleId(), summary.skippedRecords());
        }
    }

    @Override
    public void cycleFailed(SyncCycleSummary summary) {
        log.error("Sync cycle {} FAILED: {}", summary.cycleId(), summary.failureReason());
    }
}
