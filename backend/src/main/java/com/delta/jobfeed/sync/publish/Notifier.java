package com.delta.jobfeed.sync.publish;

import com.delta.jobfeed.sync.model.SyncCycleSummary;

/**
 * Receives the outcome of every cycle. Calls are fire-and-forget; an exception thrown here is logged by the
 * caller and never changes the cycle result.
 */
public interface Notifier {

    /**
     * A cycle reached DONE. The summary carries the reconciliation result and any per-record failures. Feed
     * entries swept as orphans are reported under {@code removed} as well as in
     * {@link SyncCycleSummary#orphansRemoved()}.
     */
    void cycleCompleted(SyncCycleSummary summary);

    /**
     * A cycle ended FAILED, for example on an authentication error or a failed verification.
     */
    void cycleFailed(SyncCycleSummary summary);
}
