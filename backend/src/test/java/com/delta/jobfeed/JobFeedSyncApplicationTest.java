package com.delta.jobfeed;

import com.delta.jobfeed.sync.enrich.RecruiterTagDirectory;
import com.delta.jobfeed.sync.model.SyncCycleState;
import com.delta.jobfeed.sync.model.SyncCycleSummary;
import com.delta.jobfeed.sync.service.SyncOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JobFeedSyncApplicationTest {

    @Autowired
    private SyncOrchestrator syncOrchestrator;

    @Autowired
    private RecruiterTagDirectory recruiterTagDirectory;

    @Test
    void contextWiresTheSyncPipeline() {
        assertThat(recruiterTagDirectory.size()).isEqualTo(2);
        assertThat(syncOrchestrator.isRunning()).isFalse();
    }

    @Test
    void cycleWithoutMonitoredCollectionsCompletes() {
        SyncCycleSummary summary = syncOrchestrator.runCycle();

        assertThat(summary.state()).isEqualTo(SyncCycleState.DONE);
        assertThat(summary.collections()).isEmpty();
        assertThat(summary.mutationFailures()).isEmpty();
    }
}
