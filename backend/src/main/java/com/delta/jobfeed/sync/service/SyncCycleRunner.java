package com.delta.jobfeed.sync.service;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.model.CollectionFetchResult;
import com.delta.jobfeed.sync.model.SyncCycleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class SyncCycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCycleRunner.class);

    private final FeedSyncProperties properties;
    private final SyncOrchestrator syncOrchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCycleRunner(
        FeedSyncProperties properties,
        SyncOrchestrator syncOrchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.syncOrchestrator = syncOrchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getRunner().isRunOnStartup()) {
            return;
        }

        SyncCycleSummary summary = syncOrchestrator.runCycle();
        log.info("Sync cycle {} finished with state {}", summary.cycleId(), summary.state());
        for (CollectionFetchResult collection : summary.collections()) {
            log.info(
                "Collection {}: records={}, association={}, search={}, crossCheck={}, partial={}, errors={}",
                collection.collectionId(),
                collection.records().size(),
                collection.associationTotal(),
                collection.searchTotal(),
                collection.crossCheck(),
                collection.partial(),
                collection.errors()
            );
        }

        if (properties.getRunner().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.succeeded() ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
