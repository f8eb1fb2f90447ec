package com.delta.jobfeed.sync.service;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.artifact.ArtifactEntryFactory;
import com.delta.jobfeed.sync.artifact.ArtifactRollbackException;
import com.delta.jobfeed.sync.artifact.ArtifactStore;
import com.delta.jobfeed.sync.artifact.RecordMappingException;
import com.delta.jobfeed.sync.enrich.Classifier;
import com.delta.jobfeed.sync.model.ArtifactEntry;
import com.delta.jobfeed.sync.model.Classification;
import com.delta.jobfeed.sync.model.CollectionFetchResult;
import com.delta.jobfeed.sync.model.FieldChange;
import com.delta.jobfeed.sync.model.JobRecord;
import com.delta.jobfeed.sync.model.MonitoredCollection;
import com.delta.jobfeed.sync.model.MutationFailure;
import com.delta.jobfeed.sync.model.ReconciliationResult;
import com.delta.jobfeed.sync.model.ReconciliationSummary;
import com.delta.jobfeed.sync.model.SyncCycleState;
import com.delta.jobfeed.sync.model.SyncCycleSummary;
import com.delta.jobfeed.sync.publish.Notifier;
import com.delta.jobfeed.sync.publish.Transport;
import com.delta.jobfeed.sync.reconcile.ReconciliationEngine;
import com.delta.jobfeed.sync.registry.IdentifierRegistry;
import com.delta.jobfeed.sync.remote.RemoteAuthException;
import com.delta.jobfeed.sync.remote.RemoteSourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one synchronization cycle: FETCHING, RECONCILING, MUTATING, VERIFYING, then DONE or FAILED.
 *
 * <p>Cycles never overlap; a second invocation while one is running is rejected with
 * {@link ActiveSyncCycleException}. A single failed record mutation is recorded and the cycle goes on; an
 * authentication failure, a failed verification or a rollback that could not be completed ends the cycle
 * FAILED with the feed restored to the bytes it had when the cycle started.
 */
@Service
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private static final Comparator<JobRecord> OLDEST_FIRST = Comparator.comparing(
        JobRecord::lastModifiedAt,
        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())
    );

    private final RemoteSourceClient remoteSourceClient;
    private final IdentifierRegistry registry;
    private final ArtifactStore artifactStore;
    private final ReconciliationEngine reconciliationEngine;
    private final ArtifactEntryFactory entryFactory;
    private final Classifier classifier;
    private final RecordSnapshotStore snapshotStore;
    private final ReissuePolicy reissuePolicy;
    private final Notifier notifier;
    private final Transport transport;
    private final FeedSyncProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<SyncCycleState> currentState = new AtomicReference<>();

    public SyncOrchestrator(
        RemoteSourceClient remoteSourceClient,
        IdentifierRegistry registry,
        ArtifactStore artifactStore,
        ReconciliationEngine reconciliationEngine,
        ArtifactEntryFactory entryFactory,
        Classifier classifier,
        RecordSnapshotStore snapshotStore,
        ReissuePolicy reissuePolicy,
        Notifier notifier,
        Transport transport,
        FeedSyncProperties properties,
        Clock clock
    ) {
        this.remoteSourceClient = remoteSourceClient;
        this.registry = registry;
        this.artifactStore = artifactStore;
        this.reconciliationEngine = reconciliationEngine;
        this.entryFactory = entryFactory;
        this.classifier = classifier;
        this.snapshotStore = snapshotStore;
        this.reissuePolicy = reissuePolicy;
        this.notifier = notifier;
        this.transport = transport;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * State of the running cycle, or the terminal state of the last one.
     */
    public SyncCycleState currentState() {
        return currentState.get();
    }

    public SyncCycleSummary runCycle() {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveSyncCycleException("A sync cycle is already running (state " + currentState.get() + ")");
        }
        try {
            return execute();
        } finally {
            running.set(false);
        }
    }

    private SyncCycleSummary execute() {
        CycleContext cycle = new CycleContext(UUID.randomUUID().toString(), clock.instant());
        log.info("Sync cycle {} started", cycle.id);
        boolean checkpointed = false;
        try {
            transition(cycle, SyncCycleState.FETCHING);
            Map<String, JobRecord> fetched = fetchAll(cycle);

            transition(cycle, SyncCycleState.RECONCILING);
            List<JobRecord> previous = snapshotStore.load().orElseGet(() -> {
                log.info("Sync cycle {}: no previous record set, every record counts as added", cycle.id);
                return List.of();
            });
            Map<String, JobRecord> previousById = index(previous);
            Map<String, JobRecord> current = new LinkedHashMap<>(fetched);
            for (JobRecord prior : previous) {
                if (cycle.unsafeCollections.contains(prior.collectionId()) && !current.containsKey(prior.externalId())) {
                    current.put(prior.externalId(), prior);
                    cycle.carriedForward.add(prior.externalId());
                }
            }
            if (!cycle.carriedForward.isEmpty()) {
                log.warn(
                    "Sync cycle {}: removals disabled for collections {}; carried forward {}",
                    cycle.id,
                    cycle.unsafeCollections,
                    cycle.carriedForward
                );
            }
            ReconciliationResult result = reconciliationEngine.reconcile(previous, current.values());
            cycle.result = result;
            log.info(
                "Sync cycle {}: added={}, removed={}, modified={}",
                cycle.id,
                result.summary().addedCount(),
                result.summary().removedCount(),
                result.summary().modifiedCount()
            );

            transition(cycle, SyncCycleState.MUTATING);
            artifactStore.createCheckpoint();
            checkpointed = true;
            Map<String, JobRecord> committed = applyMutations(cycle, result, previousById, current);

            transition(cycle, SyncCycleState.VERIFYING);
            Set<String> tolerated = new HashSet<>(cycle.failedRemovals);
            tolerated.addAll(cycle.retainedOrphans);
            List<String> violations = verify(committed.keySet(), tolerated);
            if (!violations.isEmpty()) {
                artifactStore.restoreCheckpoint();
                return fail(cycle, "verification failed: " + String.join("; ", violations));
            }

            registry.persist();
            snapshotStore.save(committed.values());
            artifactStore.discardCheckpoint();
            transition(cycle, SyncCycleState.DONE);
            cycle.published = properties.getPublish().isEnabled() ? publish(cycle) : null;
            SyncCycleSummary summary = cycle.summary(SyncCycleState.DONE, null, clock.instant());
            log.info(
                "Sync cycle {} DONE: {} entries, {} mutation failures, {} skipped",
                cycle.id,
                committed.size(),
                cycle.mutationFailures.size(),
                cycle.skipped.size()
            );
            notifySafely(summary, true);
            return summary;
        } catch (RemoteAuthException e) {
            log.warn("Sync cycle {} authentication failed: {}", cycle.id, e.getMessage());
            return fail(cycle, "authentication failed: " + e.getMessage());
        } catch (ArtifactRollbackException e) {
            log.error("Sync cycle {} could not roll back the feed", cycle.id, e);
            return fail(cycle, "rollback failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Sync cycle {} failed in {}", cycle.id, currentState.get(), e);
            if (checkpointed) {
                try {
                    artifactStore.restoreCheckpoint();
                } catch (RuntimeException restoreFailure) {
                    log.error("Sync cycle {} could not restore the feed checkpoint", cycle.id, restoreFailure);
                    e.addSuppressed(restoreFailure);
                }
            }
            return fail(cycle, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Map<String, JobRecord> fetchAll(CycleContext cycle) {
        remoteSourceClient.invalidateSession();
        Map<String, JobRecord> fetched = new LinkedHashMap<>();
        for (MonitoredCollection collection : properties.monitoredCollections()) {
            CollectionFetchResult result = remoteSourceClient.fetchCollection(collection.id());
            cycle.collections.add(result);
            if (!result.removalSafe()) {
                cycle.unsafeCollections.add(collection.id());
            }
            for (JobRecord record : result.records()) {
                JobRecord existing = fetched.putIfAbsent(record.externalId(), record);
                if (existing != null) {
                    log.debug("Record {} already seen in collection {}; ignoring copy from {}", record.externalId(), existing.collectionId(), collection.id());
                }
            }
        }
        return fetched;
    }

    /**
     * Applies removals, updates and inserts to the feed and returns the record set the feed now reflects.
     */
    private Map<String, JobRecord> applyMutations(
        CycleContext cycle,
        ReconciliationResult result,
        Map<String, JobRecord> previousById,
        Map<String, JobRecord> current
    ) {
        try {
            cycle.duplicatesRemoved = artifactStore.deduplicate();
        } catch (ArtifactRollbackException e) {
            throw e;
        } catch (RuntimeException e) {
            recordFailure(cycle, "*", "deduplicate", e);
        }
        alignRegistryWithFeed(cycle);

        for (String id : result.removed()) {
            try {
                artifactStore.remove(id);
            } catch (ArtifactRollbackException e) {
                throw e;
            } catch (RuntimeException e) {
                recordFailure(cycle, id, "remove", e);
                cycle.failedRemovals.add(id);
            }
        }

        Set<String> failedWrites = new HashSet<>();
        for (Map.Entry<String, List<FieldChange>> modified : result.modified().entrySet()) {
            String id = modified.getKey();
            if (!applyUpdate(cycle, current.get(id), modified.getValue())) {
                failedWrites.add(id);
            }
        }

        List<JobRecord> toInsert = new ArrayList<>();
        for (JobRecord record : current.values()) {
            boolean added = result.added().contains(record.externalId());
            boolean modified = result.modified().containsKey(record.externalId());
            if (added || (!modified && !artifactStore.contains(record.externalId()))) {
                toInsert.add(record);
            }
        }
        toInsert.sort(OLDEST_FIRST);
        for (JobRecord record : toInsert) {
            if (!result.added().contains(record.externalId())) {
                log.info("Sync cycle {}: restoring missing feed entry for {}", cycle.id, record.externalId());
            }
            if (!applyInsert(cycle, record)) {
                failedWrites.add(record.externalId());
            }
        }

        if (cycle.unsafeCollections.isEmpty()) {
            sweepOrphans(cycle, current.keySet());
        } else {
            retainOrphans(cycle, current.keySet());
        }

        try {
            artifactStore.sortNewestFirst();
        } catch (ArtifactRollbackException e) {
            throw e;
        } catch (RuntimeException e) {
            recordFailure(cycle, "*", "sort", e);
        }

        Map<String, JobRecord> committed = new LinkedHashMap<>();
        for (JobRecord record : current.values()) {
            String id = record.externalId();
            if (!failedWrites.contains(id)) {
                committed.put(id, record);
            } else if (result.modified().containsKey(id) && previousById.containsKey(id) && artifactStore.contains(id)) {
                committed.put(id, previousById.get(id));
            }
        }
        for (String id : cycle.failedRemovals) {
            JobRecord prior = previousById.get(id);
            if (prior != null) {
                committed.put(id, prior);
            }
        }
        return committed;
    }

    private boolean applyUpdate(CycleContext cycle, JobRecord record, List<FieldChange> changes) {
        String id = record.externalId();
        try {
            boolean reissue = reissuePolicy.shouldReissue(id, changes);
            String code = reissue ? registry.reissue(id) : registry.lookupOrAssign(id);
            ArtifactEntry entry = entryFactory.create(record, code, classify(record), collectionFor(record));
            if (artifactStore.contains(id)) {
                artifactStore.updateInPlace(id, entry, !reissue);
            } else {
                artifactStore.insertAtHead(entry);
            }
            return true;
        } catch (RecordMappingException e) {
            log.warn("Sync cycle {}: skipping record {}: {}", cycle.id, id, e.getMessage());
            cycle.skipped.add(id);
            return false;
        } catch (ArtifactRollbackException e) {
            throw e;
        } catch (RuntimeException e) {
            recordFailure(cycle, id, "update", e);
            return false;
        }
    }

    private boolean applyInsert(CycleContext cycle, JobRecord record) {
        String id = record.externalId();
        try {
            String code = registry.lookupOrAssign(id);
            ArtifactEntry entry = entryFactory.create(record, code, classify(record), collectionFor(record));
            if (artifactStore.contains(id)) {
                // previous record set was lost; the entry already in the feed keeps its code
                artifactStore.updateInPlace(id, entry);
            } else {
                artifactStore.insertAtHead(entry);
            }
            return true;
        } catch (RecordMappingException e) {
            log.warn("Sync cycle {}: skipping record {}: {}", cycle.id, id, e.getMessage());
            cycle.skipped.add(id);
            return false;
        } catch (ArtifactRollbackException e) {
            throw e;
        } catch (RuntimeException e) {
            recordFailure(cycle, id, "insert", e);
            return false;
        }
    }

    /**
     * Codes already published in the feed win over whatever the registry holds, so a record keeps the code
     * consumers have seen even if the registry was lost or never persisted its last cycle.
     */
    private void alignRegistryWithFeed(CycleContext cycle) {
        int adopted = 0;
        for (ArtifactEntry entry : artifactStore.snapshot()) {
            if (entry.referenceCode() == null || entry.referenceCode().isBlank()) {
                continue;
            }
            if (registry.adopt(entry.externalId(), entry.referenceCode())) {
                adopted++;
            }
        }
        if (adopted > 0) {
            log.warn("Sync cycle {}: registry adopted {} reference codes from the feed", cycle.id, adopted);
        }
    }

    private void sweepOrphans(CycleContext cycle, Set<String> currentIds) {
        for (ArtifactEntry entry : artifactStore.snapshot()) {
            String id = entry.externalId();
            if (currentIds.contains(id) || cycle.failedRemovals.contains(id) || cycle.result.removed().contains(id)) {
                continue;
            }
            try {
                if (artifactStore.remove(id)) {
                    cycle.orphansRemoved.add(id);
                    log.info("Sync cycle {}: removed orphaned feed entry {}", cycle.id, id);
                }
            } catch (ArtifactRollbackException e) {
                throw e;
            } catch (RuntimeException e) {
                recordFailure(cycle, id, "remove", e);
                cycle.failedRemovals.add(id);
            }
        }
    }

    private void retainOrphans(CycleContext cycle, Set<String> currentIds) {
        for (ArtifactEntry entry : artifactStore.snapshot()) {
            String id = entry.externalId();
            if (!currentIds.contains(id) && !cycle.result.removed().contains(id)) {
                cycle.retainedOrphans.add(id);
            }
        }
        if (!cycle.retainedOrphans.isEmpty()) {
            log.warn("Sync cycle {}: orphan sweep skipped, keeping {}", cycle.id, cycle.retainedOrphans);
        }
    }

    private List<String> verify(Set<String> expectedIds, Set<String> tolerated) {
        List<String> violations = new ArrayList<>();
        List<ArtifactEntry> entries = artifactStore.snapshot();
        Set<String> seen = new HashSet<>();
        Instant previousTimestamp = null;
        boolean sawUndated = false;
        for (ArtifactEntry entry : entries) {
            String id = entry.externalId();
            if (!seen.add(id)) {
                violations.add("duplicate entry " + id);
            }
            if (!expectedIds.contains(id) && !tolerated.contains(id)) {
                violations.add("unexpected entry " + id);
            }
            Instant timestamp = entry.lastModifiedAt();
            if (timestamp == null) {
                sawUndated = true;
            } else if (sawUndated || (previousTimestamp != null && timestamp.isAfter(previousTimestamp))) {
                violations.add("entry " + id + " is out of recency order");
            } else {
                previousTimestamp = timestamp;
            }
        }
        for (String id : expectedIds) {
            if (!seen.contains(id)) {
                violations.add("missing entry " + id);
            }
        }
        return violations;
    }

    private boolean publish(CycleContext cycle) {
        try {
            boolean published = transport.publish(artifactStore.currentBytes());
            if (!published) {
                log.warn("Sync cycle {}: feed publish reported failure", cycle.id);
            }
            return published;
        } catch (RuntimeException e) {
            log.warn("Sync cycle {}: feed publish failed", cycle.id, e);
            return false;
        }
    }

    private Classification classify(JobRecord record) {
        try {
            Classification classification = classifier.classify(record.title(), record.description());
            return classification == null ? Classification.failed("no classification returned") : classification;
        } catch (RuntimeException e) {
            log.warn("Classification failed for {}", record.externalId(), e);
            return Classification.failed(e.getMessage());
        }
    }

    private MonitoredCollection collectionFor(JobRecord record) {
        for (MonitoredCollection collection : properties.monitoredCollections()) {
            if (collection.id() == record.collectionId()) {
                return collection;
            }
        }
        FeedSyncProperties.Tearsheet defaults = new FeedSyncProperties.Tearsheet();
        return new MonitoredCollection(record.collectionId(), "", defaults.getCompanyName(), defaults.getApplyDomain());
    }

    private SyncCycleSummary fail(CycleContext cycle, String reason) {
        transition(cycle, SyncCycleState.FAILED);
        SyncCycleSummary summary = cycle.summary(SyncCycleState.FAILED, reason, clock.instant());
        log.error("Sync cycle {} FAILED: {}", cycle.id, reason);
        notifySafely(summary, false);
        return summary;
    }

    private void notifySafely(SyncCycleSummary summary, boolean completed) {
        try {
            if (completed) {
                notifier.cycleCompleted(summary);
            } else {
                notifier.cycleFailed(summary);
            }
        } catch (RuntimeException e) {
            log.warn("Notifier failed for sync cycle {}", summary.cycleId(), e);
        }
    }

    private void recordFailure(CycleContext cycle, String externalId, String operation, RuntimeException e) {
        log.warn("Sync cycle {}: {} of {} failed: {}", cycle.id, operation, externalId, e.getMessage());
        cycle.mutationFailures.add(new MutationFailure(externalId, operation, e.getMessage()));
    }

    private void transition(CycleContext cycle, SyncCycleState next) {
        currentState.set(next);
        cycle.transitions.add(next);
        log.debug("Sync cycle {} -> {}", cycle.id, next);
    }

    private Map<String, JobRecord> index(List<JobRecord> records) {
        Map<String, JobRecord> byId = new LinkedHashMap<>();
        for (JobRecord record : records) {
            byId.putIfAbsent(record.externalId(), record);
        }
        return byId;
    }

    private static final class CycleContext {
        private final String id;
        private final Instant startedAt;
        private final List<SyncCycleState> transitions = new ArrayList<>();
        private final List<CollectionFetchResult> collections = new ArrayList<>();
        private final Set<Long> unsafeCollections = new LinkedHashSet<>();
        private final Set<String> carriedForward = new LinkedHashSet<>();
        private final List<MutationFailure> mutationFailures = new ArrayList<>();
        private final Set<String> failedRemovals = new LinkedHashSet<>();
        private final Set<String> skipped = new LinkedHashSet<>();
        private final Set<String> orphansRemoved = new LinkedHashSet<>();
        private final Set<String> retainedOrphans = new LinkedHashSet<>();
        private ReconciliationResult result;
        private int duplicatesRemoved;
        private Boolean published;

        private CycleContext(String id, Instant startedAt) {
            this.id = id;
            this.startedAt = startedAt;
        }

        /**
         * The reconciliation result with swept orphans counted as removals.
         */
        private ReconciliationResult reportedResult() {
            if (result == null || orphansRemoved.isEmpty()) {
                return result;
            }
            Set<String> removed = new LinkedHashSet<>(result.removed());
            removed.addAll(orphansRemoved);
            ReconciliationSummary counts = result.summary();
            return new ReconciliationResult(
                result.added(),
                removed,
                result.modified(),
                new ReconciliationSummary(
                    counts.previousCount(),
                    counts.currentCount(),
                    counts.addedCount(),
                    removed.size(),
                    counts.modifiedCount()
                )
            );
        }

        private SyncCycleSummary summary(SyncCycleState state, String reason, Instant finishedAt) {
            return new SyncCycleSummary(
                id,
                startedAt,
                finishedAt,
                state,
                reason,
                reportedResult(),
                List.copyOf(collections),
                List.copyOf(mutationFailures),
                Set.copyOf(skipped),
                Set.copyOf(carriedForward),
                Set.copyOf(orphansRemoved),
                duplicatesRemoved,
                List.copyOf(transitions),
                published
            );
        }
    }
}
