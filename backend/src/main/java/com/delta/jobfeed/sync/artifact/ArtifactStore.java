package com.delta.jobfeed.sync.artifact;

import com.delta.jobfeed.sync.model.ArtifactEntry;
import com.delta.jobfeed.sync.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns the job feed document. Entries are kept newest first.
 *
 * <p>Every mutation follows the same sequence: back up the file on disk, apply the change to a copy of the
 * entries, write the copy through a temporary file and an atomic move, re-read and validate what was written.
 * A failed validation restores the backup byte for byte and leaves the in-memory entries untouched.
 *
 * <p>Mutations are serialized by {@link ArtifactLock} only, so a caller waits at most the configured lock wait
 * before failing with {@link ArtifactLockTimeoutException}. Readers see the entry list published by the last
 * completed mutation.
 */
public class ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private static final Comparator<ArtifactEntry> NEWEST_FIRST = Comparator.comparing(
        ArtifactEntry::lastModifiedAt,
        Comparator.nullsLast(Comparator.<Instant>reverseOrder())
    );

    private final Path file;
    private final Path backupFile;
    private final Path checkpointFile;
    private final ArtifactDocumentCodec codec;
    private final ArtifactValidator validator;
    private final ArtifactLock lock;
    private volatile List<ArtifactEntry> entries = List.of();

    public ArtifactStore(Path file, ArtifactDocumentCodec codec, ArtifactValidator validator, ArtifactLock lock) {
        this.file = file;
        this.backupFile = file.resolveSibling(file.getFileName() + ".backup");
        this.checkpointFile = file.resolveSibling(file.getFileName() + ".checkpoint");
        this.codec = codec;
        this.validator = validator;
        this.lock = lock;
    }

    /**
     * Reads the document from disk, creating an empty one when none exists yet.
     */
    public void load() {
        lock.acquire();
        try {
            if (!Files.exists(file)) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                writeAtomically(List.of());
                log.info("Created empty job feed at {}", file);
            }
            entries = List.copyOf(codec.parse(Files.readString(file, StandardCharsets.UTF_8)));
            log.info("Loaded {} feed entries from {}", entries.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load job feed " + file, e);
        } finally {
            lock.release();
        }
    }

    /**
     * Entries as of the last completed mutation. Never blocks.
     */
    public List<ArtifactEntry> snapshot() {
        return entries;
    }

    public Optional<ArtifactEntry> find(String externalId) {
        return find(entries, externalId);
    }

    public boolean contains(String externalId) {
        return find(externalId).isPresent();
    }

    /**
     * Adds a new entry as the newest one. The id must not be present yet.
     *
     * @throws ArtifactLockTimeoutException when another mutation holds the feed longer than the lock wait
     */
    public void insertAtHead(ArtifactEntry entry) {
        withLock(() -> {
            if (find(entries, entry.externalId()).isPresent()) {
                throw new IllegalStateException("Entry " + entry.externalId() + " already exists in the feed");
            }
            mutate("insert " + entry.externalId(), working -> working.add(0, entry));
            return null;
        });
    }

    /**
     * Replaces the entry for the id and moves it to the head, keeping the reference code it already had.
     *
     * @return false when the feed has no entry for the id
     */
    public boolean updateInPlace(String externalId, ArtifactEntry entry) {
        return updateInPlace(externalId, entry, true);
    }

    /**
     * @param keepReferenceCode when false the reference code carried by {@code entry} is written instead
     */
    public boolean updateInPlace(String externalId, ArtifactEntry entry, boolean keepReferenceCode) {
        return withLock(() -> {
            Optional<ArtifactEntry> existing = find(entries, externalId);
            if (existing.isEmpty()) {
                return false;
            }
            ArtifactEntry replacement = keepReferenceCode ? entry.withReferenceCode(existing.get().referenceCode()) : entry;
            mutate("update " + externalId, working -> {
                working.removeIf(candidate -> externalId.equals(candidate.externalId()));
                working.add(0, replacement);
            });
            return true;
        });
    }

    public boolean remove(String externalId) {
        return withLock(() -> {
            if (find(entries, externalId).isEmpty()) {
                return false;
            }
            mutate("remove " + externalId, working -> working.removeIf(candidate -> externalId.equals(candidate.externalId())));
            return true;
        });
    }

    /**
     * Repair pass: where several entries share an id, keeps the most recently modified one (the earliest in
     * document order on a tie) and drops the rest.
     *
     * @return number of entries dropped
     */
    public int deduplicate() {
        int duplicates = withLock(() -> {
            List<ArtifactEntry> current = entries;
            Map<String, Integer> keep = new HashMap<>();
            for (int i = 0; i < current.size(); i++) {
                ArtifactEntry candidate = current.get(i);
                Integer keptIndex = keep.get(candidate.externalId());
                if (keptIndex == null || NEWEST_FIRST.compare(candidate, current.get(keptIndex)) < 0) {
                    keep.put(candidate.externalId(), i);
                }
            }
            int dropped = current.size() - keep.size();
            if (dropped == 0) {
                return 0;
            }
            Set<Integer> kept = new HashSet<>(keep.values());
            mutate("deduplicate", working -> {
                List<ArtifactEntry> survivors = new ArrayList<>();
                for (int i = 0; i < working.size(); i++) {
                    if (kept.contains(i)) {
                        survivors.add(working.get(i));
                    }
                }
                working.clear();
                working.addAll(survivors);
            });
            return dropped;
        });
        if (duplicates > 0) {
            log.warn("Removed {} duplicate feed entries", duplicates);
        }
        return duplicates;
    }

    /**
     * Stable sort by last modification, newest first, entries without a timestamp last.
     *
     * @return whether the order changed
     */
    public boolean sortNewestFirst() {
        return withLock(() -> {
            List<ArtifactEntry> sorted = new ArrayList<>(entries);
            sorted.sort(NEWEST_FIRST);
            if (sorted.equals(entries)) {
                return false;
            }
            mutate("sort", working -> working.sort(NEWEST_FIRST));
            return true;
        });
    }

    public byte[] currentBytes() {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read job feed " + file, e);
        }
    }

    /**
     * Copies the current document aside so a whole cycle can be undone with {@link #restoreCheckpoint()}.
     */
    public void createCheckpoint() {
        withLock(() -> {
            try {
                Files.copy(file, checkpointFile, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to checkpoint job feed " + file, e);
            }
            return null;
        });
    }

    public void restoreCheckpoint() {
        withLock(() -> {
            try {
                Files.copy(checkpointFile, file, StandardCopyOption.REPLACE_EXISTING);
                entries = List.copyOf(codec.parse(Files.readString(file, StandardCharsets.UTF_8)));
                Files.deleteIfExists(checkpointFile);
            } catch (IOException e) {
                throw new ArtifactRollbackException("Unable to restore job feed checkpoint " + checkpointFile, e);
            }
            return null;
        });
        log.warn("Job feed restored from cycle checkpoint ({} entries)", entries.size());
    }

    public void discardCheckpoint() {
        try {
            Files.deleteIfExists(checkpointFile);
        } catch (IOException e) {
            log.warn("Unable to delete job feed checkpoint {}", checkpointFile, e);
        }
    }

    private <T> T withLock(Supplier<T> action) {
        lock.acquire();
        try {
            return action.get();
        } finally {
            lock.release();
        }
    }

    /**
     * Must run while holding {@link #lock}.
     */
    private void mutate(String operation, Consumer<List<ArtifactEntry>> mutation) {
        try {
            boolean hadFile = backup();
            List<ArtifactEntry> working = new ArrayList<>(entries);
            mutation.accept(working);
            try {
                writeAtomically(working);
                ValidationReport report = validator.validate(Files.readString(file, StandardCharsets.UTF_8), working.size());
                if (!report.valid()) {
                    throw new ArtifactValidationException(operation, report.errors());
                }
            } catch (ArtifactValidationException e) {
                rollback(hadFile, operation);
                throw e;
            } catch (IOException e) {
                rollback(hadFile, operation);
                throw new UncheckedIOException(operation + " could not be written", e);
            }
            entries = List.copyOf(working);
            Files.deleteIfExists(backupFile);
        } catch (IOException e) {
            throw new UncheckedIOException(operation + " could not back up " + file, e);
        }
    }

    private static Optional<ArtifactEntry> find(List<ArtifactEntry> from, String externalId) {
        return from.stream().filter(entry -> externalId.equals(entry.externalId())).findFirst();
    }

    private boolean backup() throws IOException {
        if (!Files.exists(file)) {
            return false;
        }
        Files.copy(file, backupFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return true;
    }

    private void rollback(boolean hadFile, String operation) {
        try {
            if (hadFile) {
                Files.copy(backupFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                Files.deleteIfExists(backupFile);
            } else {
                Files.deleteIfExists(file);
            }
            log.warn("Rolled back job feed after failed {}", operation);
        } catch (IOException e) {
            throw new ArtifactRollbackException("Rollback of " + operation + " failed", e);
        }
    }

    private void writeAtomically(List<ArtifactEntry> content) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(temp, codec.render(content), StandardCharsets.UTF_8);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
