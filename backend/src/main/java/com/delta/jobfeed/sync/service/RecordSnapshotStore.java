package com.delta.jobfeed.sync.service;

import com.delta.jobfeed.sync.model.JobRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The record set the feed reflected at the end of the last successful cycle.
 */
public class RecordSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(RecordSnapshotStore.class);
    private static final TypeReference<List<JobRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RecordSnapshotStore(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return empty when no cycle has completed yet
     */
    public Optional<List<JobRecord>> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            List<JobRecord> records = objectMapper.convertValue(root.path("records"), RECORD_LIST);
            return Optional.of(records == null ? List.of() : records);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read previous record set " + file, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Previous record set " + file + " is malformed", e);
        }
    }

    public void save(Collection<JobRecord> records) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("captured_at", clock.instant().toString());
        root.put("total_records", records.size());
        root.set("records", objectMapper.valueToTree(new ArrayList<>(records)));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write previous record set " + file, e);
        }
        log.debug("Saved {} records as the previous set", records.size());
    }
}
