package com.delta.jobfeed.sync.enrich;

import com.delta.jobfeed.config.FeedSyncProperties;
import jakarta.annotation.PostConstruct;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Recruiter name to LinkedIn hashtag lookup, loaded from an optional {@code recruiter_name,linkedin_tag} CSV.
 */
@Component
public class RecruiterTagDirectory {
    private static final Logger log = LoggerFactory.getLogger(RecruiterTagDirectory.class);

    private final FeedSyncProperties properties;
    private final Map<String, String> tagsByName = new HashMap<>();

    public RecruiterTagDirectory(FeedSyncProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void load() {
        String configured = properties.getRecruiterTags().getPath();
        if (configured == null || configured.isBlank()) {
            return;
        }
        Path path = Path.of(configured.trim());
        if (!Files.exists(path)) {
            log.warn("Recruiter tag file {} not found; recruiters are shown without tags", path);
            return;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read recruiter tag file " + path, e);
        }
        log.info("Loaded {} recruiter tags from {}", tagsByName.size(), path);
    }

    void load(Reader reader) throws IOException {
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String name = getColumn(record, "recruiter_name", "name");
                String tag = getColumn(record, "linkedin_tag", "tag");
                if (name == null || tag == null) {
                    log.warn("Recruiter tag row {} missing required fields", record.getRecordNumber());
                    continue;
                }
                tagsByName.put(key(name), tag.startsWith("#") ? tag : "#" + tag);
            }
        }
    }

    /**
     * Renders the recruiter for the feed: {@code "#LI-XX: Name"} when a tag is known, the bare name otherwise.
     */
    public String format(String recruiterName) {
        if (recruiterName == null || recruiterName.isBlank()) {
            return "";
        }
        String tag = tagsByName.get(key(recruiterName));
        return tag == null ? recruiterName.trim() : tag + ": " + recruiterName.trim();
    }

    public int size() {
        return tagsByName.size();
    }

    private String key(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header != null && header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }
}
