package com.delta.jobfeed.sync.remote;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.model.JobRecord;
import com.delta.jobfeed.sync.model.RecordLocation;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts one job order returned by either query surface into a {@link JobRecord}.
 *
 * <p>Missing values fall back to fixed defaults: text fields become empty, timestamps become {@code null},
 * a missing {@code isOpen} counts as open, a missing {@code isDeleted} as not deleted and a missing
 * {@code status} as not accepting candidates. Only a missing {@code id} drops the item.
 */
@Component
public class JobRecordMapper {
    private final Set<String> acceptingStatuses = new LinkedHashSet<>();

    public JobRecordMapper(FeedSyncProperties properties) {
        for (String status : properties.getRemote().getAcceptingStatuses()) {
            if (status != null && !status.isBlank()) {
                acceptingStatuses.add(status.trim().toLowerCase(Locale.ROOT));
            }
        }
    }

    public Optional<JobRecord> map(JsonNode node, long collectionId) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String externalId = text(node, "id");
        if (externalId == null) {
            return Optional.empty();
        }
        JsonNode address = node.path("address");
        RecordLocation location = new RecordLocation(
            text(address, "city"),
            text(address, "state"),
            firstNonBlank(text(address, "countryName"), text(address, "country"))
        );
        String status = text(node, "status");
        return Optional.of(new JobRecord(
            externalId,
            text(node, "title"),
            firstNonBlank(text(node, "publicDescription"), text(node, "description")),
            location,
            firstValue(node, "employmentType"),
            firstValue(node, "onSite"),
            ownerName(node),
            epochMillis(node, "dateLastModified"),
            epochMillis(node, "dateAdded"),
            status,
            isActive(node, status),
            collectionId
        ));
    }

    boolean isActive(JsonNode node, String status) {
        boolean open = flag(node.get("isOpen"), true);
        boolean deleted = flag(node.get("isDeleted"), false);
        boolean accepting = status != null && acceptingStatuses.contains(status.trim().toLowerCase(Locale.ROOT));
        return open && !deleted && accepting;
    }

    static String ownerName(JsonNode node) {
        JsonNode assigned = node.path("assignedUsers").path("data");
        if (assigned.isArray() && assigned.size() > 0) {
            String name = personName(assigned.get(0));
            if (name != null) {
                return name;
            }
        }
        return firstNonBlank(personName(node.get("responseUser")), personName(node.get("owner")));
    }

    private static String personName(JsonNode person) {
        if (person == null || !person.isObject()) {
            return null;
        }
        String first = text(person, "firstName");
        String last = text(person, "lastName");
        if (first == null && last == null) {
            return null;
        }
        if (first == null) {
            return last;
        }
        return last == null ? first : first + " " + last;
    }

    private static boolean flag(JsonNode value, boolean fallback) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return fallback;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asInt() != 0;
        }
        String raw = value.asText("").trim().toLowerCase(Locale.ROOT);
        if (raw.isEmpty()) {
            return fallback;
        }
        return raw.equals("true") || raw.equals("1") || raw.equals("yes") || raw.equals("open");
    }

    private static Instant epochMillis(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        String raw = value.asText("").trim();
        if (raw.matches("\\d+")) {
            return Instant.ofEpochMilli(Long.parseLong(raw));
        }
        return null;
    }

    private static String firstValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                String text = item.isNull() ? null : item.asText("").trim();
                if (text != null && !text.isEmpty()) {
                    return text;
                }
            }
            return null;
        }
        return text(node, field);
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
