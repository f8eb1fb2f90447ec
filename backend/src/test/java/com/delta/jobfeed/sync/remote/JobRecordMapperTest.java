package com.delta.jobfeed.sync.remote;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.model.JobRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JobRecordMapperTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JobRecordMapper mapper = new JobRecordMapper(new FeedSyncProperties());

    @Test
    void mapsFullJobOrder() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {
              "id": 34085,
              "title": "  Senior Java Developer ",
              "publicDescription": "<p>Build <b>things</b></p>",
              "description": "internal notes",
              "status": "Accepting Candidates",
              "isOpen": true,
              "isDeleted": false,
              "employmentType": "Contract to Hire",
              "onSite": ["Hybrid"],
              "address": {"city": "Ottawa", "state": "ON", "countryName": "Canada"},
              "assignedUsers": {"total": 1, "data": [{"firstName": "Rachel", "lastName": "Mann"}]},
              "owner": {"firstName": "Owen", "lastName": "Owner"},
              "dateAdded": 1720742400000,
              "dateLastModified": 1721000000000
            }
            """);

        JobRecord record = mapper.map(node, 1256L).orElseThrow();

        assertThat(record.externalId()).isEqualTo("34085");
        assertThat(record.title()).isEqualTo("Senior Java Developer");
        assertThat(record.description()).isEqualTo("<p>Build <b>things</b></p>");
        assertThat(record.location().city()).isEqualTo("Ottawa");
        assertThat(record.location().country()).isEqualTo("Canada");
        assertThat(record.employmentKind()).isEqualTo("Contract to Hire");
        assertThat(record.workArrangement()).isEqualTo("Hybrid");
        assertThat(record.assignedOwnerName()).isEqualTo("Rachel Mann");
        assertThat(record.dateAdded()).isEqualTo(Instant.ofEpochMilli(1720742400000L));
        assertThat(record.lastModifiedAt()).isEqualTo(Instant.ofEpochMilli(1721000000000L));
        assertThat(record.collectionId()).isEqualTo(1256L);
        assertThat(record.active()).isTrue();
    }

    @Test
    void ownerFallsBackThroughResponseUserThenOwner() throws Exception {
        JsonNode emptyAssigned = objectMapper.readTree("""
            {"id": 1, "assignedUsers": {"data": []}, "responseUser": {"firstName": "Adam"},
             "owner": {"firstName": "Owen", "lastName": "Owner"}}
            """);
        JsonNode ownerOnly = objectMapper.readTree("""
            {"id": 2, "assignedUsers": {"data": [{"firstName": " ", "lastName": null}]},
             "owner": {"firstName": "Owen", "lastName": "Owner"}}
            """);

        assertThat(mapper.map(emptyAssigned, 1L).orElseThrow().assignedOwnerName()).isEqualTo("Adam");
        assertThat(mapper.map(ownerOnly, 1L).orElseThrow().assignedOwnerName()).isEqualTo("Owen Owner");
    }

    @Test
    void missingFieldsFallBackToDefaults() throws Exception {
        JobRecord record = mapper.map(objectMapper.readTree("{\"id\": \"77\", \"status\": \"Open\"}"), 5L).orElseThrow();

        assertThat(record.title()).isEmpty();
        assertThat(record.description()).isEmpty();
        assertThat(record.location().city()).isEmpty();
        assertThat(record.assignedOwnerName()).isEmpty();
        assertThat(record.lastModifiedAt()).isNull();
        assertThat(record.active()).isTrue();
    }

    @Test
    void activeRequiresOpenNotDeletedAndAcceptingStatus() throws Exception {
        assertThat(active("{\"id\":1,\"status\":\"Accepting Candidates\",\"isOpen\":false}")).isFalse();
        assertThat(active("{\"id\":1,\"status\":\"Accepting Candidates\",\"isDeleted\":true}")).isFalse();
        assertThat(active("{\"id\":1,\"status\":\"Filled\",\"isOpen\":true}")).isFalse();
        assertThat(active("{\"id\":1,\"isOpen\":true}")).isFalse();
        assertThat(active("{\"id\":1,\"status\":\"open\",\"isOpen\":\"true\"}")).isTrue();
    }

    @Test
    void itemWithoutIdIsDropped() throws Exception {
        Optional<JobRecord> record = mapper.map(objectMapper.readTree("{\"title\":\"No id\"}"), 1L);

        assertThat(record).isEmpty();
    }

    private boolean active(String json) throws Exception {
        return mapper.map(objectMapper.readTree(json), 1L).orElseThrow().active();
    }
}
