package com.delta.jobfeed.sync.reconcile;

import com.delta.jobfeed.sync.model.FieldChange;
import com.delta.jobfeed.sync.model.JobRecord;
import com.delta.jobfeed.sync.model.ReconciliationResult;
import com.delta.jobfeed.sync.model.RecordLocation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationEngineTest {
    private final ReconciliationEngine engine = new ReconciliationEngine();

    @Test
    void detectsAddedAndRemovedIds() {
        ReconciliationResult result = engine.reconcile(
            List.of(record("101", "Java Developer"), record("102", "Data Analyst")),
            List.of(record("102", "Data Analyst"), record("103", "QA Lead"))
        );

        assertThat(result.added()).containsExactly("103");
        assertThat(result.removed()).containsExactly("101");
        assertThat(result.modified()).isEmpty();
        assertThat(result.summary().previousCount()).isEqualTo(2);
        assertThat(result.summary().currentCount()).isEqualTo(2);
        assertThat(result.summary().netChange()).isZero();
        assertThat(result.hasChanges()).isTrue();
    }

    @Test
    void reportsOnlyChangedMaterialFields() {
        JobRecord before = record("101", "Java Developer");
        JobRecord after = record("101", "Senior Java Developer");

        ReconciliationResult result = engine.reconcile(List.of(before), List.of(after));

        assertThat(result.added()).isEmpty();
        assertThat(result.removed()).isEmpty();
        assertThat(result.modified()).containsOnlyKeys("101");
        assertThat(result.modified().get("101"))
            .containsExactly(new FieldChange("title", "Java Developer", "Senior Java Developer"));
    }

    @Test
    void sameInputHasNoChanges() {
        List<JobRecord> records = List.of(record("101", "Java Developer"), record("102", "Data Analyst"));

        ReconciliationResult result = engine.reconcile(records, records);

        assertThat(result.hasChanges()).isFalse();
        assertThat(result.summary().modifiedCount()).isZero();
    }

    @Test
    void ignoresNonMaterialFieldsAndSurroundingWhitespace() {
        JobRecord before = record("101", "Java Developer");
        JobRecord after = new JobRecord(
            "101",
            "  Java Developer ",
            before.description(),
            before.location(),
            before.employmentKind(),
            before.workArrangement(),
            before.assignedOwnerName(),
            before.lastModifiedAt().plusSeconds(3600),
            before.dateAdded(),
            "Open",
            before.active(),
            1264
        );

        assertThat(engine.diff(before, after)).isEmpty();
    }

    @Test
    void emptyPreviousMakesEverythingAdded() {
        ReconciliationResult result = engine.reconcile(List.of(), List.of(record("101", "Java Developer")));

        assertThat(result.added()).containsExactly("101");
        assertThat(result.summary().netChange()).isEqualTo(1);
    }

    private JobRecord record(String id, String title) {
        return new JobRecord(
            id,
            title,
            "<p>" + title + "</p>",
            new RecordLocation("Chicago", "IL", "United States"),
            "Contract",
            "Remote",
            "Rachel Mann",
            Instant.parse("2025-07-01T10:00:00Z"),
            Instant.parse("2025-06-01T10:00:00Z"),
            "Accepting Candidates",
            true,
            1256
        );
    }
}
