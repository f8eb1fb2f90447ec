package com.delta.jobfeed.sync.artifact;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValueMapperTest {

    @Test
    void mapsEmploymentKinds() {
        assertThat(FieldValueMapper.jobType("Contract")).isEqualTo("Contract");
        assertThat(FieldValueMapper.jobType("Contract to Hire")).isEqualTo("Contract to Hire");
        assertThat(FieldValueMapper.jobType("Direct Hire")).isEqualTo("Direct Hire");
        assertThat(FieldValueMapper.jobType("Permanent")).isEqualTo("Direct Hire");
        assertThat(FieldValueMapper.jobType(null)).isEqualTo("Contract");
    }

    @Test
    void mapsWorkArrangements() {
        assertThat(FieldValueMapper.remoteType("Hybrid")).isEqualTo("Hybrid");
        assertThat(FieldValueMapper.remoteType("Off-Site")).isEqualTo("Remote");
        assertThat(FieldValueMapper.remoteType("No Preference")).isEqualTo("No Preference");
        assertThat(FieldValueMapper.remoteType("On-Site")).isEqualTo("Onsite");
        assertThat(FieldValueMapper.remoteType("")).isEqualTo("Onsite");
    }

    @Test
    void formatsDisplayDateInUtc() {
        assertThat(FieldValueMapper.displayDate(Instant.parse("2025-07-04T23:30:00Z"))).isEqualTo("July 4, 2025");
        assertThat(FieldValueMapper.displayDate(null)).isEmpty();
    }

    @Test
    void buildsApplicationUrlWithEncodedTitle() {
        assertThat(FieldValueMapper.applicationUrl("apply.myticas.com", "34085", "Senior .NET Developer (Remote)"))
            .isEqualTo("https://apply.myticas.com/34085/Senior%20.NET%20Developer%20%28Remote%29/?source=LinkedIn");
    }
}
