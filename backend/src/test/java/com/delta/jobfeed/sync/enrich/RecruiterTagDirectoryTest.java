package com.delta.jobfeed.sync.enrich;

import com.delta.jobfeed.config.FeedSyncProperties;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

class RecruiterTagDirectoryTest {

    @Test
    void loadsTagsFromConfiguredFile() {
        FeedSyncProperties properties = new FeedSyncProperties();
        properties.getRecruiterTags().setPath("src/test/resources/fixtures/recruiter-tags.csv");
        RecruiterTagDirectory directory = new RecruiterTagDirectory(properties);

        directory.load();

        assertThat(directory.size()).isEqualTo(2);
        assertThat(directory.format("Rachel Mann")).isEqualTo("#LI-RM1: Rachel Mann");
        assertThat(directory.format("  adam   gebara ")).isEqualTo("#LI-AG1: adam   gebara");
        assertThat(directory.format("Myticas Recruiter")).isEqualTo("Myticas Recruiter");
    }

    @Test
    void acceptsAlternateHeaders() throws Exception {
        RecruiterTagDirectory directory = new RecruiterTagDirectory(new FeedSyncProperties());

        directory.load(new StringReader("Name,Tag\nDana Scully,LI-DS1\n"));

        assertThat(directory.format("Dana Scully")).isEqualTo("#LI-DS1: Dana Scully");
    }

    @Test
    void missingFileLeavesDirectoryEmpty() {
        FeedSyncProperties properties = new FeedSyncProperties();
        properties.getRecruiterTags().setPath("target/does-not-exist.csv");
        RecruiterTagDirectory directory = new RecruiterTagDirectory(properties);

        directory.load();

        assertThat(directory.size()).isZero();
        assertThat(directory.format("Rachel Mann")).isEqualTo("Rachel Mann");
        assertThat(directory.format(null)).isEmpty();
    }
}
