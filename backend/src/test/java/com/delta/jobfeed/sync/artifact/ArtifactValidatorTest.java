package com.delta.jobfeed.sync.artifact;

import com.delta.jobfeed.sync.model.ValidationReport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactValidatorTest {
    private static final Instant T0 = Instant.parse("2025-07-01T00:00:00Z");

    private final ArtifactDocumentCodec codec = new ArtifactDocumentCodec("Myticas Consulting", "https://www.myticas.com");
    private final ArtifactValidator validator = new ArtifactValidator();

    @Test
    void acceptsRenderedDocument() {
        String xml = codec.render(List.of(
            ArtifactStoreTest.entry("101", "CODE000101", "Java Developer", T0),
            ArtifactStoreTest.entry("102", "CODE000102", "Data Analyst", T0)
        ));

        ValidationReport report = validator.validate(xml, 2);

        assertThat(report.valid()).isTrue();
        assertThat(report.entryCount()).isEqualTo(2);
        assertThat(report.errors()).isEmpty();
    }

    @Test
    void rejectsTruncatedDocument() {
        String xml = codec.render(List.of(ArtifactStoreTest.entry("101", "CODE000101", "Java Developer", T0)));
        String truncated = xml.substring(0, xml.indexOf("</source>"));

        ValidationReport report = validator.validate(truncated, 1);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).anyMatch(error -> error.contains("not closed"));
    }

    @Test
    void rejectsDuplicateIdsAndCodes() {
        String xml = codec.render(List.of(
            ArtifactStoreTest.entry("101", "CODE000101", "Java Developer", T0),
            ArtifactStoreTest.entry("101", "CODE000101", "Java Developer", T0)
        ));

        ValidationReport report = validator.validate(xml, 2);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).contains("duplicate bhatsid 101", "duplicate referencenumber CODE000101");
    }

    @Test
    void rejectsMissingRequiredFieldAndCountMismatch() {
        String xml = """
            <?xml version="1.0" encoding="UTF-8"?>
            <source>
              <publisher><![CDATA[Myticas Consulting]]></publisher>
              <job>
                <title><![CDATA[Java Developer]]></title>
                <company><![CDATA[Myticas Consulting]]></company>
                <date><![CDATA[July 1, 2025]]></date>
                <referencenumber><![CDATA[CODE000101]]></referencenumber>
                <bhatsid><![CDATA[101]]></bhatsid>
                <url><![CDATA[https://apply.myticas.com/101/Java%20Developer/?source=LinkedIn]]></url>
              </job>
            </source>
            """;

        ValidationReport report = validator.validate(xml, 2);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).contains("job 1 is missing <description>", "expected 2 jobs but found 1");
    }

    @Test
    void rejectsWrongRoot() {
        ValidationReport report = validator.validate("<feed><job/></feed>", 0);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).anyMatch(error -> error.contains("root element"));
    }
}
