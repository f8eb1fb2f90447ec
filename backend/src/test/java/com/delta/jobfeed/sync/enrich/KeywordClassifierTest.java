package com.delta.jobfeed.sync.enrich;

import com.delta.jobfeed.sync.model.Classification;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordClassifierTest {
    private final KeywordClassifier classifier = new KeywordClassifier();

    @Test
    void classifiesFromTitleFirst() {
        Classification result = classifier.classify("Senior Java Developer", "<p>Join our banking platform team.</p>");

        assertThat(result.success()).isTrue();
        assertThat(result.jobFunction()).isEqualTo("Information Technology");
        assertThat(result.industries()).isEqualTo("IT Services and IT Consulting");
        assertThat(result.seniorityLevel()).isEqualTo("Mid-Senior level");
    }

    @Test
    void fallsBackWhenNothingMatches() {
        Classification result = classifier.classify("Forklift Operator", "Night shift.");

        assertThat(result.success()).isTrue();
        assertThat(result.jobFunction()).isEqualTo("Information Technology");
        assertThat(result.industries()).isEqualTo("Staffing and Recruiting");
        assertThat(result.seniorityLevel()).isEqualTo("Mid-Senior level");
    }

    @Test
    void readsDescriptionAsPlainText() {
        Classification result = classifier.classify("Payroll Specialist", "<div class=\"hospital\">Junior role at a <b>hospital</b></div>");

        assertThat(result.jobFunction()).isEqualTo("Finance");
        assertThat(result.industries()).isEqualTo("Hospitals and Health Care");
    }

    @Test
    void blankInputFails() {
        Classification result = classifier.classify(" ", null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isNotBlank();
    }
}
