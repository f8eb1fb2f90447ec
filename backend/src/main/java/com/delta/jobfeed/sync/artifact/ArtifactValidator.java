package com.delta.jobfeed.sync.artifact;

import com.delta.jobfeed.sync.model.ValidationReport;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks run against the bytes just written: a single {@code <source>} root that is closed,
 * required fields on every job, unique job ids and reference codes, and the expected number of jobs.
 */
public class ArtifactValidator {
    static final List<String> REQUIRED_FIELDS = List.of(
        "title",
        "company",
        "date",
        "referencenumber",
        "bhatsid",
        "url",
        "description"
    );

    public ValidationReport validate(String xml, int expectedEntries) {
        List<String> errors = new ArrayList<>();
        if (xml == null || !xml.trim().endsWith("</" + ArtifactDocumentCodec.ROOT + ">")) {
            errors.add("document is not closed by </" + ArtifactDocumentCodec.ROOT + ">");
        }
        Document document = ArtifactDocumentCodec.parseDocument(xml);
        if (document.children().size() != 1) {
            errors.add("document must have exactly one root element, found " + document.children().size());
        }
        Element root = ArtifactDocumentCodec.rootElement(document);
        if (root == null) {
            errors.add("root element must be <" + ArtifactDocumentCodec.ROOT + ">");
            return ValidationReport.invalid(0, errors);
        }

        Set<String> ids = new HashSet<>();
        Set<String> codes = new HashSet<>();
        int count = 0;
        for (Element job : root.children()) {
            if (!ArtifactDocumentCodec.JOB.equals(job.tagName())) {
                continue;
            }
            count++;
            Map<String, String> values = ArtifactDocumentCodec.childValues(job);
            for (String field : REQUIRED_FIELDS) {
                if (!values.containsKey(field)) {
                    errors.add("job " + count + " is missing <" + field + ">");
                }
            }
            String id = values.getOrDefault("bhatsid", "");
            String code = values.getOrDefault("referencenumber", "");
            if (id.isBlank()) {
                errors.add("job " + count + " has a blank bhatsid");
            } else if (!ids.add(id)) {
                errors.add("duplicate bhatsid " + id);
            }
            if (code.isBlank()) {
                errors.add("job " + count + " has a blank referencenumber");
            } else if (!codes.add(code)) {
                errors.add("duplicate referencenumber " + code);
            }
        }
        if (expectedEntries >= 0 && count != expectedEntries) {
            errors.add("expected " + expectedEntries + " jobs but found " + count);
        }
        return errors.isEmpty() ? ValidationReport.ok(count) : ValidationReport.invalid(count, errors);
    }
}
