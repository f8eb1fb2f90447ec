package com.delta.jobfeed.sync.artifact;

import com.delta.jobfeed.sync.model.ArtifactEntry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the job feed document. Every field payload is wrapped in CDATA so descriptions keep their
 * embedded markup verbatim.
 */
public class ArtifactDocumentCodec {
    static final String ROOT = "source";
    static final String JOB = "job";
    static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    static final List<String> FIELDS = List.of(
        "title",
        "company",
        "date",
        "referencenumber",
        "bhatsid",
        "url",
        "description",
        "jobtype",
        "city",
        "state",
        "country",
        "category",
        "apply_email",
        "remotetype",
        "assignedrecruiter",
        "jobfunction",
        "jobindustries",
        "senioritylevel",
        "lastmodified"
    );

    private final String publisherName;
    private final String publisherUrl;

    public ArtifactDocumentCodec(String publisherName, String publisherUrl) {
        this.publisherName = publisherName;
        this.publisherUrl = publisherUrl;
    }

    public String render(List<ArtifactEntry> entries) {
        Document document = Jsoup.parse(XML_DECLARATION + "\n<" + ROOT + "></" + ROOT + ">", "", Parser.xmlParser());
        Element source = document.selectFirst(ROOT);
        appendField(source, "publisher", publisherName, "\n  ");
        appendField(source, "publisherurl", publisherUrl, "\n  ");
        for (ArtifactEntry entry : entries) {
            source.appendChild(new TextNode("\n  "));
            Element job = source.appendElement(JOB);
            for (Map.Entry<String, String> field : fieldValues(entry).entrySet()) {
                appendField(job, field.getKey(), field.getValue(), "\n    ");
            }
            job.appendChild(new TextNode("\n  "));
        }
        source.appendChild(new TextNode("\n"));
        return document.outerHtml() + "\n";
    }

    public static Document parseDocument(String xml) {
        return Jsoup.parse(xml == null ? "" : xml, "", Parser.xmlParser());
    }

    /**
     * Lenient read used when loading the artifact from disk; structural problems are reported by
     * {@link ArtifactValidator}, not here.
     */
    public List<ArtifactEntry> parse(String xml) {
        List<ArtifactEntry> entries = new ArrayList<>();
        Element root = rootElement(parseDocument(xml));
        if (root == null) {
            return entries;
        }
        for (Element job : root.children()) {
            if (JOB.equals(job.tagName())) {
                entries.add(toEntry(childValues(job)));
            }
        }
        return entries;
    }

    static Element rootElement(Document document) {
        for (Element child : document.children()) {
            if (ROOT.equals(child.tagName())) {
                return child;
            }
        }
        return null;
    }

    static Map<String, String> childValues(Element job) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Element field : job.children()) {
            values.putIfAbsent(field.tagName(), field.wholeText().trim());
        }
        return values;
    }

    static Map<String, String> fieldValues(ArtifactEntry entry) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("title", entry.title());
        values.put("company", entry.company());
        values.put("date", entry.date());
        values.put("referencenumber", entry.referenceCode());
        values.put("bhatsid", entry.externalId());
        values.put("url", entry.url());
        values.put("description", entry.description());
        values.put("jobtype", entry.jobType());
        values.put("city", entry.city());
        values.put("state", entry.state());
        values.put("country", entry.country());
        values.put("category", entry.category());
        values.put("apply_email", entry.applyEmail());
        values.put("remotetype", entry.remoteType());
        values.put("assignedrecruiter", entry.assignedRecruiter());
        values.put("jobfunction", entry.jobFunction());
        values.put("jobindustries", entry.jobIndustries());
        values.put("senioritylevel", entry.seniorityLevel());
        values.put("lastmodified", entry.lastModifiedAt() == null ? "" : entry.lastModifiedAt().toString());
        return values;
    }

    private ArtifactEntry toEntry(Map<String, String> values) {
        return new ArtifactEntry(
            values.getOrDefault("bhatsid", ""),
            values.getOrDefault("referencenumber", ""),
            values.getOrDefault("title", ""),
            values.getOrDefault("company", ""),
            values.getOrDefault("date", ""),
            values.getOrDefault("url", ""),
            values.getOrDefault("description", ""),
            values.getOrDefault("jobtype", ""),
            values.getOrDefault("city", ""),
            values.getOrDefault("state", ""),
            values.getOrDefault("country", ""),
            values.getOrDefault("category", ""),
            values.getOrDefault("apply_email", ""),
            values.getOrDefault("remotetype", ""),
            values.getOrDefault("assignedrecruiter", ""),
            values.getOrDefault("jobfunction", ""),
            values.getOrDefault("jobindustries", ""),
            values.getOrDefault("senioritylevel", ""),
            parseInstant(values.get("lastmodified"))
        );
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static void appendField(Element parent, String name, String value, String indent) {
        parent.appendChild(new TextNode(indent));
        Element field = parent.appendElement(name);
        String remaining = value == null ? "" : value;
        // "]]>" cannot appear inside one CDATA section; split it across two.
        int split = remaining.indexOf("]]>");
        while (split >= 0) {
            field.appendChild(new CDataNode(remaining.substring(0, split + 2)));
            remaining = remaining.substring(split + 2);
            split = remaining.indexOf("]]>");
        }
        field.appendChild(new CDataNode(remaining));
    }
}
