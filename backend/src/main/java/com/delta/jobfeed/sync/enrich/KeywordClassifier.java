package com.delta.jobfeed.sync.enrich;

import com.delta.jobfeed.sync.model.Classification;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword lookup over title and description. Deterministic, used when no model-backed classifier is wired.
 */
@Service
public class KeywordClassifier implements Classifier {
    private static final Map<String, List<String>> FUNCTIONS = new LinkedHashMap<>();
    private static final Map<String, List<String>> INDUSTRIES = new LinkedHashMap<>();
    private static final Map<String, List<String>> SENIORITY = new LinkedHashMap<>();

    static {
        FUNCTIONS.put("Information Technology", List.of("developer", "engineer", "software", "devops", "cloud", "network", "data", "analyst", "architect", "sql", "java", ".net", "python"));
        FUNCTIONS.put("Project Management", List.of("project manager", "program manager", "scrum master", "pmo"));
        FUNCTIONS.put("Finance", List.of("accountant", "accounting", "financial", "finance", "payroll", "auditor"));
        FUNCTIONS.put("Engineering", List.of("mechanical", "electrical", "civil", "structural", "manufacturing engineer"));
        FUNCTIONS.put("Human Resources", List.of("recruiter", "human resources", "talent acquisition", "hr "));
        FUNCTIONS.put("Sales", List.of("sales", "account executive", "business development"));
        FUNCTIONS.put("Administrative", List.of("administrative", "assistant", "receptionist", "clerk", "coordinator"));

        INDUSTRIES.put("Banking", List.of("bank", "banking", "credit union", "lending"));
        INDUSTRIES.put("Insurance", List.of("insurance", "underwriting", "claims"));
        INDUSTRIES.put("Hospitals and Health Care", List.of("health", "hospital", "clinical", "medical", "patient"));
        INDUSTRIES.put("Government Administration", List.of("government", "federal", "public sector", "clearance"));
        INDUSTRIES.put("Manufacturing", List.of("manufacturing", "plant", "production", "assembly"));
        INDUSTRIES.put("Telecommunications", List.of("telecom", "wireless", "5g"));
        INDUSTRIES.put("IT Services and IT Consulting", List.of("software", "developer", "cloud", "it ", "technology"));

        SENIORITY.put("Executive", List.of("chief", "vp", "vice president", "director", "head of"));
        SENIORITY.put("Mid-Senior level", List.of("senior", "sr.", "sr ", "lead", "principal", "manager", "architect"));
        SENIORITY.put("Entry level", List.of("junior", "jr.", "jr ", "entry", "intern", "graduate", "associate"));
    }

    @Override
    public Classification classify(String title, String description) {
        String safeTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        String plainDescription = description == null ? "" : Jsoup.parse(description).text().toLowerCase(Locale.ROOT);
        if (safeTitle.isBlank() && plainDescription.isBlank()) {
            return Classification.failed("no title or description to classify");
        }
        String combined = safeTitle + " " + plainDescription;
        return Classification.of(
            firstMatch(FUNCTIONS, safeTitle, combined, "Information Technology"),
            firstMatch(INDUSTRIES, safeTitle, combined, "Staffing and Recruiting"),
            firstMatch(SENIORITY, safeTitle, safeTitle, "Mid-Senior level")
        );
    }

    private String firstMatch(Map<String, List<String>> table, String title, String combined, String fallback) {
        for (String source : List.of(title + " ", combined + " ")) {
            for (Map.Entry<String, List<String>> entry : table.entrySet()) {
                for (String keyword : entry.getValue()) {
                    if (source.contains(keyword)) {
                        return entry.getKey();
                    }
                }
            }
        }
        return fallback;
    }
}
