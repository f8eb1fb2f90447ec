package com.delta.jobfeed.sync.artifact;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class FieldValueMapper {
    public static final String CONTRACT = "Contract";
    public static final String CONTRACT_TO_HIRE = "Contract to Hire";
    public static final String DIRECT_HIRE = "Direct Hire";
    public static final String REMOTE = "Remote";
    public static final String HYBRID = "Hybrid";
    public static final String ONSITE = "Onsite";
    public static final String NO_PREFERENCE = "No Preference";

    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US)
        .withZone(ZoneOffset.UTC);

    private FieldValueMapper() {
    }

    public static String jobType(String employmentKind) {
        String value = normalize(employmentKind);
        if (value.contains("contract to hire") || value.contains("contract-to-hire") || value.contains("c2h")
            || value.contains("temp to perm")) {
            return CONTRACT_TO_HIRE;
        }
        if (value.contains("direct") || value.contains("perm") || value.contains("full-time") || value.contains("full time")) {
            return DIRECT_HIRE;
        }
        return CONTRACT;
    }

    public static String remoteType(String workArrangement) {
        String value = normalize(workArrangement);
        if (value.contains("hybrid")) {
            return HYBRID;
        }
        if (value.contains("no preference")) {
            return NO_PREFERENCE;
        }
        if (value.contains("remote") || value.contains("off-site") || value.contains("offsite")) {
            return REMOTE;
        }
        return ONSITE;
    }

    public static String displayDate(Instant instant) {
        return instant == null ? "" : DISPLAY_DATE.format(instant);
    }

    public static String applicationUrl(String applyDomain, String externalId, String title) {
        String slug = URLEncoder.encode(title == null ? "" : title.trim(), StandardCharsets.UTF_8).replace("+", "%20");
        return "https://" + applyDomain + "/" + externalId + "/" + slug + "/?source=LinkedIn";
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
