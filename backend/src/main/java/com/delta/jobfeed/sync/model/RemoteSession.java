package com.delta.jobfeed.sync.model;

import java.time.Instant;

public record RemoteSession(
    String restToken,
    String restUrl,
    Instant issuedAt
) {
    public String endpoint(String path) {
        String base = restUrl.endsWith("/") ? restUrl : restUrl + "/";
        return base + (path.startsWith("/") ? path.substring(1) : path);
    }
}
