package com.delta.jobfeed.sync.remote;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.http.AtsHttpClient;
import com.delta.jobfeed.sync.model.HttpFetchResult;
import com.delta.jobfeed.sync.model.RemoteSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the three-step token exchange: authorization code, access token, REST session.
 */
@Service
public class BullhornAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(BullhornAuthenticator.class);

    private final AtsHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final FeedSyncProperties properties;

    public BullhornAuthenticator(AtsHttpClient httpClient, ObjectMapper objectMapper, FeedSyncProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public RemoteSession authenticate() {
        FeedSyncProperties.Remote remote = properties.getRemote();
        requireCredentials(remote);
        String code = requestAuthorizationCode(remote);
        String accessToken = exchangeCode(remote, code);
        RemoteSession session = openRestSession(remote, accessToken);
        log.info("Authenticated against remote REST endpoint {}", session.restUrl());
        return session;
    }

    private void requireCredentials(FeedSyncProperties.Remote remote) {
        if (isBlank(remote.getClientId())
            || isBlank(remote.getClientSecret())
            || isBlank(remote.getUsername())
            || isBlank(remote.getPassword())) {
            throw new RemoteAuthException("Remote credentials are not configured");
        }
    }

    private String requestAuthorizationCode(FeedSyncProperties.Remote remote) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", remote.getClientId());
        params.put("response_type", "code");
        if (!isBlank(remote.getRedirectUri())) {
            params.put("redirect_uri", remote.getRedirectUri());
        }
        params.put("username", remote.getUsername());
        params.put("password", remote.getPassword());
        params.put("action", "Login");
        HttpFetchResult result = httpClient.get(remote.getAuthorizeUrl() + "?" + encodeParams(params), "*/*");
        if (!result.isRedirect() || result.location() == null) {
            throw new RemoteAuthException("Authorization step failed: " + result.describeFailure());
        }
        String code = queryParameter(result.location(), "code");
        if (isBlank(code)) {
            throw new RemoteAuthException("Authorization step returned no code");
        }
        return code;
    }

    private String exchangeCode(FeedSyncProperties.Remote remote, String code) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("client_id", remote.getClientId());
        form.put("client_secret", remote.getClientSecret());
        if (!isBlank(remote.getRedirectUri())) {
            form.put("redirect_uri", remote.getRedirectUri());
        }
        HttpFetchResult result = httpClient.postForm(remote.getTokenUrl(), encodeParams(form), "application/json");
        JsonNode body = readSuccessfulBody(result, "Token step");
        String accessToken = body.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new RemoteAuthException("Token step returned no access token");
        }
        return accessToken;
    }

    private RemoteSession openRestSession(FeedSyncProperties.Remote remote, String accessToken) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("version", "2.0");
        params.put("access_token", accessToken);
        HttpFetchResult result = httpClient.postForm(remote.getRestLoginUrl() + "?" + encodeParams(params), "", "application/json");
        JsonNode body = readSuccessfulBody(result, "REST login step");
        String restToken = body.path("BhRestToken").asText("");
        String restUrl = body.path("restUrl").asText("");
        if (restToken.isBlank() || restUrl.isBlank()) {
            throw new RemoteAuthException("REST login step returned no session");
        }
        return new RemoteSession(restToken, restUrl, Instant.now());
    }

    private JsonNode readSuccessfulBody(HttpFetchResult result, String step) {
        if (!result.isSuccessful() || result.body() == null) {
            throw new RemoteAuthException(step + " failed: " + result.describeFailure());
        }
        try {
            return objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new RemoteAuthException(step + " returned malformed JSON", e);
        }
    }

    static String queryParameter(String url, String name) {
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return null;
        }
        for (String pair : url.substring(queryStart + 1).split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    static String encodeParams(Map<String, String> params) {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (builder.length() > 0) {
                builder.append('&');
            }
            builder.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
        }
        return builder.toString();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
