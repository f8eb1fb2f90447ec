package com.delta.jobfeed.sync.http;

import com.delta.jobfeed.config.FeedSyncProperties;
import com.delta.jobfeed.sync.model.HttpFetchResult;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Synchronous HTTP access to the applicant-tracking system. Every request uses the same fixed timeout and is
 * attempted once; redirects are returned to the caller because the authorization step reads its code from the
 * {@code Location} header. Failures never throw, they come back as an {@link HttpFetchResult} with an error code.
 */
@Service
public class AtsHttpClient {
    private final FeedSyncProperties properties;
    private final HttpClient client;

    public AtsHttpClient(FeedSyncProperties properties) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return executeOnce(url, "GET", acceptHeader, null, null);
    }

    public HttpFetchResult postForm(String url, String formBody, String acceptHeader) {
        return executeOnce(url, "POST", acceptHeader, formBody == null ? "" : formBody, "application/x-www-form-urlencoded");
    }

    private HttpFetchResult executeOnce(String url, String method, String acceptHeader, String body, String contentType) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "application/json" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", FeedSyncProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", safeAccept);
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", contentType)
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Location").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private URI normalizeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String errorCode, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            errorCode,
            message
        );
    }
}
