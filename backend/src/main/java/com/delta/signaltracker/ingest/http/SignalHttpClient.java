package com.delta.signaltracker.ingest.http;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
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
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Single-attempt HTTP transport shared by plugins and the remote embedding engine.
 * Failures come back as {@link HttpFetchResult} error codes, never as exceptions; callers
 * decide what a failure means for their source. Admission control lives in the rate
 * limiters, not here.
 */
@Service
public class SignalHttpClient {
    private final IngestionProperties properties;
    private final HttpClient client;

    public SignalHttpClient(
        IngestionProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Map.of());
    }

    public HttpFetchResult get(String url, String acceptHeader, Map<String, String> headers) {
        return send(url, "GET", acceptHeader, null, headers, null);
    }

    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader, Map<String, String> headers) {
        return send(url, "POST", acceptHeader, jsonBody == null ? "" : jsonBody, headers, null);
    }

    public HttpFetchResult postJson(
        String url,
        String jsonBody,
        String acceptHeader,
        Map<String, String> headers,
        Duration timeout
    ) {
        return send(url, "POST", acceptHeader, jsonBody == null ? "" : jsonBody, headers, timeout);
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        Map<String, String> headers,
        Duration timeout
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        Duration requestTimeout = timeout == null ? Duration.ofSeconds(properties.getRequestTimeoutSeconds()) : timeout;
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("User-Agent", IngestionProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8");
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    builder.setHeader(name, value);
                }
            });
        }
        HttpRequest request;
        if ("POST".equalsIgnoreCase(method)) {
            request = builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                .build();
        } else {
            request = builder.GET().build();
        }

        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                parseRetryAfter(response.headers().firstValue("Retry-After").orElse(null)),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException ignored) {
            // HTTP-date form is not used by the providers we call.
            return null;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
