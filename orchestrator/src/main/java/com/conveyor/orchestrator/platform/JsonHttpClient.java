package com.conveyor.orchestrator.platform;

import com.conveyor.orchestrator.platform.dto.RejectionResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Shared plumbing of the registry and platform clients: JSON over
 * java.net.http, one request per call, blocking.
 *
 * Both clients are called from stage attempt threads, so blocking I/O is fine
 * and an interrupt (timeout, cancellation) aborts the request.
 */
abstract class JsonHttpClient {

    protected final ObjectMapper json;

    private final HttpClient http;
    private final String     baseUrl;
    private final Duration   requestTimeout;

    protected JsonHttpClient(String baseUrl, Duration requestTimeout, ObjectMapper objectMapper) {
        this.baseUrl        = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** POST a JSON body; returns the raw response whatever its status. */
    protected HttpResponse<String> post(String path, Object body, String opName) throws InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        return send(req, opName);
    }

    /** GET; returns the raw response whatever its status. */
    protected HttpResponse<String> get(String path, String opName) throws InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(req, opName);
    }

    /**
     * 2xx → accepted, 4xx → rejected with the reason from the body, anything
     * else → {@link PlatformException}.
     */
    protected Receipt toReceipt(HttpResponse<String> resp, String opName) {
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return Receipt.ok();
        }
        if (status >= 400 && status < 500) {
            return Receipt.rejected(rejectionReason(resp));
        }
        throw new PlatformException(opName + " failed with HTTP " + status + ": " + resp.body());
    }

    protected <T> T parse(HttpResponse<String> resp, Class<T> type, String opName) {
        try {
            return json.readValue(resp.body(), type);
        } catch (JsonProcessingException e) {
            throw new PlatformException("Failed to parse " + opName + " response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> send(HttpRequest req, String opName) throws InterruptedException {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PlatformException(opName + " failed", e);
        }
    }

    private String rejectionReason(HttpResponse<String> resp) {
        String body = resp.body();
        if (body == null || body.isBlank()) {
            return "HTTP " + resp.statusCode();
        }
        try {
            RejectionResponse rejection = json.readValue(body, RejectionResponse.class);
            if (rejection.reason() != null) return rejection.reason();
        } catch (JsonProcessingException e) {
            // not JSON; fall through to the raw body
        }
        return body;
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new PlatformException("JSON serialization failed", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
