package io.dealsync.sdk;

import java.net.http.HttpHeaders;
import java.util.Optional;

/** A completed HTTP exchange as seen by callers of {@link RateLimitedExecutor}. */
public final class ApiResponse {
    private final int statusCode;
    private final String body;
    private final HttpHeaders headers;
    private final long durationMs;
    private final int attempts;

    ApiResponse(int statusCode, String body, HttpHeaders headers, long durationMs, int attempts) {
        this.statusCode = statusCode;
        this.body = body;
        this.headers = headers;
        this.durationMs = durationMs;
        this.attempts = attempts;
    }

    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public HttpHeaders getHeaders() { return headers; }
    public long getDurationMs() { return durationMs; }
    /** 1, or 2 when the first attempt was rate limited. */
    public int getAttempts() { return attempts; }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Optional<String> header(String name) {
        return headers.firstValue(name);
    }
}
