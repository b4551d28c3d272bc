package io.dealsync.sdk;

import io.dealsync.sdk.exception.RequestFailedException;
import io.dealsync.sdk.model.UsageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Sends one request and retries it once if HubSpot answers 429.
 *
 * <p>The wait before the retry comes from {@code X-HubSpot-RateLimit-Interval-Milliseconds}
 * ({@value #DEFAULT_RETRY_INTERVAL_MS} ms when missing or unreadable). A second 429 is
 * returned to the caller like any other response. Network faults are never retried.
 *
 * <p>Status codes are not checked here; see {@link ResponseReader#requireSuccess}.
 */
public class RateLimitedExecutor {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedExecutor.class);

    static final int TOO_MANY_REQUESTS = 429;
    static final long DEFAULT_RETRY_INTERVAL_MS = 10_000;

    private final HttpClient httpClient;
    private final Sleeper sleeper;
    private final ApiCallRecorder recorder;

    RateLimitedExecutor(HttpClient httpClient, Sleeper sleeper, ApiCallRecorder recorder) {
        this.httpClient = httpClient;
        this.sleeper = sleeper;
        this.recorder = recorder;
    }

    /**
     * Execute {@code request}, waiting and resending once on 429.
     *
     * @param operation name used in logs and call records
     * @throws RequestFailedException on a network fault or interruption
     */
    public ApiResponse execute(String operation, HttpRequest request) {
        long start = System.nanoTime();
        HttpResponse<String> response = send(operation, request, start);
        int attempts = 1;

        if (response.statusCode() == TOO_MANY_REQUESTS) {
            long waitMs = retryIntervalMs(response.headers());
            log.atWarn()
                    .addKeyValue("operation", operation)
                    .addKeyValue("status_code", TOO_MANY_REQUESTS)
                    .addKeyValue("retry_after_ms", waitMs)
                    .log("Rate limited on {}, retrying after {} ms", operation, waitMs);
            pause(operation, request, waitMs, start);
            response = send(operation, request, start);
            attempts++;
        }

        long durationMs = elapsedMs(start);
        recorder.record(operation, request.method(), response.statusCode(), durationMs);
        log.atDebug()
                .addKeyValue("operation", operation)
                .addKeyValue("status_code", response.statusCode())
                .addKeyValue("duration_ms", durationMs)
                .addKeyValue("attempts", attempts)
                .log("{} {} completed", request.method(), request.uri().getPath());
        return new ApiResponse(response.statusCode(), response.body(), response.headers(), durationMs, attempts);
    }

    /** Retry interval advertised by a 429 response, in milliseconds. */
    static long retryIntervalMs(HttpHeaders headers) {
        String value = headers.firstValue(UsageSnapshot.INTERVAL_MILLISECONDS).orElse(null);
        if (value == null) return DEFAULT_RETRY_INTERVAL_MS;
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed >= 0 ? parsed : DEFAULT_RETRY_INTERVAL_MS;
        } catch (NumberFormatException e) {
            log.atDebug().addKeyValue("header_value", value).log("Unreadable retry interval, using default");
            return DEFAULT_RETRY_INTERVAL_MS;
        }
    }

    private HttpResponse<String> send(String operation, HttpRequest request, long start) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            long durationMs = elapsedMs(start);
            recorder.record(operation, request.method(), null, durationMs);
            log.atError()
                    .addKeyValue("operation", operation)
                    .addKeyValue("duration_ms", durationMs)
                    .setCause(e)
                    .log("Request to {} failed", request.uri().getPath());
            throw new RequestFailedException(
                    operation + " failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()),
                    e, RequestFailedException.CONNECTION_ERROR, durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            long durationMs = elapsedMs(start);
            recorder.record(operation, request.method(), null, durationMs);
            throw new RequestFailedException(operation + " interrupted", e, RequestFailedException.INTERRUPTED,
                    durationMs);
        }
    }

    private void pause(String operation, HttpRequest request, long waitMs, long start) {
        try {
            sleeper.sleep(Duration.ofMillis(waitMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            long durationMs = elapsedMs(start);
            recorder.record(operation, request.method(), TOO_MANY_REQUESTS, durationMs);
            throw new RequestFailedException(operation + " interrupted while waiting to retry", e,
                    RequestFailedException.INTERRUPTED, durationMs);
        }
    }

    private static long elapsedMs(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
