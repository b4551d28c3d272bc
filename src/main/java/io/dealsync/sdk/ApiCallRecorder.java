package io.dealsync.sdk;

/**
 * Receives one record per HTTP call made by the client, for metrics or audit.
 *
 * <p>{@code statusCode} is null when no response was received.
 */
@FunctionalInterface
public interface ApiCallRecorder {

    void record(String operation, String method, Integer statusCode, long durationMs);

    /** Recorder that writes each call to the {@code io.dealsync.sdk.api} logger. */
    static ApiCallRecorder logging() {
        return LoggingApiCallRecorder.INSTANCE;
    }
}
