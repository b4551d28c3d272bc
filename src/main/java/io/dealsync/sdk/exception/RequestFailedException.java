package io.dealsync.sdk.exception;

/**
 * Thrown when a request could not be completed: a network fault, an interrupted
 * wait, or a non-2xx status that the calling operation does not handle itself.
 */
public class RequestFailedException extends HubSpotApiException {
    public static final String CONNECTION_ERROR = "CONNECTION_ERROR";
    public static final String HTTP_ERROR = "HTTP_ERROR";
    public static final String INTERRUPTED = "INTERRUPTED";

    private final long durationMs;

    public RequestFailedException(String message, int status, long durationMs) {
        super(message, status, HTTP_ERROR);
        this.durationMs = durationMs;
    }

    public RequestFailedException(String message, Throwable cause, String code, long durationMs) {
        super(message, cause, 0, code);
        this.durationMs = durationMs;
    }

    /** Elapsed time from the first send until the failure, including any backoff. */
    public long getDurationMs() { return durationMs; }

    /** True when a response status is known, false for transport-level faults. */
    public boolean hasStatus() { return getStatus() > 0; }
}
