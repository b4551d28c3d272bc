package io.dealsync.sdk.exception;

/**
 * Base exception for all HubSpot Deals SDK errors.
 */
public class HubSpotApiException extends RuntimeException {
    private final int status;
    private final String code;

    public HubSpotApiException(String message, int status, String code) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public HubSpotApiException(String message, Throwable cause, int status, String code) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    /** HTTP status of the failed call, or 0 when no response was received. */
    public int getStatus() { return status; }
    public String getCode() { return code; }
}
