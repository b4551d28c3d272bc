package io.dealsync.sdk.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a best-effort diagnostic call.
 *
 * <p>Separates "the call worked but there was nothing to report" ({@link Status#ABSENT})
 * from "the call did not work" ({@link Status#FAILED}). Callers that do not care can
 * use {@link #toOptional()}.
 */
public final class ProbeResult<T> {

    public enum Status { SUCCEEDED, ABSENT, FAILED }

    private final Status status;
    private final T value;
    private final Exception error;

    private ProbeResult(Status status, T value, Exception error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> ProbeResult<T> succeeded(T value) {
        return new ProbeResult<>(Status.SUCCEEDED, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ProbeResult<T> absent() {
        return new ProbeResult<>(Status.ABSENT, null, null);
    }

    public static <T> ProbeResult<T> failed(Exception error) {
        return new ProbeResult<>(Status.FAILED, null, Objects.requireNonNull(error, "error"));
    }

    public Status getStatus() { return status; }
    public boolean isSucceeded() { return status == Status.SUCCEEDED; }
    public boolean isAbsent() { return status == Status.ABSENT; }
    public boolean isFailed() { return status == Status.FAILED; }

    public T getValue() {
        if (value == null) throw new NoSuchElementException("No value for probe with status " + status);
        return value;
    }

    public Optional<Exception> getError() { return Optional.ofNullable(error); }

    /** The value when the probe succeeded; failures and absences both collapse to empty. */
    public Optional<T> toOptional() { return Optional.ofNullable(value); }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCEEDED -> "ProbeResult[SUCCEEDED: " + value + "]";
            case ABSENT -> "ProbeResult[ABSENT]";
            case FAILED -> "ProbeResult[FAILED: " + error.getMessage() + "]";
        };
    }
}
