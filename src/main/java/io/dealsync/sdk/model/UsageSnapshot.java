package io.dealsync.sdk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Rate-limit headers seen on one response, with the time they were captured.
 * Only headers the CRM actually sent are present.
 */
public final class UsageSnapshot {
    public static final String DAILY = "X-HubSpot-RateLimit-Daily";
    public static final String DAILY_REMAINING = "X-HubSpot-RateLimit-Daily-Remaining";
    public static final String INTERVAL_MILLISECONDS = "X-HubSpot-RateLimit-Interval-Milliseconds";
    public static final String MAX = "X-HubSpot-RateLimit-Max";
    public static final String REMAINING = "X-HubSpot-RateLimit-Remaining";
    public static final String SECONDLY = "X-HubSpot-RateLimit-Secondly";
    public static final String SECONDLY_REMAINING = "X-HubSpot-RateLimit-Secondly-Remaining";

    public static final List<String> HEADER_NAMES = List.of(
            DAILY, DAILY_REMAINING, INTERVAL_MILLISECONDS, MAX, REMAINING, SECONDLY, SECONDLY_REMAINING);

    private final Map<String, String> headers;
    private final Instant capturedAt;

    @JsonCreator
    public UsageSnapshot(@JsonProperty("headers") Map<String, String> headers,
                         @JsonProperty("capturedAt") Instant capturedAt) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
    }

    /**
     * Picks the known rate-limit headers out of a response, in {@link #HEADER_NAMES} order.
     *
     * @param lookup returns the first value of a header, or empty when absent
     * @return a snapshot, or empty when none of the headers were sent
     */
    public static Optional<UsageSnapshot> capture(Function<String, Optional<String>> lookup, Instant capturedAt) {
        Map<String, String> found = new LinkedHashMap<>();
        for (String name : HEADER_NAMES) {
            lookup.apply(name).ifPresent(value -> found.put(name, value));
        }
        if (found.isEmpty()) return Optional.empty();
        return Optional.of(new UsageSnapshot(found, capturedAt));
    }

    public Map<String, String> getHeaders() { return headers; }
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public Instant getCapturedAt() { return capturedAt; }

    public Optional<String> get(String header) {
        return Optional.ofNullable(headers.get(header));
    }

    @JsonIgnore
    public Optional<String> getDailyRemaining() { return get(DAILY_REMAINING); }
    @JsonIgnore
    public Optional<String> getIntervalRemaining() { return get(REMAINING); }

    @Override
    public String toString() {
        return "UsageSnapshot{headers=" + headers + ", capturedAt=" + capturedAt + '}';
    }
}
