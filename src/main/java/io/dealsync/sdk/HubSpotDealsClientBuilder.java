package io.dealsync.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Builder for {@link HubSpotDealsClient}.
 *
 * <pre>{@code
 * HubSpotDealsClient client = HubSpotDealsClient.builder()
 *     .accessToken("pat-na1-...")
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public class HubSpotDealsClientBuilder {
    public static final String DEFAULT_BASE_URL = "https://api.hubapi.com";
    public static final String DEFAULT_USER_AGENT = "HubSpot-Deals-Extraction-Service/1.0";

    String baseUrl = DEFAULT_BASE_URL;
    String accessToken;
    Duration timeout = Duration.ofSeconds(30);
    Duration testDelay = Duration.ZERO;
    String userAgent = DEFAULT_USER_AGENT;
    HttpClient httpClient;
    ObjectMapper objectMapper;
    ApiCallRecorder apiCallRecorder;
    Sleeper sleeper = Sleeper.THREAD;
    Clock clock = Clock.systemUTC();

    HubSpotDealsClientBuilder() {}

    /** Set the HubSpot API base URL. */
    public HubSpotDealsClientBuilder baseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
        return this;
    }

    /** Set the initial session token, used by calls that take no {@link Credential}. */
    public HubSpotDealsClientBuilder accessToken(String accessToken) {
        this.accessToken = accessToken;
        return this;
    }

    /** Set the per-request timeout. */
    public HubSpotDealsClientBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /** Delay slept before every deal page request, to simulate a slow upstream in tests. */
    public HubSpotDealsClientBuilder testDelay(Duration testDelay) {
        this.testDelay = testDelay;
        return this;
    }

    /** Override the User-Agent header. */
    public HubSpotDealsClientBuilder userAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    /** Override the default HttpClient. */
    public HubSpotDealsClientBuilder httpClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        return this;
    }

    /** Override the default Jackson ObjectMapper. */
    public HubSpotDealsClientBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    /** Receive a record of every HTTP call. Defaults to {@link ApiCallRecorder#logging()}. */
    public HubSpotDealsClientBuilder apiCallRecorder(ApiCallRecorder apiCallRecorder) {
        this.apiCallRecorder = apiCallRecorder;
        return this;
    }

    HubSpotDealsClientBuilder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    HubSpotDealsClientBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /** Build the client. */
    public HubSpotDealsClient build() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (testDelay == null || testDelay.isNegative()) {
            throw new IllegalArgumentException("testDelay must not be negative");
        }
        return new HubSpotDealsClient(this);
    }
}
