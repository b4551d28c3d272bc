package io.dealsync.sdk;

import io.dealsync.sdk.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Client for extracting deals from the HubSpot CRM API.
 *
 * <p>Every call is synchronous and blocks until HubSpot answers (including the single
 * wait-and-retry on 429). Operations that take a {@link Credential} authenticate that
 * request with it and also make it the session token; the no-credential overloads use
 * the session token. Use {@link #builder()} or {@link #fromEnv()} to create instances.
 *
 * <p>Implements {@link AutoCloseable} for use with try-with-resources.
 */
public class HubSpotDealsClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HubSpotDealsClient.class);

    private final AuthenticatedSession session;
    private final DealFetcher fetcher;
    private final ConnectionDiagnostics diagnostics;

    HubSpotDealsClient(HubSpotDealsClientBuilder b) {
        Credential initial = b.accessToken != null && !b.accessToken.isBlank() ? Credential.bearer(b.accessToken) : null;
        this.session = new AuthenticatedSession(b.baseUrl, b.userAgent, b.timeout, initial);

        HttpClient httpClient = b.httpClient != null ? b.httpClient : HttpClient.newBuilder()
                .connectTimeout(b.timeout)
                .build();
        ResponseReader reader = new ResponseReader(
                b.objectMapper != null ? b.objectMapper : ResponseReader.createDefaultMapper());
        ApiCallRecorder recorder = b.apiCallRecorder != null ? b.apiCallRecorder : ApiCallRecorder.logging();
        RateLimitedExecutor executor = new RateLimitedExecutor(httpClient, b.sleeper, recorder);

        this.fetcher = new DealFetcher(session, executor, reader, b.testDelay, b.sleeper);
        this.diagnostics = new ConnectionDiagnostics(session, executor, reader, fetcher, b.clock);

        log.atDebug()
                .addKeyValue("operation", "hubspot_api_service_init")
                .addKeyValue("base_url", session.getBaseUrl())
                .addKeyValue("test_delay_ms", b.testDelay.toMillis())
                .log("HubSpot API client initialized");
    }

    /** Create a new builder. */
    public static HubSpotDealsClientBuilder builder() {
        return new HubSpotDealsClientBuilder();
    }

    /**
     * Create a client from environment variables.
     * Reads {@code HUBSPOT_BASE_URL}, {@code HUBSPOT_ACCESS_TOKEN} and
     * {@code HUBSPOT_TEST_DELAY_SECONDS}.
     */
    public static HubSpotDealsClient fromEnv() {
        String url = System.getenv("HUBSPOT_BASE_URL");
        String token = System.getenv("HUBSPOT_ACCESS_TOKEN");
        String delay = System.getenv("HUBSPOT_TEST_DELAY_SECONDS");
        return builder()
                .baseUrl(url != null && !url.isBlank() ? url : HubSpotDealsClientBuilder.DEFAULT_BASE_URL)
                .accessToken(token)
                .testDelay(parseDelaySeconds(delay))
                .build();
    }

    static Duration parseDelaySeconds(String value) {
        if (value == null || value.isBlank()) return Duration.ZERO;
        try {
            double seconds = Double.parseDouble(value.trim());
            return seconds > 0 ? Duration.ofMillis(Math.round(seconds * 1000)) : Duration.ZERO;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("HUBSPOT_TEST_DELAY_SECONDS is not a number: " + value, e);
        }
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit close in Java 17
    }

    // ─── Session ───────────────────────────────────────────────

    /** Replace the session token used by the no-credential overloads. */
    public void setToken(Credential credential) {
        session.setToken(credential);
    }

    public AuthenticatedSession getSession() { return session; }
    public DealFetcher deals() { return fetcher; }
    public ConnectionDiagnostics diagnostics() { return diagnostics; }

    // ─── Deals ─────────────────────────────────────────────────

    /** Schema of every deal property HubSpot exposes. */
    public List<DealProperty> getDealProperties(Credential credential) {
        return fetcher.getDealProperties(credential);
    }

    public List<DealProperty> getDealProperties() {
        return getDealProperties(session.getCredential());
    }

    /** One page of deals. */
    public DealPage getDeals(Credential credential, DealQuery query) {
        return fetcher.getDeals(credential, query);
    }

    public DealPage getDeals(DealQuery query) {
        return getDeals(session.getCredential(), query);
    }

    /** One page of deals; a null or empty {@code properties} list requests the defaults. */
    public DealPage getDeals(Credential credential, int limit, String after,
                             List<String> properties, List<String> associations) {
        return fetcher.getDeals(credential, limit, after, properties, associations);
    }

    /** A single deal, or empty if it does not exist. */
    public Optional<Deal> getDealById(Credential credential, String dealId,
                                      PropertySelection properties, List<String> associations) {
        return fetcher.getDealById(credential, dealId, properties, associations);
    }

    public Optional<Deal> getDealById(Credential credential, String dealId) {
        return fetcher.getDealById(credential, dealId);
    }

    public Optional<Deal> getDealById(String dealId) {
        return getDealById(session.getCredential(), dealId);
    }

    /** Iterate over every page of the listing, starting at {@code query}'s cursor. */
    public DealPaginator paginate(Credential credential, DealQuery query) {
        return new DealPaginator(fetcher, credential, query);
    }

    // ─── Diagnostics ───────────────────────────────────────────

    public boolean validateCredentials(Credential credential) {
        return diagnostics.validateCredentials(credential);
    }

    public Optional<AccountInfo> getAccountInfo(Credential credential) {
        return diagnostics.getAccountInfo(credential);
    }

    public Optional<UsageSnapshot> getApiUsage(Credential credential) {
        return diagnostics.getApiUsage(credential);
    }

    /** Full connection test; never throws. */
    public ConnectionReport testConnection(Credential credential) {
        return diagnostics.testConnection(credential);
    }

    public ConnectionReport testConnection() {
        if (!session.hasCredential()) {
            return ConnectionReport.builder().error("No access token set").build();
        }
        return testConnection(session.getCredential());
    }
}
