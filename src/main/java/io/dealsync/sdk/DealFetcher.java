package io.dealsync.sdk;

import com.fasterxml.jackson.core.type.TypeReference;
import io.dealsync.sdk.exception.RequestFailedException;
import io.dealsync.sdk.model.Deal;
import io.dealsync.sdk.model.DealPage;
import io.dealsync.sdk.model.DealProperty;
import io.dealsync.sdk.model.DealPropertyList;
import io.dealsync.sdk.model.DealQuery;
import io.dealsync.sdk.model.PropertySelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Reads deals and the deal property schema from the CRM objects API.
 *
 * <p>One call fetches one page; driving the cursor loop is left to the caller
 * (see {@link DealPaginator}).
 */
public class DealFetcher {
    private static final Logger log = LoggerFactory.getLogger(DealFetcher.class);

    static final String PROPERTIES_PATH = "/crm/v3/properties/deals";
    static final String DEALS_PATH = "/crm/v3/objects/deals";

    private final AuthenticatedSession session;
    private final RateLimitedExecutor executor;
    private final ResponseReader reader;
    private final Duration testDelay;
    private final Sleeper sleeper;

    DealFetcher(AuthenticatedSession session, RateLimitedExecutor executor, ResponseReader reader,
                Duration testDelay, Sleeper sleeper) {
        this.session = session;
        this.executor = executor;
        this.reader = reader;
        this.testDelay = testDelay;
        this.sleeper = sleeper;
    }

    /** All deal properties the portal exposes. */
    public List<DealProperty> getDealProperties(Credential credential) {
        session.setToken(credential);
        log.atInfo().addKeyValue("operation", "get_deal_properties").log("Fetching deal properties");

        ApiResponse response = executor.execute("hubspot_get_deal_properties",
                session.get(PROPERTIES_PATH, "", credential));
        reader.requireSuccess(response, "get_deal_properties");
        List<DealProperty> properties = reader.read(response, new TypeReference<DealPropertyList>() {},
                "get_deal_properties").getResults();

        log.atInfo()
                .addKeyValue("operation", "get_deal_properties")
                .addKeyValue("property_count", properties.size())
                .addKeyValue("duration_ms", response.getDurationMs())
                .log("Retrieved {} deal properties", properties.size());
        return properties;
    }

    /**
     * Fetch one page of deals.
     *
     * @throws RequestFailedException on a network fault or a non-2xx status
     */
    public DealPage getDeals(Credential credential, DealQuery query) {
        session.setToken(credential);
        if (!testDelay.isZero() && !testDelay.isNegative()) {
            log.atInfo()
                    .addKeyValue("operation", "get_deals")
                    .addKeyValue("delay_type", "test_delay")
                    .log("Test delay: sleeping for {} ms", testDelay.toMillis());
            try {
                sleeper.sleep(testDelay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RequestFailedException("get_deals interrupted during test delay", e,
                        RequestFailedException.INTERRUPTED, 0);
            }
        }

        log.atInfo()
                .addKeyValue("operation", "get_deals")
                .addKeyValue("limit", query.getLimit())
                .addKeyValue("has_cursor", query.getAfter() != null)
                .addKeyValue("properties_count", query.getProperties().isDefaults()
                        ? "default" : String.valueOf(query.getProperties().getNames().size()))
                .log("Fetching deals from HubSpot");

        ApiResponse response;
        try {
            response = executor.execute("hubspot_get_deals", session.get(DEALS_PATH, query.toQueryString(), credential));
            reader.requireSuccess(response, "get_deals");
        } catch (RequestFailedException e) {
            log.atError()
                    .addKeyValue("operation", "get_deals")
                    .addKeyValue("status_code", e.hasStatus() ? e.getStatus() : null)
                    .addKeyValue("duration_ms", e.getDurationMs())
                    .log("Error fetching deals: {}", e.getMessage());
            throw e;
        }

        DealPage page = reader.read(response, new TypeReference<DealPage>() {}, "get_deals");
        log.atInfo()
                .addKeyValue("operation", "get_deals")
                .addKeyValue("status_code", response.getStatusCode())
                .addKeyValue("duration_ms", response.getDurationMs())
                .addKeyValue("deal_count", page.getResults().size())
                .addKeyValue("has_more", page.hasMore())
                .log("Deals retrieved successfully");
        return page;
    }

    /**
     * Fetch one page of deals with list-style arguments. A null or empty
     * {@code properties} list requests the default properties.
     */
    public DealPage getDeals(Credential credential, int limit, String after,
                             List<String> properties, List<String> associations) {
        return getDeals(credential, new DealQuery()
                .setLimit(limit)
                .setAfter(after)
                .setProperties(PropertySelection.orDefaults(properties))
                .setAssociations(associations));
    }

    /**
     * Fetch a single deal. Unlike the listing, an empty selection sends no
     * {@code properties} parameter.
     *
     * @return the deal, or empty if HubSpot answers 404
     * @throws RequestFailedException on a network fault or any other non-2xx status
     */
    public Optional<Deal> getDealById(Credential credential, String dealId,
                                      PropertySelection properties, List<String> associations) {
        if (dealId == null || dealId.isBlank()) throw new IllegalArgumentException("dealId must not be blank");
        session.setToken(credential);
        StringBuilder qs = new StringBuilder();
        if (properties != null) appendParam(qs, "properties", properties.toParameter());
        if (associations != null && !associations.isEmpty()) appendParam(qs, "associations", String.join(",", associations));

        ApiResponse response;
        try {
            response = executor.execute("hubspot_get_deal_by_id",
                    session.get(DEALS_PATH + "/" + encodePathSegment(dealId), qs.toString(), credential));
        } catch (RequestFailedException e) {
            log.atError()
                    .addKeyValue("operation", "get_deal_by_id")
                    .addKeyValue("deal_id", dealId)
                    .log("Failed to get deal {}: {}", dealId, e.getMessage());
            throw e;
        }

        if (response.getStatusCode() == 404) {
            log.atWarn()
                    .addKeyValue("operation", "get_deal_by_id")
                    .addKeyValue("deal_id", dealId)
                    .log("Deal not found: {}", dealId);
            return Optional.empty();
        }
        reader.requireSuccess(response, "get_deal_by_id");
        return Optional.of(reader.read(response, new TypeReference<Deal>() {}, "get_deal_by_id"));
    }

    public Optional<Deal> getDealById(Credential credential, String dealId) {
        return getDealById(credential, dealId, null, List.of());
    }

    private static void appendParam(StringBuilder sb, String key, String value) {
        if (value == null || value.isEmpty()) return;
        if (sb.length() > 0) sb.append('&');
        sb.append(key).append('=').append(encode(value));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String encodePathSegment(String value) {
        return encode(value).replace("+", "%20");
    }
}
