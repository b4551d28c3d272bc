package io.dealsync.sdk;

import com.fasterxml.jackson.core.type.TypeReference;
import io.dealsync.sdk.model.AccountInfo;
import io.dealsync.sdk.model.ConnectionReport;
import io.dealsync.sdk.model.DealQuery;
import io.dealsync.sdk.model.ProbeResult;
import io.dealsync.sdk.model.UsageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Best-effort connectivity checks against HubSpot.
 *
 * <p>None of these methods throw for remote or network failures. The {@code probe*}
 * methods report failures as {@link ProbeResult.Status#FAILED}; the plain variants
 * collapse them to {@code false} or empty.
 */
public class ConnectionDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(ConnectionDiagnostics.class);

    static final String ACCOUNT_INFO_PATH = "/integrations/v1/me";
    private static final String MINIMAL_QUERY = "limit=1";

    private final AuthenticatedSession session;
    private final RateLimitedExecutor executor;
    private final ResponseReader reader;
    private final DealFetcher fetcher;
    private final Clock clock;

    ConnectionDiagnostics(AuthenticatedSession session, RateLimitedExecutor executor, ResponseReader reader,
                          DealFetcher fetcher, Clock clock) {
        this.session = session;
        this.executor = executor;
        this.reader = reader;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    /**
     * Check the token with a one-item properties call. Succeeds with {@code true} on
     * HTTP 200 and {@code false} on any other status; fails on network errors.
     */
    public ProbeResult<Boolean> probeCredentials(Credential credential) {
        log.atInfo().addKeyValue("operation", "validate_credentials").log("Validating HubSpot credentials");
        try {
            session.setToken(credential);
            ApiResponse response = executor.execute("hubspot_validate_credentials",
                    session.get(DealFetcher.PROPERTIES_PATH, MINIMAL_QUERY, credential));
            boolean valid = response.getStatusCode() == 200;
            if (valid) {
                log.atInfo().addKeyValue("operation", "validate_credentials").log("Credentials validated successfully");
            } else {
                log.atWarn()
                        .addKeyValue("operation", "validate_credentials")
                        .addKeyValue("status_code", response.getStatusCode())
                        .log("Credential validation failed");
            }
            return ProbeResult.succeeded(valid);
        } catch (RuntimeException e) {
            log.atError()
                    .addKeyValue("operation", "validate_credentials")
                    .setCause(e)
                    .log("Credential validation error: {}", e.getMessage());
            return ProbeResult.failed(e);
        }
    }

    public boolean validateCredentials(Credential credential) {
        return probeCredentials(credential).toOptional().orElse(false);
    }

    /** Account details, absent when the endpoint answers anything but 200. */
    public ProbeResult<AccountInfo> probeAccountInfo(Credential credential) {
        try {
            session.setToken(credential);
            ApiResponse response = executor.execute("hubspot_get_account_info",
                    session.get(ACCOUNT_INFO_PATH, "", credential));
            if (response.getStatusCode() != 200) {
                log.atDebug()
                        .addKeyValue("operation", "get_account_info")
                        .addKeyValue("status_code", response.getStatusCode())
                        .log("Account info not available");
                return ProbeResult.absent();
            }
            AccountInfo info = reader.read(response, new TypeReference<AccountInfo>() {}, "get_account_info");
            log.atDebug()
                    .addKeyValue("operation", "get_account_info")
                    .addKeyValue("portal_id", info.getPortalId())
                    .addKeyValue("hub_domain", info.getHubDomain())
                    .log("Account info retrieved");
            return ProbeResult.succeeded(info);
        } catch (RuntimeException e) {
            log.atDebug()
                    .addKeyValue("operation", "get_account_info")
                    .log("Account info not available: {}", e.getMessage());
            return ProbeResult.failed(e);
        }
    }

    public Optional<AccountInfo> getAccountInfo(Credential credential) {
        return probeAccountInfo(credential).toOptional();
    }

    /**
     * Rate-limit headers from a one-item properties call. Absent when the call is not
     * a 200 or carries none of the {@link UsageSnapshot#HEADER_NAMES}.
     */
    public ProbeResult<UsageSnapshot> probeApiUsage(Credential credential) {
        try {
            session.setToken(credential);
            ApiResponse response = executor.execute("hubspot_get_api_usage",
                    session.get(DealFetcher.PROPERTIES_PATH, MINIMAL_QUERY, credential));
            if (response.getStatusCode() != 200) {
                return ProbeResult.absent();
            }
            Optional<UsageSnapshot> snapshot = UsageSnapshot.capture(response::header, clock.instant());
            if (snapshot.isEmpty()) {
                return ProbeResult.absent();
            }
            log.atDebug()
                    .addKeyValue("operation", "get_api_usage")
                    .addKeyValue("daily_remaining", snapshot.get().getDailyRemaining().orElse(null))
                    .addKeyValue("interval_remaining", snapshot.get().getIntervalRemaining().orElse(null))
                    .log("API usage info retrieved");
            return ProbeResult.succeeded(snapshot.get());
        } catch (RuntimeException e) {
            log.atWarn()
                    .addKeyValue("operation", "get_api_usage")
                    .log("Could not retrieve API usage: {}", e.getMessage());
            return ProbeResult.failed(e);
        }
    }

    public Optional<UsageSnapshot> getApiUsage(Credential credential) {
        return probeApiUsage(credential).toOptional();
    }

    /**
     * Validate the token and, only if it is valid, collect account info, usage and a
     * one-deal read. Each step is guarded on its own; {@code error} in the report is set
     * only when the orchestration itself fails.
     */
    public ConnectionReport testConnection(Credential credential) {
        log.atInfo().addKeyValue("operation", "test_connection").log("Testing HubSpot API connection");
        ConnectionReport.Builder report = ConnectionReport.builder();

        try {
            Objects.requireNonNull(credential, "credential");
            boolean valid = validateCredentials(credential);
            report.tokenValid(valid).apiReachable(valid);

            if (valid) {
                report.accountInfo(getAccountInfo(credential).orElse(null));
                report.usageInfo(getApiUsage(credential).orElse(null));

                try {
                    fetcher.getDeals(credential, new DealQuery().setLimit(1));
                    report.dataAccessible(true);
                    log.atInfo()
                            .addKeyValue("operation", "test_connection")
                            .addKeyValue("token_valid", true)
                            .addKeyValue("data_accessible", true)
                            .log("Connection test successful");
                } catch (RuntimeException e) {
                    log.atWarn()
                            .addKeyValue("operation", "test_connection")
                            .log("Data access test failed: {}", e.getMessage());
                }
            } else {
                log.atWarn().addKeyValue("operation", "test_connection").log("Connection test failed - invalid token");
            }
        } catch (RuntimeException e) {
            report.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.atError()
                    .addKeyValue("operation", "test_connection")
                    .setCause(e)
                    .log("Connection test error");
        }

        return report.build();
    }
}
