package io.dealsync.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;

/**
 * Base URL plus the bearer credential applied to every outgoing request.
 *
 * <p>{@link #setToken(Credential)} overwrites the session credential for all later
 * calls (last write wins). Requests built with an explicit credential carry that
 * credential regardless of what the session holds, so callers sharing a session can
 * still pin the token of their own request. There is no lock; callers that need
 * isolated credentials should use separate sessions.
 */
public class AuthenticatedSession {
    private static final Logger log = LoggerFactory.getLogger(AuthenticatedSession.class);

    private final String baseUrl;
    private final String userAgent;
    private final Duration timeout;
    private volatile Credential credential;

    AuthenticatedSession(String baseUrl, String userAgent, Duration timeout, Credential credential) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.credential = credential;
    }

    public String getBaseUrl() { return baseUrl; }

    /** Replace the session credential used by subsequent calls. */
    public void setToken(Credential credential) {
        this.credential = Objects.requireNonNull(credential, "credential");
        log.atDebug().addKeyValue("operation", "token_set").log("Access token set");
    }

    public Credential getCredential() {
        Credential current = credential;
        if (current == null) {
            throw new IllegalStateException("No access token set; pass a Credential or configure accessToken on the builder");
        }
        return current;
    }

    public boolean hasCredential() { return credential != null; }

    /**
     * Build a GET request for {@code path} (relative to the base URL) authenticated
     * with the given credential.
     */
    HttpRequest get(String path, String queryString, Credential requestCredential) {
        String uri = baseUrl + path;
        if (queryString != null && !queryString.isEmpty()) uri += "?" + queryString;
        return HttpRequest.newBuilder()
                .uri(URI.create(uri))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .header("Authorization", requestCredential.authorizationHeader())
                .GET()
                .build();
    }
}
