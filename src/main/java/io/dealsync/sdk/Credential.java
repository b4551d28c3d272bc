package io.dealsync.sdk;

import java.util.Objects;

/**
 * A HubSpot bearer token (private app token or OAuth access token).
 *
 * <p>Immutable. Refreshing an expired token is the caller's concern; pass the new
 * token on the next call. {@link #toString()} never reveals the token.
 */
public final class Credential {
    private final String token;

    private Credential(String token) {
        this.token = token;
    }

    public static Credential bearer(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Access token must not be blank");
        }
        return new Credential(token.strip());
    }

    public String getToken() { return token; }

    String authorizationHeader() {
        return "Bearer " + token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Credential other && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token);
    }

    @Override
    public String toString() {
        String tail = token.length() > 4 ? token.substring(token.length() - 4) : "";
        return "Credential[****" + tail + "]";
    }
}
