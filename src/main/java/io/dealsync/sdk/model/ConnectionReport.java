package io.dealsync.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Optional;

/**
 * Result of a connection test. Built once and never modified.
 *
 * <p>Serializes with the snake_case keys the extraction pipeline stores.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"token_valid", "api_reachable", "data_accessible", "account_info", "usage_info", "error"})
public final class ConnectionReport {
    private final boolean tokenValid;
    private final boolean apiReachable;
    private final boolean dataAccessible;
    private final AccountInfo accountInfo;
    private final UsageSnapshot usageInfo;
    private final String error;

    private ConnectionReport(Builder b) {
        this.tokenValid = b.tokenValid;
        this.apiReachable = b.apiReachable;
        this.dataAccessible = b.dataAccessible;
        this.accountInfo = b.accountInfo;
        this.usageInfo = b.usageInfo;
        this.error = b.error;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("token_valid")
    public boolean isTokenValid() { return tokenValid; }

    @JsonProperty("api_reachable")
    public boolean isApiReachable() { return apiReachable; }

    @JsonProperty("data_accessible")
    public boolean isDataAccessible() { return dataAccessible; }

    @JsonProperty("account_info")
    public AccountInfo getAccountInfoOrNull() { return accountInfo; }

    @JsonProperty("usage_info")
    public UsageSnapshot getUsageInfoOrNull() { return usageInfo; }

    @JsonProperty("error")
    public String getErrorOrNull() { return error; }

    @JsonIgnore
    public Optional<AccountInfo> getAccountInfo() { return Optional.ofNullable(accountInfo); }

    @JsonIgnore
    public Optional<UsageSnapshot> getUsageInfo() { return Optional.ofNullable(usageInfo); }

    @JsonIgnore
    public Optional<String> getError() { return Optional.ofNullable(error); }

    @Override
    public String toString() {
        return "ConnectionReport{tokenValid=" + tokenValid
                + ", apiReachable=" + apiReachable
                + ", dataAccessible=" + dataAccessible
                + ", accountInfo=" + (accountInfo != null)
                + ", usageInfo=" + (usageInfo != null)
                + ", error=" + error + '}';
    }

    /** Collects results while a connection test runs. */
    public static final class Builder {
        private boolean tokenValid;
        private boolean apiReachable;
        private boolean dataAccessible;
        private AccountInfo accountInfo;
        private UsageSnapshot usageInfo;
        private String error;

        private Builder() {}

        public Builder tokenValid(boolean v) { this.tokenValid = v; return this; }
        public Builder apiReachable(boolean v) { this.apiReachable = v; return this; }
        public Builder dataAccessible(boolean v) { this.dataAccessible = v; return this; }
        public Builder accountInfo(AccountInfo v) { this.accountInfo = v; return this; }
        public Builder usageInfo(UsageSnapshot v) { this.usageInfo = v; return this; }
        public Builder error(String v) { this.error = v; return this; }

        public ConnectionReport build() {
            return new ConnectionReport(this);
        }
    }
}
