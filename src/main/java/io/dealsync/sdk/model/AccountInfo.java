package io.dealsync.sdk.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Account details returned by the account-info endpoint.
 *
 * <p>All fields are kept as received; the getters below cover the ones diagnostics care about.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class AccountInfo {
    private final Map<String, JsonNode> attributes = new LinkedHashMap<>();

    public AccountInfo() {}

    @JsonAnySetter
    public void setAttribute(String name, JsonNode value) {
        attributes.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Long getPortalId() {
        JsonNode node = attributes.get("portalId");
        return node != null && node.canConvertToLong() ? node.asLong() : null;
    }

    public String getHubDomain() { return text("hubDomain"); }
    public String getTimeZone() { return text("timeZone"); }
    public String getCompanyCurrency() { return text("companyCurrency"); }

    private String text(String name) {
        JsonNode node = attributes.get(name);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
