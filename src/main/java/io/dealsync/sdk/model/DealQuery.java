package io.dealsync.sdk.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Parameters for one page of the deal listing.
 *
 * <p>{@code limit} above {@link #MAX_LIMIT} is capped, not rejected.
 */
public class DealQuery {
    public static final int MAX_LIMIT = 100;

    private int limit = MAX_LIMIT;
    private String after;
    private PropertySelection properties = PropertySelection.defaults();
    private List<String> associations = List.of();
    private Boolean archived;

    public DealQuery() {}

    /** Copy of this query positioned at the given cursor. */
    public DealQuery withAfter(String cursor) {
        return new DealQuery()
                .setLimit(limit)
                .setAfter(cursor)
                .setProperties(properties)
                .setAssociations(associations)
                .setArchived(archived);
    }

    public int getLimit() { return limit; }
    public DealQuery setLimit(int v) {
        if (v < 1) throw new IllegalArgumentException("limit must be at least 1, got " + v);
        this.limit = Math.min(v, MAX_LIMIT);
        return this;
    }
    public String getAfter() { return after; }
    public DealQuery setAfter(String v) { this.after = v; return this; }
    public PropertySelection getProperties() { return properties; }
    public DealQuery setProperties(PropertySelection v) { this.properties = Objects.requireNonNull(v, "properties"); return this; }
    public List<String> getAssociations() { return associations; }
    public DealQuery setAssociations(List<String> v) { this.associations = v != null ? List.copyOf(v) : List.of(); return this; }
    public Boolean getArchived() { return archived; }
    public DealQuery setArchived(Boolean v) { this.archived = v; return this; }

    /** Convert to query string for URL. */
    public String toQueryString() {
        StringBuilder sb = new StringBuilder();
        appendParam(sb, "limit", String.valueOf(limit));
        appendParam(sb, "after", after);
        appendParam(sb, "properties", properties.toParameter());
        if (!associations.isEmpty()) appendParam(sb, "associations", String.join(",", associations));
        if (archived != null) appendParam(sb, "archived", String.valueOf(archived));
        return sb.toString();
    }

    private static void appendParam(StringBuilder sb, String key, String value) {
        if (value == null || value.isEmpty()) return;
        if (sb.length() > 0) sb.append('&');
        sb.append(key).append('=').append(URLEncoder.encode(value, StandardCharsets.UTF_8));
    }
}
