package io.dealsync.sdk.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Which deal properties a request asks for.
 *
 * <ul>
 *   <li>{@link #defaults()} sends the fixed default field list.</li>
 *   <li>{@link #of(Collection)} sends exactly the given names, in order.</li>
 *   <li>{@link #of(String...)} with no names sends no {@code properties} parameter,
 *       leaving the CRM to return its own minimal payload.</li>
 * </ul>
 */
public final class PropertySelection {

    /** Fields requested when the caller does not choose any. */
    public static final List<String> DEFAULT_PROPERTIES = List.of(
            "dealname", "amount", "dealstage", "pipeline", "closedate", "createdate", "hs_lastmodifieddate");

    private static final PropertySelection DEFAULTS = new PropertySelection(DEFAULT_PROPERTIES, true);
    private static final PropertySelection NONE = new PropertySelection(List.of(), false);

    private final List<String> names;
    private final boolean defaults;

    private PropertySelection(List<String> names, boolean defaults) {
        this.names = names;
        this.defaults = defaults;
    }

    public static PropertySelection defaults() {
        return DEFAULTS;
    }

    public static PropertySelection of(Collection<String> names) {
        Objects.requireNonNull(names, "names");
        if (names.isEmpty()) return NONE;
        return new PropertySelection(List.copyOf(names), false);
    }

    public static PropertySelection of(String... names) {
        return of(List.of(names));
    }

    /**
     * Selection for callers that pass a plain list: {@code null} or empty means
     * {@link #defaults()}.
     */
    public static PropertySelection orDefaults(Collection<String> names) {
        return names == null || names.isEmpty() ? DEFAULTS : of(names);
    }

    public List<String> getNames() { return names; }
    public boolean isDefaults() { return defaults; }
    public boolean isEmpty() { return names.isEmpty(); }

    /** Comma-joined names as sent on the wire, or null when nothing is sent. */
    public String toParameter() {
        return names.isEmpty() ? null : String.join(",", names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertySelection other)) return false;
        return defaults == other.defaults && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, defaults);
    }

    @Override
    public String toString() {
        return defaults ? "PropertySelection[defaults]" : "PropertySelection" + names;
    }
}
