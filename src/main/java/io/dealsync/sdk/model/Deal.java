package io.dealsync.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A HubSpot deal.
 *
 * <p>Property values are kept as {@link JsonNode} exactly as the CRM returned them;
 * there is no local schema. HubSpot sends most values as strings (amounts and dates
 * included), so {@link #getPropertyAsText(String)} covers the common case.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Deal {
    private String id;
    private Map<String, JsonNode> properties;
    private Instant createdAt;
    private Instant updatedAt;
    private boolean archived;
    private Map<String, AssociationList> associations;

    public Deal() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Map<String, JsonNode> getProperties() { return properties != null ? properties : Collections.emptyMap(); }
    public void setProperties(Map<String, JsonNode> properties) { this.properties = properties; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public boolean isArchived() { return archived; }
    public void setArchived(boolean archived) { this.archived = archived; }
    public Map<String, AssociationList> getAssociations() { return associations != null ? associations : Collections.emptyMap(); }
    public void setAssociations(Map<String, AssociationList> associations) { this.associations = associations; }

    /** Raw value of a property; empty when the property was not returned. JSON null is returned as-is. */
    public Optional<JsonNode> getProperty(String name) {
        return Optional.ofNullable(getProperties().get(name));
    }

    /** Text value of a property, or empty when it is missing or JSON null. */
    public Optional<String> getPropertyAsText(String name) {
        JsonNode node = getProperties().get(name);
        if (node == null || node.isNull() || node.isContainerNode()) return Optional.empty();
        return Optional.of(node.asText());
    }

    /** Ids of the objects associated through the given relation, in received order. */
    public List<String> getAssociatedIds(String relation) {
        AssociationList list = getAssociations().get(relation);
        if (list == null) return List.of();
        return list.getResults().stream().map(AssociationRef::getId).toList();
    }

    /** Associations of one relation type, e.g. {@code contacts}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssociationList {
        private List<AssociationRef> results;

        public AssociationList() {}

        public List<AssociationRef> getResults() { return results != null ? results : List.of(); }
        public void setResults(List<AssociationRef> results) { this.results = results; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssociationRef {
        private String id;
        private String type;

        public AssociationRef() {}

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }
}
