package io.dealsync.sdk.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema entry for one deal property exposed by the CRM.
 *
 * <p>Fields without a typed getter (e.g. {@code modificationMetadata}, {@code hasUniqueValue})
 * are kept in {@link #getAdditionalFields()} and written back out on serialization.
 */
public class DealProperty {
    private String name;
    private String label;
    private String type;
    private String fieldType;
    private String groupName;
    private String description;
    private boolean calculated;
    private boolean hubspotDefined;
    private boolean hidden;
    private Integer displayOrder;
    private boolean formField;
    private List<Option> options;
    private final Map<String, JsonNode> additionalFields = new LinkedHashMap<>();

    public DealProperty() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getFieldType() { return fieldType; }
    public void setFieldType(String fieldType) { this.fieldType = fieldType; }
    public String getGroupName() { return groupName; }
    public void setGroupName(String groupName) { this.groupName = groupName; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public boolean isCalculated() { return calculated; }
    public void setCalculated(boolean calculated) { this.calculated = calculated; }
    public boolean isHubspotDefined() { return hubspotDefined; }
    public void setHubspotDefined(boolean hubspotDefined) { this.hubspotDefined = hubspotDefined; }
    public boolean isHidden() { return hidden; }
    public void setHidden(boolean hidden) { this.hidden = hidden; }
    public Integer getDisplayOrder() { return displayOrder; }
    public void setDisplayOrder(Integer displayOrder) { this.displayOrder = displayOrder; }
    public boolean isFormField() { return formField; }
    public void setFormField(boolean formField) { this.formField = formField; }
    /** Allowed values of an enumeration property such as {@code dealstage}; empty for other types. */
    public List<Option> getOptions() { return options != null ? options : List.of(); }
    public void setOptions(List<Option> options) { this.options = options; }

    @JsonAnySetter
    public void setAdditionalField(String name, JsonNode value) {
        additionalFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getAdditionalFields() {
        return Collections.unmodifiableMap(additionalFields);
    }

    /** One allowed value of an enumeration property. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Option {
        private String label;
        private String value;
        private Integer displayOrder;
        private boolean hidden;
        private String description;

        public Option() {}

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
        public String getValue() { return value; }
        public void setValue(String value) { this.value = value; }
        public Integer getDisplayOrder() { return displayOrder; }
        public void setDisplayOrder(Integer displayOrder) { this.displayOrder = displayOrder; }
        public boolean isHidden() { return hidden; }
        public void setHidden(boolean hidden) { this.hidden = hidden; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }
}
