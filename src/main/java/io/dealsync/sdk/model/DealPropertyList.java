package io.dealsync.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response of the deal properties endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DealPropertyList {
    private List<DealProperty> results;

    public DealPropertyList() {}

    public List<DealProperty> getResults() { return results != null ? results : List.of(); }
    public void setResults(List<DealProperty> results) { this.results = results; }
}
