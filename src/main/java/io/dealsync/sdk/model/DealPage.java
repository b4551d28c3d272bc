package io.dealsync.sdk.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * One page of the deal listing.
 *
 * <p>The cursor for the following page is read from {@code paging.next.after};
 * when it is absent there are no more pages.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DealPage {
    private List<Deal> results;
    private Paging paging;

    public DealPage() {}

    public List<Deal> getResults() { return results != null ? results : List.of(); }
    public void setResults(List<Deal> results) { this.results = results; }
    public Paging getPaging() { return paging; }
    public void setPaging(Paging paging) { this.paging = paging; }

    @JsonIgnore
    public Optional<String> getNextCursor() {
        if (paging == null || paging.getNext() == null) return Optional.empty();
        String after = paging.getNext().getAfter();
        return after == null || after.isEmpty() ? Optional.empty() : Optional.of(after);
    }

    @JsonIgnore
    public boolean hasMore() {
        return getNextCursor().isPresent();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Paging {
        private NextPage next;

        public Paging() {}

        public NextPage getNext() { return next; }
        public void setNext(NextPage next) { this.next = next; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NextPage {
        private String after;
        private String link;

        public NextPage() {}

        public String getAfter() { return after; }
        public void setAfter(String after) { this.after = after; }
        public String getLink() { return link; }
        public void setLink(String link) { this.link = link; }
    }
}
