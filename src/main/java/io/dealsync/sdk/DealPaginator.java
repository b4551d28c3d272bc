package io.dealsync.sdk;

import io.dealsync.sdk.model.DealPage;
import io.dealsync.sdk.model.DealQuery;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Walks the deal listing page by page, following {@code paging.next.after}.
 *
 * <p>The first call uses the query's own cursor (normally none); iteration stops after the first page
 * that carries no cursor. There is no page limit, so a caller worried about a
 * cursor that never ends must stop iterating itself. Each {@link #next()} issues one
 * request and may throw what {@link DealFetcher#getDeals(Credential, DealQuery)} throws.
 */
public class DealPaginator implements Iterator<DealPage> {
    private final DealFetcher fetcher;
    private final Credential credential;
    private final DealQuery query;

    private String cursor;
    private boolean done;
    private int pagesFetched;

    DealPaginator(DealFetcher fetcher, Credential credential, DealQuery query) {
        this.fetcher = fetcher;
        this.credential = credential;
        this.query = query;
        this.cursor = query.getAfter();
    }

    @Override
    public boolean hasNext() {
        return !done;
    }

    @Override
    public DealPage next() {
        if (done) throw new NoSuchElementException("No more deal pages");
        DealPage page = fetcher.getDeals(credential, query.withAfter(cursor));
        pagesFetched++;
        cursor = page.getNextCursor().orElse(null);
        done = cursor == null;
        return page;
    }

    public int getPagesFetched() { return pagesFetched; }

    /** Cursor that the next call will send; null once the last page has been read. */
    public String getCursor() { return cursor; }
}
