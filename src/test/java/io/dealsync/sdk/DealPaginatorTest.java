package io.dealsync.sdk;

import io.dealsync.sdk.exception.RequestFailedException;
import io.dealsync.sdk.model.Deal;
import io.dealsync.sdk.model.DealPage;
import io.dealsync.sdk.model.DealQuery;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class DealPaginatorTest {

    private static final Credential TOKEN = Credential.bearer("pat-pages");

    private MockWebServer server;
    private HubSpotDealsClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = HubSpotDealsClient.builder()
                .baseUrl(server.url("/").toString())
                .sleeper(d -> {})
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    private void enqueuePage(String cursor, String... ids) {
        StringBuilder body = new StringBuilder("{\"results\":[");
        for (int i = 0; i < ids.length; i++) {
            if (i > 0) body.append(',');
            body.append("{\"id\":\"").append(ids[i]).append("\",\"properties\":{}}");
        }
        body.append(']');
        if (cursor != null) {
            body.append(",\"paging\":{\"next\":{\"after\":\"").append(cursor).append("\"}}");
        }
        body.append('}');
        server.enqueue(new MockResponse().setBody(body.toString()).setHeader("Content-Type", "application/json"));
    }

    private static List<String> ids(List<Deal> deals) {
        List<String> ids = new ArrayList<>();
        for (Deal deal : deals) ids.add(deal.getId());
        return ids;
    }

    @Test
    void testExternallyDrivenLoopStopsWhenCursorIsGone() throws Exception {
        enqueuePage("c1", "1", "2");
        enqueuePage(null, "3");

        List<Deal> all = new ArrayList<>();
        String cursor = null;
        int calls = 0;
        do {
            DealPage page = client.getDeals(TOKEN, new DealQuery().setAfter(cursor));
            calls++;
            all.addAll(page.getResults());
            cursor = page.getNextCursor().orElse(null);
        } while (cursor != null);

        assertEquals(2, calls);
        assertEquals(List.of("1", "2", "3"), ids(all));
        assertNull(server.takeRequest().getRequestUrl().queryParameter("after"));
        assertEquals("c1", server.takeRequest().getRequestUrl().queryParameter("after"));
    }

    @Test
    void testPaginatorFollowsCursor() throws Exception {
        enqueuePage("c1", "1", "2");
        enqueuePage(null, "3");

        DealPaginator pages = client.paginate(TOKEN, new DealQuery().setLimit(2));
        List<Deal> all = new ArrayList<>();
        while (pages.hasNext()) {
            all.addAll(pages.next().getResults());
        }

        assertEquals(2, pages.getPagesFetched());
        assertEquals(List.of("1", "2", "3"), ids(all));
        assertEquals(2, server.getRequestCount());
        assertNull(pages.getCursor());
        assertThrows(NoSuchElementException.class, pages::next);

        assertEquals("2", server.takeRequest().getRequestUrl().queryParameter("limit"));
        assertEquals("c1", server.takeRequest().getRequestUrl().queryParameter("after"));
    }

    @Test
    void testPaginatorSingleEmptyPage() {
        enqueuePage(null);

        DealPaginator pages = client.paginate(TOKEN, new DealQuery());

        assertTrue(pages.hasNext());
        assertTrue(pages.next().getResults().isEmpty());
        assertFalse(pages.hasNext());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void testPaginatorResumesFromQueryCursor() throws Exception {
        enqueuePage(null, "9");

        DealPaginator pages = client.paginate(TOKEN, new DealQuery().setAfter("resume-here"));
        pages.next();

        assertEquals("resume-here", server.takeRequest().getRequestUrl().queryParameter("after"));
    }

    @Test
    void testPaginatorPropagatesFailures() {
        enqueuePage("c1", "1");
        server.enqueue(new MockResponse().setResponseCode(502));

        DealPaginator pages = client.paginate(TOKEN, new DealQuery());
        pages.next();

        assertThrows(RequestFailedException.class, pages::next);
        assertTrue(pages.hasNext());
        assertEquals("c1", pages.getCursor());
    }
}
