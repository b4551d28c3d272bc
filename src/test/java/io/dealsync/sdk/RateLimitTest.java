package io.dealsync.sdk;

import io.dealsync.sdk.exception.RequestFailedException;
import io.dealsync.sdk.model.DealPage;
import io.dealsync.sdk.model.DealQuery;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitTest {

    private static final String EMPTY_PAGE = "{\"results\":[]}";
    private static final Credential TOKEN = Credential.bearer("pat-test-token");

    private MockWebServer server;
    private List<Duration> sleeps;
    private List<Integer> recordedStatuses;
    private HubSpotDealsClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        sleeps = new ArrayList<>();
        recordedStatuses = new CopyOnWriteArrayList<>();
        client = HubSpotDealsClient.builder()
                .baseUrl(server.url("/").toString())
                .sleeper(sleeps::add)
                .apiCallRecorder((operation, method, status, durationMs) -> recordedStatuses.add(status))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    @Test
    void testRetryOn429UsesIntervalHeader() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(429)
                .setHeader("X-HubSpot-RateLimit-Interval-Milliseconds", "250")
                .setBody("{\"status\":\"error\",\"message\":\"You have reached your secondly limit.\"}"));
        server.enqueue(new MockResponse().setBody(EMPTY_PAGE).setHeader("Content-Type", "application/json"));

        DealPage page = client.getDeals(TOKEN, new DealQuery().setLimit(10));

        assertTrue(page.getResults().isEmpty());
        assertEquals(2, server.getRequestCount());
        assertEquals(List.of(Duration.ofMillis(250)), sleeps);
        assertEquals(List.of(200), recordedStatuses);
    }

    @Test
    void testRetryIsIdenticalRequest() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("X-HubSpot-RateLimit-Interval-Milliseconds", "1"));
        server.enqueue(new MockResponse().setBody(EMPTY_PAGE));

        client.getDeals(TOKEN, new DealQuery().setLimit(5).setAfter("abc"));

        RecordedRequest first = server.takeRequest();
        RecordedRequest second = server.takeRequest();
        assertEquals(first.getPath(), second.getPath());
        assertEquals(first.getHeader("Authorization"), second.getHeader("Authorization"));
    }

    @Test
    void testDefaultIntervalWhenHeaderMissing() {
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setBody(EMPTY_PAGE));

        client.getDeals(TOKEN, new DealQuery());

        assertEquals(List.of(Duration.ofMillis(10_000)), sleeps);
    }

    @Test
    void testDefaultIntervalWhenHeaderUnreadable() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("X-HubSpot-RateLimit-Interval-Milliseconds", "soon"));
        server.enqueue(new MockResponse().setBody(EMPTY_PAGE));

        client.getDeals(TOKEN, new DealQuery());

        assertEquals(List.of(Duration.ofMillis(10_000)), sleeps);
    }

    @Test
    void testSecond429IsNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("X-HubSpot-RateLimit-Interval-Milliseconds", "5"));
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("X-HubSpot-RateLimit-Interval-Milliseconds", "5"));
        server.enqueue(new MockResponse().setBody(EMPTY_PAGE));

        RequestFailedException e = assertThrows(RequestFailedException.class,
                () -> client.getDeals(TOKEN, new DealQuery()));

        assertEquals(429, e.getStatus());
        assertEquals(RequestFailedException.HTTP_ERROR, e.getCode());
        assertEquals(2, server.getRequestCount());
        assertEquals(1, sleeps.size());
    }

    @Test
    void testNoRetryOn500() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"message\":\"internal error\"}"));

        RequestFailedException e = assertThrows(RequestFailedException.class,
                () -> client.getDeals(TOKEN, new DealQuery()));

        assertEquals(500, e.getStatus());
        assertTrue(e.getMessage().contains("internal error"));
        assertEquals(1, server.getRequestCount());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testNetworkFailureIsNotRetried() throws Exception {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String url = stopped.url("/").toString();
        stopped.shutdown();

        HubSpotDealsClient offline = HubSpotDealsClient.builder()
                .baseUrl(url)
                .timeout(Duration.ofSeconds(2))
                .sleeper(sleeps::add)
                .apiCallRecorder((operation, method, status, durationMs) -> recordedStatuses.add(status))
                .build();

        RequestFailedException e = assertThrows(RequestFailedException.class,
                () -> offline.getDeals(TOKEN, new DealQuery()));

        assertEquals(RequestFailedException.CONNECTION_ERROR, e.getCode());
        assertFalse(e.hasStatus());
        assertTrue(e.getDurationMs() >= 0);
        assertTrue(sleeps.isEmpty());
        assertEquals(1, recordedStatuses.size());
        assertNull(recordedStatuses.get(0));
    }

    @Test
    void testInterruptedBackoffFails() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("X-HubSpot-RateLimit-Interval-Milliseconds", "5"));

        HubSpotDealsClient interrupting = HubSpotDealsClient.builder()
                .baseUrl(server.url("/").toString())
                .sleeper(d -> { throw new InterruptedException("stop"); })
                .build();

        try {
            RequestFailedException e = assertThrows(RequestFailedException.class,
                    () -> interrupting.getDeals(TOKEN, new DealQuery()));
            assertEquals(RequestFailedException.INTERRUPTED, e.getCode());
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, server.getRequestCount());
        } finally {
            Thread.interrupted();
        }
    }
}
