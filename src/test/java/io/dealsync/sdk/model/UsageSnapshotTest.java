package io.dealsync.sdk.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UsageSnapshotTest {

    private static final Instant AT = Instant.parse("2024-05-05T00:00:00Z");

    @Test
    void testCaptureKeepsKnownHeadersInOrder() {
        Map<String, String> sent = Map.of(
                UsageSnapshot.SECONDLY_REMAINING, "9",
                UsageSnapshot.DAILY, "500000",
                "X-Request-Id", "abc");

        UsageSnapshot snapshot = UsageSnapshot.capture(name -> Optional.ofNullable(sent.get(name)), AT).orElseThrow();

        assertEquals(List.of(UsageSnapshot.DAILY, UsageSnapshot.SECONDLY_REMAINING), List.copyOf(snapshot.getHeaders().keySet()));
        assertEquals(AT, snapshot.getCapturedAt());
    }

    @Test
    void testCaptureWithNoKnownHeadersIsEmpty() {
        assertTrue(UsageSnapshot.capture(name -> Optional.empty(), AT).isEmpty());
    }

    @Test
    void testSevenHeaderNames() {
        assertEquals(7, UsageSnapshot.HEADER_NAMES.size());
    }

    @Test
    void testCapturedAtIsWrittenAsIsoString() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        UsageSnapshot snapshot = new UsageSnapshot(Map.of(UsageSnapshot.DAILY, "1000"), AT);

        JsonNode json = mapper.valueToTree(snapshot);

        assertEquals("2024-05-05T00:00:00Z", json.get("capturedAt").asText());
        assertTrue(json.get("capturedAt").isTextual());
        assertEquals(AT, mapper.treeToValue(json, UsageSnapshot.class).getCapturedAt());
    }
}
