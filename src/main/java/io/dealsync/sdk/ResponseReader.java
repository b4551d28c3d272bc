package io.dealsync.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.dealsync.sdk.exception.HubSpotApiException;
import io.dealsync.sdk.exception.RequestFailedException;

/** Status checks and JSON decoding of {@link ApiResponse} bodies. */
final class ResponseReader {
    private final ObjectMapper objectMapper;

    ResponseReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    ObjectMapper getObjectMapper() { return objectMapper; }

    /** Throw {@link RequestFailedException} unless the status is 2xx. */
    ApiResponse requireSuccess(ApiResponse response, String operation) {
        if (response.isSuccess()) return response;
        throw new RequestFailedException(
                operation + " failed with HTTP " + response.getStatusCode() + ": "
                        + errorMessage(response.getStatusCode(), response.getBody()),
                response.getStatusCode(), response.getDurationMs());
    }

    <T> T read(ApiResponse response, TypeReference<T> type, String operation) {
        String body = response.getBody();
        if (body == null || body.isEmpty()) {
            throw new HubSpotApiException(operation + " returned an empty body", response.getStatusCode(), "PARSE_ERROR");
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (Exception e) {
            throw new HubSpotApiException("Failed to parse " + operation + " response: " + e.getMessage(), e,
                    response.getStatusCode(), "PARSE_ERROR");
        }
    }

    /** HubSpot error bodies look like {@code {"status":"error","message":"...","category":"..."}}. */
    String errorMessage(int status, String body) {
        if (body == null || body.isEmpty()) return "HTTP " + status;
        String raw = body.length() > 500 ? body.substring(0, 500) + "..." : body;
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return raw;
        }
        if (node.hasNonNull("message")) return node.get("message").asText();
        if (node.hasNonNull("error")) return node.get("error").asText();
        return raw;
    }
}
