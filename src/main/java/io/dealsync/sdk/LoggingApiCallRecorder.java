package io.dealsync.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LoggingApiCallRecorder implements ApiCallRecorder {
    static final LoggingApiCallRecorder INSTANCE = new LoggingApiCallRecorder();

    private static final Logger log = LoggerFactory.getLogger("io.dealsync.sdk.api");

    private LoggingApiCallRecorder() {}

    @Override
    public void record(String operation, String method, Integer statusCode, long durationMs) {
        log.atInfo()
                .addKeyValue("operation", operation)
                .addKeyValue("method", method)
                .addKeyValue("status_code", statusCode)
                .addKeyValue("duration_ms", durationMs)
                .log("API call {} {} -> {}", operation, method, statusCode != null ? statusCode : "no response");
    }
}
