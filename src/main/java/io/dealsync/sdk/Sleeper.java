package io.dealsync.sdk;

import java.time.Duration;

/** Blocks the calling thread. Swapped out in tests so backoff can be observed without waiting. */
@FunctionalInterface
interface Sleeper {
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
