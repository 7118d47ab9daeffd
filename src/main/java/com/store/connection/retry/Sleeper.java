package com.store.connection.retry;

import java.time.Duration;

/**
 * Pause between retry attempts. Replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
