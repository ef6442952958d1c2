package io.hearthwarrio.mobitium.core;

import java.time.Duration;

/**
 * Pause between polling attempts. Replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM_SLEEPER = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
