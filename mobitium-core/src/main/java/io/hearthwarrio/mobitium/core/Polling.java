package io.hearthwarrio.mobitium.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Deadline-bounded polling.
 * <p>
 * The attempt always runs at least once, even with a zero timeout. Between attempts the calling thread sleeps for the
 * polling interval; interrupting it cancels the wait, restores the interrupt flag and raises
 * {@link IllegalStateException}.
 * <p>
 * Timeouts bound only the waiting: an attempt that is already running is never cut short.
 */
public final class Polling {

    private final Clock clock;
    private final Sleeper sleeper;

    public Polling(Clock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static Polling system() {
        return new Polling(Clock.systemUTC(), Sleeper.SYSTEM_SLEEPER);
    }

    public Clock clock() {
        return clock;
    }

    public Sleeper sleeper() {
        return sleeper;
    }

    /**
     * Repeats {@code attempt} until it yields a value or the timeout elapses.
     *
     * @param timeout  total waiting budget
     * @param interval pause between attempts
     * @param attempt  one attempt; an empty result means "not yet"
     * @return first non-empty result, or empty when the deadline passed
     */
    public <T> Optional<T> until(Duration timeout, Duration interval, Supplier<Optional<T>> attempt) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            Optional<T> result = attempt.get();
            if (result.isPresent()) {
                return result;
            }
            if (!clock.instant().isBefore(deadline)) {
                return Optional.empty();
            }
            pause(interval);
        }
    }

    /**
     * Sleeps for the given duration, translating interruption into cancellation.
     */
    public void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Polling was interrupted", e);
        }
    }
}
