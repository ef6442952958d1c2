package io.hearthwarrio.mobitium.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PollingTest {

    @Test
    void attemptsOnceEvenWithZeroTimeout() {
        ManualClock clock = new ManualClock();
        AtomicInteger attempts = new AtomicInteger();

        Optional<String> result = clock.polling().until(Duration.ZERO, Duration.ofMillis(100), () -> {
            attempts.incrementAndGet();
            return Optional.empty();
        });

        assertFalse(result.isPresent());
        assertEquals(1, attempts.get());
    }

    @Test
    void retriesUntilValueAppears() {
        ManualClock clock = new ManualClock();
        AtomicInteger attempts = new AtomicInteger();

        Optional<Integer> result = clock.polling().until(Duration.ofSeconds(10), Duration.ofSeconds(1), () ->
                attempts.incrementAndGet() == 3 ? Optional.of(42) : Optional.empty());

        assertEquals(Optional.of(42), result);
        assertEquals(3, attempts.get());
    }

    @Test
    void stopsAtDeadline() {
        ManualClock clock = new ManualClock();
        AtomicInteger attempts = new AtomicInteger();

        Optional<Object> result = clock.polling().until(Duration.ofSeconds(5), Duration.ofSeconds(1), () -> {
            attempts.incrementAndGet();
            return Optional.empty();
        });

        assertFalse(result.isPresent());
        // t=0..5 inclusive
        assertEquals(6, attempts.get());
    }

    @Test
    void interruptionCancelsWait() {
        Polling polling = new Polling(new ManualClock(), d -> {
            throw new InterruptedException("stop");
        });

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> polling.until(Duration.ofSeconds(5), Duration.ofSeconds(1), Optional::empty));

        assertTrue(Thread.interrupted(), "interrupt flag must be restored");
        assertInstanceOf(InterruptedException.class, ex.getCause());
    }
}
