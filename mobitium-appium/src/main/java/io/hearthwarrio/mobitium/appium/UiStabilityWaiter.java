package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.Polling;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Waits until two consecutive page sources are identical, bounded by a pre-delay.
 * <p>
 * Used before element searches so that transitions and animations settle first. Reaching the deadline is not an
 * error: the search simply starts.
 */
public final class UiStabilityWaiter {

    private final DeviceSession session;
    private final Polling polling;

    public UiStabilityWaiter(DeviceSession session, Polling polling) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.polling = Objects.requireNonNull(polling, "polling must not be null");
    }

    /**
     * @param preDelay     waiting budget; zero or negative skips the wait entirely
     * @param pollInterval pause between page source reads
     * @return {@code true} if the UI settled before the deadline
     */
    public boolean await(Duration preDelay, Duration pollInterval) {
        if (preDelay == null || preDelay.isZero() || preDelay.isNegative()) {
            return true;
        }
        Instant deadline = polling.clock().instant().plus(preDelay);
        String previous = session.getPageSource();
        while (polling.clock().instant().isBefore(deadline)) {
            polling.pause(pollInterval);
            String current = session.getPageSource();
            if (Objects.equals(previous, current)) {
                return true;
            }
            previous = current;
        }
        return false;
    }
}
