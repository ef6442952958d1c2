package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.Polling;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.FluentWait;

import java.time.Duration;
import java.util.Objects;

/**
 * System alert helper. Every operation polls until the alert responds or the timeout elapses.
 */
public final class AlertHandler {

    private final DeviceSession session;
    private final Duration timeout;
    private final Duration pollInterval;
    private final Polling polling;

    public AlertHandler(DeviceSession session, Duration timeout, Duration pollInterval, Polling polling) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.polling = Objects.requireNonNull(polling, "polling must not be null");
    }

    /**
     * @return {@code true} if an alert showed up within the timeout
     */
    public boolean isPresent() {
        try {
            newWait("alert to be present").until(s -> s.getAlertText() != null);
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * @throws TimeoutException if no alert could be accepted in time
     */
    public void accept() {
        newWait("alert to be accepted").until(s -> {
            s.acceptAlert();
            return true;
        });
    }

    /**
     * @throws TimeoutException if no alert could be dismissed in time
     */
    public void dismiss() {
        newWait("alert to be dismissed").until(s -> {
            s.dismissAlert();
            return true;
        });
    }

    /**
     * @throws TimeoutException if no alert showed up in time
     */
    public String getText() {
        return newWait("alert text").until(DeviceSession::getAlertText);
    }

    private FluentWait<DeviceSession> newWait(String what) {
        return new FluentWait<>(session, polling.clock(), polling.sleeper()::sleep)
                .withTimeout(timeout)
                .pollingEvery(pollInterval)
                .withMessage("waiting for " + what)
                .ignoring(WebDriverException.class);
    }
}
