package io.hearthwarrio.mobitium.testkit;

import io.appium.java_client.AppiumDriver;
import io.hearthwarrio.mobitium.appium.AppiumDeviceSession;
import io.hearthwarrio.mobitium.appium.MobileActions;
import io.hearthwarrio.mobitium.appium.MobileSession;
import io.hearthwarrio.mobitium.appium.StdOutStepReporter;
import io.hearthwarrio.mobitium.core.MobitiumConfig;
import io.hearthwarrio.mobitium.core.event.EventLog;

import java.util.Objects;

/**
 * Convenience factory methods for creating MobileActions in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestMobitium {

    private TestMobitium() {
        // utility class
    }

    /**
     * Creates plain MobileActions without logging.
     */
    public static MobileActions plain(AppiumDriver driver, MobitiumConfig config) {
        return new MobileActions(session(driver, config, null));
    }

    /**
     * Creates plain MobileActions that read telemetry from a shared event log.
     */
    public static MobileActions plain(AppiumDriver driver, MobitiumConfig config, EventLog eventLog) {
        Objects.requireNonNull(eventLog, "eventLog must not be null");
        return new MobileActions(session(driver, config, eventLog));
    }

    /**
     * Creates MobileActions with stdout element, event and step logging enabled.
     */
    public static MobileActions stdout(AppiumDriver driver, MobitiumConfig config) {
        return new MobileActions(session(driver, config, null))
                .withLoggingToStdOut()
                .withStepReporter(new StdOutStepReporter());
    }

    /**
     * Creates MobileActions with stdout logging that read telemetry from a shared event log.
     */
    public static MobileActions stdout(AppiumDriver driver, MobitiumConfig config, EventLog eventLog) {
        Objects.requireNonNull(eventLog, "eventLog must not be null");
        return new MobileActions(session(driver, config, eventLog))
                .withLoggingToStdOut()
                .withStepReporter(new StdOutStepReporter());
    }

    private static MobileSession session(AppiumDriver driver, MobitiumConfig config, EventLog eventLog) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return MobileSession.builder(new AppiumDeviceSession(driver), config)
                .eventLog(eventLog)
                .build();
    }
}
