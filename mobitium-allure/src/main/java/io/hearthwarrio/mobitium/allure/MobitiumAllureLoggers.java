package io.hearthwarrio.mobitium.allure;

import io.hearthwarrio.mobitium.appium.DeviceSession;
import io.hearthwarrio.mobitium.appium.MobileActions;
import io.hearthwarrio.mobitium.appium.ResolvedElementLogger;
import io.hearthwarrio.mobitium.appium.StepReporter;
import io.hearthwarrio.mobitium.core.event.EventMatchLogger;

/**
 * Factory methods for Allure-related Mobitium loggers.
 * <p>
 * This class lives in the mobitium-allure module to avoid leaking Allure
 * dependencies into mobitium-core or mobitium-appium.
 */
public final class MobitiumAllureLoggers {

    private MobitiumAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger for resolved elements without screenshots.
     */
    public static ResolvedElementLogger resolvedElements(DeviceSession device) {
        return new AllureResolvedElementLogger(device, false);
    }

    public static ResolvedElementLogger resolvedElements(DeviceSession device, boolean screenshots) {
        return new AllureResolvedElementLogger(device, screenshots);
    }

    public static EventMatchLogger events() {
        return new AllureEventMatchLogger();
    }

    /**
     * Creates a step reporter that attaches a screenshot, the page source and the error to failed steps.
     */
    public static StepReporter steps(DeviceSession device) {
        return new AllureStepReporter(device);
    }

    /**
     * Routes every Allure-capable channel of {@code actions} to Allure.
     */
    public static MobileActions attach(MobileActions actions) {
        DeviceSession device = actions.getSession().getDevice();
        return actions
                .withLogger(resolvedElements(device))
                .withEventLogger(events())
                .withStepReporter(steps(device));
    }
}
