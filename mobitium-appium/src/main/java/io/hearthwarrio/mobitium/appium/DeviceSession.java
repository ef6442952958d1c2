package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.gesture.Bounds;
import io.hearthwarrio.mobitium.core.locator.Query;

import java.util.List;
import java.util.Map;

/**
 * Device protocol as seen by Mobitium.
 * <p>
 * {@link AppiumDeviceSession} talks to a real Appium server; tests use in-memory fakes. Calls are strictly sequential:
 * one logical test thread drives one session.
 * <p>
 * Protocol failures are reported as Selenium {@link org.openqa.selenium.WebDriverException}s.
 */
public interface DeviceSession {

    /**
     * Runs one element search.
     *
     * @return matches in document order; empty when nothing matched
     */
    List<DeviceElement> findElements(Query query);

    String getPageSource();

    /**
     * @return viewport size, anchored at the origin
     */
    Bounds getWindowSize();

    /**
     * Performs a touch gesture and releases all input state afterwards.
     */
    void perform(Gesture gesture);

    /**
     * Runs an Appium {@code mobile:} command.
     *
     * @param script command name, e.g. {@code mobile: deepLink}
     * @param args   command arguments
     */
    Object executeScript(String script, Map<String, Object> args);

    /**
     * Presses an Android key by key code.
     */
    void pressAndroidKey(int keyCode);

    /**
     * Types keys through the active keyboard (used for iOS keys such as {@code "\n"}).
     */
    void typeKeys(CharSequence keys);

    /**
     * @throws org.openqa.selenium.NoAlertPresentException if no alert is shown
     */
    String getAlertText();

    void acceptAlert();

    void dismissAlert();

    /**
     * @return PNG bytes
     */
    byte[] getScreenshot();
}
