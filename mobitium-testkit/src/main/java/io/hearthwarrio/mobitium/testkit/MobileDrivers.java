package io.hearthwarrio.mobitium.testkit;

import io.appium.java_client.AppiumDriver;
import io.appium.java_client.android.AndroidDriver;
import io.appium.java_client.android.options.UiAutomator2Options;
import io.appium.java_client.ios.IOSDriver;
import io.appium.java_client.ios.options.XCUITestOptions;
import io.hearthwarrio.mobitium.core.MisconfigurationException;
import io.hearthwarrio.mobitium.core.MobitiumConfig;
import org.openqa.selenium.WebDriverException;

import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Minimal Appium driver factory for tests.
 * <p>
 * Capabilities come from {@link MobitiumConfig}; the app binary is resolved against the working directory.
 * Session creation is retried {@link MobitiumConfig#getSessionRetries()} times.
 * <p>
 * Testkit lives outside Mobitium core to avoid turning Mobitium into a test framework.
 */
public final class MobileDrivers {

    public static final Duration NEW_COMMAND_TIMEOUT = Duration.ofSeconds(100);
    public static final Duration ADB_EXEC_TIMEOUT = Duration.ofSeconds(40);

    private MobileDrivers() {
        // utility class
    }

    /**
     * Starts a session for the configured platform.
     */
    public static AppiumDriver create(MobitiumConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return config.isAndroid() ? android(config) : ios(config);
    }

    public static AndroidDriver android(MobitiumConfig config) {
        UiAutomator2Options options = androidOptions(config);
        requireApp(config);
        URL url = config.getAppiumUrl();
        return withRetries("Android", config.getSessionRetries(), () -> new AndroidDriver(url, options));
    }

    public static IOSDriver ios(MobitiumConfig config) {
        XCUITestOptions options = iosOptions(config);
        requireApp(config);
        URL url = config.getAppiumUrl();
        return withRetries("iOS", config.getSessionRetries(), () -> new IOSDriver(url, options));
    }

    public static UiAutomator2Options androidOptions(MobitiumConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        UiAutomator2Options options = new UiAutomator2Options()
                .setApp(appPath(config).toString())
                .setPlatformVersion(config.getAndroidVersion())
                .setDeviceName(config.getAndroidDeviceName())
                .setAppPackage(config.getAppPackage())
                .setAppActivity(config.getAppActivity())
                .setNoReset(false)
                .setAutoGrantPermissions(true)
                .setNewCommandTimeout(NEW_COMMAND_TIMEOUT)
                .setAdbExecTimeout(ADB_EXEC_TIMEOUT);
        options.setCapability("appium:isHeadless", config.isAndroidHeadlessMode());
        return options;
    }

    public static XCUITestOptions iosOptions(MobitiumConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        XCUITestOptions options = new XCUITestOptions()
                .setApp(appPath(config).toString())
                .setPlatformVersion(config.getIosVersion())
                .setDeviceName(config.getIosDeviceName())
                .setConnectHardwareKeyboard(false)
                .setAutoAcceptAlerts(config.isIosAutoAcceptAlerts())
                .setAutoDismissAlerts(config.isIosAutoDismissAlerts())
                .setNewCommandTimeout(NEW_COMMAND_TIMEOUT);
        options.setCapability("appium:showIOSLog", false);
        return options;
    }

    private static Path appPath(MobitiumConfig config) {
        return Paths.get(config.getAppName()).toAbsolutePath();
    }

    private static void requireApp(MobitiumConfig config) {
        Path app = appPath(config);
        if (!Files.exists(app)) {
            throw new MisconfigurationException("App binary '" + config.getAppName() + "' not found at " + app
                    + ". Build the app and copy it to the project root.");
        }
    }

    private static <D extends AppiumDriver> D withRetries(String platform, int retries, Supplier<D> factory) {
        WebDriverException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return factory.get();
            } catch (WebDriverException e) {
                last = e;
                System.out.println("[Mobitium] " + platform + " session not created (attempt " + (attempt + 1)
                        + " of " + (retries + 1) + "): " + e.getRawMessage());
            }
        }
        throw new IllegalStateException("Could not start " + platform
                + " session. Check that the device is running and Appium is reachable.", last);
    }
}
