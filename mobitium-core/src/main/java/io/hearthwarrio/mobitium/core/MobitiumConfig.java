package io.hearthwarrio.mobitium.core;

import io.hearthwarrio.mobitium.core.gesture.ScrollDirection;
import io.hearthwarrio.mobitium.core.locator.Platform;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Session configuration read from a {@code tests.properties} file, with environment overrides.
 * <p>
 * Every key can be overridden by an environment variable spelled exactly like the key, in UPPER_SNAKE form
 * ({@code appium.url} -> {@code APPIUM_URL}) or in lower_snake form.
 * <p>
 * File lookup order for {@link #load()}:
 * <ol>
 *   <li>{@code CONFIG_PATH} environment variable</li>
 *   <li>{@code tests/config/tests.local.properties}, {@code tests/config/tests.<profile>.properties},
 *       {@code tests/config/tests.properties}</li>
 *   <li>{@code tests.local.properties}, {@code tests.<profile>.properties}, {@code tests.properties} in the working
 *       directory</li>
 *   <li>{@code src/test/resources/tests.properties}</li>
 *   <li>{@code tests.properties} on the classpath</li>
 * </ol>
 * The profile comes from {@code TEST_PROFILE}, or is {@code ci} when {@code CI} is set.
 */
public final class MobitiumConfig {

    static final String CLASSPATH_RESOURCE = "tests.properties";

    private final Properties properties;
    private final Map<String, String> env;

    private final Platform platform;
    private final URL appiumUrl;

    MobitiumConfig(Properties properties, Map<String, String> env) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.env = Objects.requireNonNull(env, "env must not be null");

        String pf = prop("platform", "ANDROID").trim().toUpperCase(Locale.ROOT);
        try {
            this.platform = Platform.valueOf(pf);
        } catch (IllegalArgumentException e) {
            throw new MisconfigurationException("Unsupported platform '" + pf + "', expected ANDROID or IOS", e);
        }

        String url = prop("appium.url", "http://localhost:4723/");
        try {
            this.appiumUrl = URI.create(url).toURL();
        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new MisconfigurationException("Invalid appium.url '" + url + "'", e);
        }
    }

    /**
     * Builds a configuration from explicit properties and environment.
     */
    public static MobitiumConfig from(Properties properties, Map<String, String> env) {
        return new MobitiumConfig(properties, env);
    }

    /**
     * Locates and loads the configuration file using the process environment.
     *
     * @throws MisconfigurationException when no configuration file can be found or read
     */
    public static MobitiumConfig load() {
        return load(System.getenv(), Paths.get("").toAbsolutePath());
    }

    static MobitiumConfig load(Map<String, String> env, Path workingDir) {
        List<Path> candidates = candidatePaths(env, workingDir);
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return new MobitiumConfig(readFile(candidate), env);
            }
        }

        try (InputStream in = MobitiumConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
                return new MobitiumConfig(props, env);
            }
        } catch (IOException e) {
            throw new MisconfigurationException("Failed to read classpath " + CLASSPATH_RESOURCE, e);
        }

        StringBuilder tried = new StringBuilder();
        for (Path p : candidates) {
            tried.append("\n - ").append(p);
        }
        tried.append("\n - classpath:").append(CLASSPATH_RESOURCE);
        throw new MisconfigurationException(
                "Test configuration file not found. Looked in:" + tried +
                        "\nSet CONFIG_PATH or create tests/config/tests.properties"
        );
    }

    static List<Path> candidatePaths(Map<String, String> env, Path workingDir) {
        List<Path> out = new ArrayList<>();

        String envPath = trimToNull(env.get("CONFIG_PATH"));
        if (envPath != null) {
            out.add(Paths.get(envPath));
        }

        String profile = trimToNull(env.get("TEST_PROFILE"));
        if (profile == null && env.get("CI") != null) {
            profile = "ci";
        }

        Path configDir = workingDir.resolve("tests").resolve("config");
        out.add(configDir.resolve("tests.local.properties"));
        if (profile != null) {
            out.add(configDir.resolve("tests." + profile + ".properties"));
        }
        out.add(configDir.resolve("tests.properties"));

        out.add(workingDir.resolve("tests.local.properties"));
        if (profile != null) {
            out.add(workingDir.resolve("tests." + profile + ".properties"));
        }
        out.add(workingDir.resolve("tests.properties"));

        out.add(workingDir.resolve("src").resolve("test").resolve("resources").resolve("tests.properties"));
        return out;
    }

    private static Properties readFile(Path path) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new MisconfigurationException("Failed to read configuration " + path, e);
        }
        return props;
    }

    // ----------- session -----------

    public Platform getPlatform() {
        return platform;
    }

    public boolean isAndroid() {
        return platform == Platform.ANDROID;
    }

    public boolean isIos() {
        return platform == Platform.IOS;
    }

    public URL getAppiumUrl() {
        return appiumUrl;
    }

    public String getAndroidVersion() {
        return prop("android.version", "16");
    }

    public String getIosVersion() {
        return prop("ios.version", "18.4");
    }

    public String getAndroidDeviceName() {
        return prop("android.device.name", "WBA16");
    }

    public String getIosDeviceName() {
        return prop("ios.device.name", "iPhone 16 Plus");
    }

    /**
     * Application file for the active platform.
     */
    public String getAppName() {
        return platform == Platform.ANDROID
                ? prop("android.app.name", "android.apk")
                : prop("ios.app.name", "ios.app");
    }

    public String getAppActivity() {
        return prop("app.activity", "MainActivity");
    }

    public String getAppPackage() {
        return prop("app.package", "com.dev");
    }

    public String getBundleId() {
        return prop("bundle.id", "MOBILEAPP.DEV");
    }

    public boolean isIosAutoAcceptAlerts() {
        return propBoolean("ios.auto_accept_alerts", false);
    }

    public boolean isIosAutoDismissAlerts() {
        return propBoolean("ios.auto_dismiss_alerts", false);
    }

    public boolean isAndroidHeadlessMode() {
        return propBoolean("android.headless.mode", true);
    }

    /**
     * Extra attempts when creating the Appium session.
     */
    public int getSessionRetries() {
        return propInt("session.retries", 3);
    }

    // ----------- action defaults -----------

    /**
     * Default {@link ActionOptions}, with any {@code timeout.*} / {@code scroll.*} overrides applied.
     */
    public ActionOptions defaultActionOptions() {
        ActionOptions options = ActionOptions.defaults()
                .withPreDelay(propSeconds("timeout.before.expectation", MobitiumDefaults.PRE_DELAY))
                .withSearchTimeout(propSeconds("timeout.expectation", MobitiumDefaults.SEARCH_TIMEOUT))
                .withPollInterval(propMillis("polling.interval", MobitiumDefaults.POLL_INTERVAL))
                .withScrollCount(propInt("scroll.count", MobitiumDefaults.SCROLL_COUNT))
                .withScrollCapacity(propDouble("scroll.capacity", MobitiumDefaults.SCROLL_CAPACITY));

        String direction = rawProp("scroll.direction");
        if (direction != null) {
            try {
                options = options.withScrollDirection(ScrollDirection.valueOf(direction.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new MisconfigurationException("Invalid scroll.direction '" + direction + "'", e);
            }
        }
        return options;
    }

    public Duration getEventTimeout() {
        return propSeconds("timeout.event.expectation", MobitiumDefaults.EVENT_TIMEOUT);
    }

    // ----------- raw access -----------

    /**
     * Resolves a key through environment overrides, then the file, then the default.
     */
    public String prop(String name, String defaultValue) {
        String v = rawProp(name);
        return v == null ? defaultValue : v.trim();
    }

    public boolean propBoolean(String name, boolean defaultValue) {
        String v = rawProp(name);
        if (v == null) {
            return defaultValue;
        }
        switch (v.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "y":
            case "on":
                return true;
            case "false":
            case "0":
            case "no":
            case "n":
            case "off":
                return false;
            default:
                return defaultValue;
        }
    }

    public int propInt(String name, int defaultValue) {
        String v = rawProp(name);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private double propDouble(String name, double defaultValue) {
        String v = rawProp(name);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new MisconfigurationException("Invalid number for " + name + ": '" + v + "'", e);
        }
    }

    private Duration propSeconds(String name, Duration defaultValue) {
        String v = rawProp(name);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Math.round(Double.parseDouble(v.trim()) * 1000));
        } catch (NumberFormatException e) {
            throw new MisconfigurationException("Invalid seconds for " + name + ": '" + v + "'", e);
        }
    }

    private Duration propMillis(String name, Duration defaultValue) {
        String v = rawProp(name);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            throw new MisconfigurationException("Invalid milliseconds for " + name + ": '" + v + "'", e);
        }
    }

    private String rawProp(String name) {
        String fromEnv = envProp(name);
        return fromEnv != null ? fromEnv : properties.getProperty(name);
    }

    private String envProp(String name) {
        if (env.get(name) != null) {
            return env.get(name);
        }
        String snake = name.replaceAll("[.\\s-]+", "_");
        String upper = env.get(snake.toUpperCase(Locale.ROOT));
        if (upper != null) {
            return upper;
        }
        return env.get(snake.toLowerCase(Locale.ROOT));
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
