package io.hearthwarrio.mobitium.core;

import io.hearthwarrio.mobitium.core.gesture.ScrollDirection;
import io.hearthwarrio.mobitium.core.locator.Platform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class MobitiumConfigTest {

    @Test
    void environmentOverridesFileInAnySpelling() {
        Properties props = new Properties();
        props.setProperty("platform", "android");
        props.setProperty("app.package", "com.example.shop");
        props.setProperty("scroll.count", "1");

        Map<String, String> env = new HashMap<>();
        env.put("PLATFORM", "ios");
        env.put("scroll_count", "4");

        MobitiumConfig config = MobitiumConfig.from(props, env);

        assertEquals(Platform.IOS, config.getPlatform());
        assertEquals("com.example.shop", config.getAppPackage());
        assertEquals(4, config.defaultActionOptions().getScrollCount());
    }

    @Test
    void actionDefaultsComeFromProperties() {
        Properties props = new Properties();
        props.setProperty("timeout.expectation", "3");
        props.setProperty("timeout.before.expectation", "0.5");
        props.setProperty("polling.interval", "250");
        props.setProperty("scroll.capacity", "0.5");
        props.setProperty("scroll.direction", "left");
        props.setProperty("timeout.event.expectation", "20");

        MobitiumConfig config = MobitiumConfig.from(props, Collections.emptyMap());
        ActionOptions options = config.defaultActionOptions();

        assertEquals(Duration.ofSeconds(3), options.getSearchTimeout());
        assertEquals(Duration.ofMillis(500), options.getPreDelay());
        assertEquals(Duration.ofMillis(250), options.getPollInterval());
        assertEquals(0.5, options.getScrollCapacity());
        assertEquals(ScrollDirection.LEFT, options.getScrollDirection());
        assertEquals(Duration.ofSeconds(20), config.getEventTimeout());
    }

    @Test
    void unknownPlatformIsMisconfiguration() {
        Properties props = new Properties();
        props.setProperty("platform", "symbian");

        assertThrows(MisconfigurationException.class, () -> MobitiumConfig.from(props, Collections.emptyMap()));
    }

    @Test
    void booleanFlagsAcceptCommonSpellings() {
        Properties props = new Properties();
        props.setProperty("ios.auto_accept_alerts", "yes");
        props.setProperty("flag.off", "off");

        MobitiumConfig config = MobitiumConfig.from(props, Collections.emptyMap());

        assertTrue(config.isIosAutoAcceptAlerts());
        assertFalse(config.propBoolean("flag.off", true));
        assertTrue(config.propBoolean("missing", true));
    }

    @Test
    void profileFileIsPreferredOverPlainFile(@TempDir Path dir) throws IOException {
        Path configDir = Files.createDirectories(dir.resolve("tests").resolve("config"));
        Files.write(configDir.resolve("tests.properties"), "platform=ANDROID\n".getBytes(StandardCharsets.UTF_8));
        Files.write(configDir.resolve("tests.ci.properties"), "platform=IOS\n".getBytes(StandardCharsets.UTF_8));

        Map<String, String> env = new HashMap<>();
        env.put("CI", "true");

        MobitiumConfig config = MobitiumConfig.load(env, dir);

        assertEquals(Platform.IOS, config.getPlatform());
    }

    @Test
    void explicitConfigPathComesFirst(@TempDir Path dir) throws IOException {
        Path explicit = dir.resolve("custom.properties");
        Files.write(explicit, "platform=IOS\n".getBytes(StandardCharsets.UTF_8));

        Map<String, String> env = new HashMap<>();
        env.put("CONFIG_PATH", explicit.toString());

        List<Path> candidates = MobitiumConfig.candidatePaths(env, dir);

        assertEquals(explicit, candidates.get(0));
        assertEquals(Platform.IOS, MobitiumConfig.load(env, dir).getPlatform());
    }

    @Test
    void fallsBackToClasspathResource(@TempDir Path dir) {
        MobitiumConfig config = MobitiumConfig.load(Collections.emptyMap(), dir);

        assertEquals(Platform.ANDROID, config.getPlatform());
        assertEquals("com.example.demo", config.getAppPackage());
    }
}
