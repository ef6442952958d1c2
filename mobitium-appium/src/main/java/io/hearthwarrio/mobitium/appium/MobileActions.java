package io.hearthwarrio.mobitium.appium;

import io.appium.java_client.android.nativekey.AndroidKey;
import io.hearthwarrio.mobitium.core.ActionOptions;
import io.hearthwarrio.mobitium.core.MisconfigurationException;
import io.hearthwarrio.mobitium.core.MobitiumDefaults;
import io.hearthwarrio.mobitium.core.Polling;
import io.hearthwarrio.mobitium.core.event.EventCorrelator;
import io.hearthwarrio.mobitium.core.event.EventMatchLogger;
import io.hearthwarrio.mobitium.core.event.EventPosition;
import io.hearthwarrio.mobitium.core.event.StdOutEventMatchLogger;
import io.hearthwarrio.mobitium.core.event.TelemetryEvent;
import io.hearthwarrio.mobitium.core.gesture.Bounds;
import io.hearthwarrio.mobitium.core.gesture.ScrollDirection;
import io.hearthwarrio.mobitium.core.gesture.SwipeGeometry;
import io.hearthwarrio.mobitium.core.locator.Locator;
import io.hearthwarrio.mobitium.core.locator.Platform;
import io.hearthwarrio.mobitium.core.locator.Queries;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * High-level Mobitium entry point: the actions a mobile end-to-end test performs.
 * <p>
 * Element-based actions go through {@link ElementResolver}, so they all share the same wait/retry/scroll behavior
 * configured by {@link ActionOptions}. Telemetry checks go through {@link EventCorrelator}.
 * <p>
 * Every public action is reported as one step via the configured {@link StepReporter}; a failing action marks its
 * step as failed before the exception propagates.
 * <p>
 * One instance serves one test. Call {@link #tearDown()} at the end of the test so that background event checks are
 * collected.
 */
public class MobileActions {

    private final MobileSession session;
    private final DeviceSession device;
    private final Polling polling;
    private final GesturePerformer gestures;
    private final ElementResolver resolver;
    private final EventCorrelator correlator;

    private StepReporter stepReporter = StepReporter.NO_OP;

    public MobileActions(MobileSession session) {
        this(session, null);
    }

    public MobileActions(MobileSession session, ResolvedElementLogger logger) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.device = session.getDevice();
        this.polling = session.getPolling();
        this.gestures = new GesturePerformer(device);
        this.resolver = new ElementResolver(device, session.getPlatform(), polling, gestures, logger);
        this.correlator = new EventCorrelator(session.getEventLog(), polling, session.getConsumptionMode(),
                MobitiumDefaults.EVENT_POLL_INTERVAL, null);
    }

    // ----------- configuration -----------

    public MobileActions withLogger(ResolvedElementLogger logger) {
        resolver.withLogger(logger);
        return this;
    }

    public MobileActions withLoggingToStdOut() {
        resolver.withLogger(new StdOutResolvedElementLogger());
        session.getEventLog().setLogger(new StdOutEventMatchLogger());
        return this;
    }

    /**
     * Replaces the logger of the session's event log ({@code null} disables event logging).
     */
    public MobileActions withEventLogger(EventMatchLogger logger) {
        session.getEventLog().setLogger(logger);
        return this;
    }

    public MobileActions withStepReporter(StepReporter stepReporter) {
        this.stepReporter = stepReporter == null ? StepReporter.NO_OP : stepReporter;
        return this;
    }

    public MobileSession getSession() {
        return session;
    }

    public ElementResolver getResolver() {
        return resolver;
    }

    public EventCorrelator getCorrelator() {
        return correlator;
    }

    // ----------- element lookup -----------

    /**
     * Resolves a visible element with the session's default options.
     */
    public DeviceElement findElement(Locator locator) {
        return findElement(locator, session.getDefaultOptions());
    }

    public DeviceElement findElement(Locator locator, ActionOptions options) {
        return step("Find " + locator, () -> resolver.resolve(locator, options));
    }

    // ----------- clicks -----------

    public void click(Locator locator) {
        click(locator, session.getDefaultOptions());
    }

    public void click(Locator locator, ActionOptions options) {
        Objects.requireNonNull(locator, "locator must not be null");
        run("Click " + locator, () -> resolver.resolve(locator, options).click());
    }

    public void click(TextMatch text) {
        click(text, session.getDefaultOptions());
    }

    public void click(TextMatch text, ActionOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        run("Click " + text, () -> resolver.resolve(text.toLocator(), options, text.toString()).click());
    }

    /**
     * Clicks the element named by an item of a telemetry event, with the default event-click options (one scroll at
     * capacity 0.7, the session's event timeout, the first matching event).
     */
    public void clickFromEvent(String eventName, String pattern) {
        clickFromEvent(eventName, pattern, eventClickOptions(), session.getEventTimeout(), EventPosition.FIRST);
    }

    /**
     * Waits for (and consumes) a matching event, takes the {@code name} of the first matching entry of
     * {@code event.data.items} in the first or last matching event, and clicks the element showing that name
     * (Android {@code @text}, iOS {@code @label}).
     *
     * @param pattern JSON object pattern or a path to a file holding one
     * @throws io.hearthwarrio.mobitium.core.event.EventNotFoundException if no event matched in time
     * @throws io.hearthwarrio.mobitium.core.event.EventPayloadMismatchException if the event yields no item name
     */
    public void clickFromEvent(String eventName, String pattern, ActionOptions options, Duration eventTimeout,
                               EventPosition position) {
        Objects.requireNonNull(eventName, "eventName must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(eventTimeout, "eventTimeout must not be null");
        EventPosition pos = position == null ? EventPosition.FIRST : position;

        run("Click item of event '" + eventName + "'", () -> {
            correlator.awaitEvent(eventName, pattern, eventTimeout);
            String itemName = correlator.findItemName(eventName, pattern, pos);

            Locator locator = Locator.of(Queries.text(itemName), Queries.label(itemName));
            resolver.resolve(locator, options, "event item '" + itemName + "'").click();
        });
    }

    /**
     * Dispatches to the entry point of the target's variant.
     */
    public void click(ClickTarget target, ActionOptions options) {
        Objects.requireNonNull(target, "target must not be null");
        target.accept(new ClickTarget.Visitor<Void>() {
            @Override
            public Void visitElement(ClickTarget.ElementTarget t) {
                click(t.getLocator(), options);
                return null;
            }

            @Override
            public Void visitText(ClickTarget.TextTarget t) {
                click(t.getMatch(), options);
                return null;
            }

            @Override
            public Void visitEvent(ClickTarget.EventTarget t) {
                clickFromEvent(t.getEventName(), t.getPattern(), options, session.getEventTimeout(), t.getPosition());
                return null;
            }
        });
    }

    /**
     * Default options for event-derived clicks.
     */
    public ActionOptions eventClickOptions() {
        return session.getDefaultOptions()
                .withScrollCount(MobitiumDefaults.EVENT_CLICK_SCROLL_COUNT)
                .withScrollCapacity(MobitiumDefaults.EVENT_CLICK_SCROLL_CAPACITY);
    }

    // ----------- visibility / values -----------

    public void checkVisible(Locator locator) {
        checkVisible(locator, session.getDefaultOptions());
    }

    public void checkVisible(Locator locator, ActionOptions options) {
        Objects.requireNonNull(locator, "locator must not be null");
        run("Check visible " + locator, () -> resolver.resolve(locator, options));
    }

    public void checkVisible(TextMatch text, ActionOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        run("Check visible " + text, () -> resolver.resolve(text.toLocator(), options, text.toString()));
    }

    public void typeText(Locator locator, String text) {
        typeText(locator, text, session.getDefaultOptions());
    }

    public void typeText(Locator locator, String text, ActionOptions options) {
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(text, "text must not be null");
        run("Type '" + text + "' into " + locator, () -> resolver.resolve(locator, options).setValue(text));
    }

    public String getText(Locator locator) {
        return getText(locator, session.getDefaultOptions());
    }

    public String getText(Locator locator, ActionOptions options) {
        Objects.requireNonNull(locator, "locator must not be null");
        return step("Get text of " + locator, () -> String.valueOf(resolver.resolve(locator, options).getText()));
    }

    /**
     * Reads the element text and keeps only its digits ({@code "1 299 ₽"} becomes {@code 1299}).
     *
     * @return the number, or {@code null} when the text has no digits; long digit runs are not truncated
     */
    public BigInteger getPrice(Locator locator, ActionOptions options) {
        String text = getText(locator, options);
        return parseDigits(text);
    }

    public BigInteger getPrice(Locator locator) {
        return getPrice(locator, session.getDefaultOptions());
    }

    /**
     * @return attribute value, or an empty string when the attribute is absent
     */
    public String getAttributeValue(Locator locator, String attribute, ActionOptions options) {
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(attribute, "attribute must not be null");
        return step("Get attribute '" + attribute + "' of " + locator, () -> {
            String value = resolver.resolve(locator, options).getAttribute(attribute);
            return value == null ? "" : value;
        });
    }

    public String getAttributeValue(Locator locator, String attribute) {
        return getAttributeValue(locator, attribute, session.getDefaultOptions());
    }

    // ----------- taps -----------

    /**
     * Taps absolute screen coordinates after letting the UI settle for up to {@code preDelay}.
     */
    public void tapArea(int x, int y, Duration preDelay) {
        run("Tap (" + x + ", " + y + ")", () -> {
            resolver.getUiStability().await(preDelay, session.getDefaultOptions().getPollInterval());
            device.perform(Gesture.tap(x, y));
        });
    }

    /**
     * Taps absolute screen coordinates once {@code condition} holds, or after {@code preDelay} at the latest.
     */
    public void tapArea(int x, int y, Duration preDelay, BooleanSupplier condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        run("Tap (" + x + ", " + y + ")", () -> {
            Instant deadline = polling.clock().instant().plus(preDelay);
            while (polling.clock().instant().isBefore(deadline) && !condition.getAsBoolean()) {
                polling.pause(session.getDefaultOptions().getPollInterval());
            }
            device.perform(Gesture.tap(x, y));
        });
    }

    /**
     * Taps at an offset from the element's top-left corner.
     */
    public void tapElementArea(Locator locator, int dx, int dy, ActionOptions options) {
        Objects.requireNonNull(locator, "locator must not be null");
        run("Tap " + locator + " at (+" + dx + ", +" + dy + ")", () -> {
            Bounds bounds = resolver.resolve(locator, options).getBounds();
            device.perform(Gesture.tap(bounds.getX() + dx, bounds.getY() + dy));
        });
    }

    public void tapElementArea(Locator locator, int dx, int dy) {
        tapElementArea(locator, dx, dy, session.getDefaultOptions());
    }

    // ----------- scrolls / swipes -----------

    public void scrollDown(int count, double capacity) {
        scroll(count, capacity, ScrollDirection.DOWN);
    }

    public void scrollUp(int count, double capacity) {
        scroll(count, capacity, ScrollDirection.UP);
    }

    public void scrollLeft(int count, double capacity) {
        scroll(count, capacity, ScrollDirection.LEFT);
    }

    public void scrollRight(int count, double capacity) {
        scroll(count, capacity, ScrollDirection.RIGHT);
    }

    public void scroll(int count, double capacity, ScrollDirection direction) {
        run("Scroll " + direction + " x" + count, () -> gestures.scroll(count, capacity, direction));
    }

    public void swipeDown(Locator locator, int count, double capacity) {
        swipe(locator, count, capacity, ScrollDirection.DOWN);
    }

    public void swipeUp(Locator locator, int count, double capacity) {
        swipe(locator, count, capacity, ScrollDirection.UP);
    }

    public void swipeLeft(Locator locator, int count, double capacity) {
        swipe(locator, count, capacity, ScrollDirection.LEFT);
    }

    public void swipeRight(Locator locator, int count, double capacity) {
        swipe(locator, count, capacity, ScrollDirection.RIGHT);
    }

    /**
     * Swipes inside the element's bounds. The capacity is checked before the element is searched.
     */
    public void swipe(Locator locator, int count, double capacity, ScrollDirection direction) {
        Objects.requireNonNull(locator, "locator must not be null");
        run("Swipe " + direction + " x" + count + " on " + locator, () -> {
            SwipeGeometry.requireValidCapacity(capacity);
            DeviceElement element = resolver.resolve(locator, session.getDefaultOptions());
            gestures.swipe(element, count, capacity, direction);
        });
    }

    // ----------- platform actions -----------

    /**
     * Opens a deep link in the app under test via {@code mobile: deepLink}.
     *
     * @throws MisconfigurationException if the app package (Android) or bundle id (iOS) is not configured
     */
    public void openDeeplink(String url) {
        Objects.requireNonNull(url, "url must not be null");
        run("Open deeplink " + url, () -> {
            Map<String, Object> args = new HashMap<>();
            args.put("url", url);
            if (session.getPlatform() == Platform.ANDROID) {
                args.put("package", require(session.getAppPackage(), "app package"));
            } else {
                args.put("bundleId", require(session.getBundleId(), "bundle id"));
            }
            device.executeScript("mobile: deepLink", args);
        });
    }

    public void pressKey(AndroidKey androidKey, String iosKey) {
        pressKey(androidKey == null ? null : androidKey.getCode(), iosKey);
    }

    /**
     * Presses a platform key: the Android key code on Android, the key text on iOS.
     *
     * @throws MisconfigurationException if the key for the active platform is missing
     */
    public void pressKey(Integer androidKeyCode, String iosKey) {
        run("Press key", () -> {
            if (session.getPlatform() == Platform.ANDROID) {
                if (androidKeyCode == null) {
                    throw new MisconfigurationException("androidKey is required on Android");
                }
                device.pressAndroidKey(androidKeyCode);
            } else {
                if (iosKey == null || iosKey.isEmpty()) {
                    throw new MisconfigurationException("iosKey is required on iOS");
                }
                device.typeKeys(iosKey);
            }
        });
    }

    public void tapEnter() {
        pressKey(AndroidKey.ENTER, "\n");
    }

    public AlertHandler alert() {
        return alert(session.getDefaultOptions().getSearchTimeout(), session.getDefaultOptions().getPollInterval());
    }

    public AlertHandler alert(Duration timeout, Duration pollInterval) {
        return new AlertHandler(device, timeout, pollInterval, polling);
    }

    // ----------- telemetry -----------

    public TelemetryEvent checkHasEvent(String eventName) {
        return checkHasEvent(eventName, null, session.getEventTimeout());
    }

    public TelemetryEvent checkHasEvent(String eventName, String patternOrPath) {
        return checkHasEvent(eventName, patternOrPath, session.getEventTimeout());
    }

    /**
     * Waits for a matching event anywhere in the event log and consumes it.
     */
    public TelemetryEvent checkHasEvent(String eventName, String patternOrPath, Duration timeout) {
        return step("Check event '" + eventName + "'", () -> correlator.awaitEvent(eventName, patternOrPath, timeout));
    }

    public CompletableFuture<TelemetryEvent> checkHasEventAsync(String eventName, String patternOrPath) {
        return checkHasEventAsync(eventName, patternOrPath, session.getEventTimeout());
    }

    /**
     * Starts a background check that only considers events arriving after this call. Failures surface from
     * {@link #awaitAllEventChecks()}.
     */
    public CompletableFuture<TelemetryEvent> checkHasEventAsync(String eventName, String patternOrPath,
                                                                Duration timeout) {
        return step("Check event '" + eventName + "' in background",
                () -> correlator.awaitEventInBackground(eventName, patternOrPath, timeout));
    }

    public void awaitAllEventChecks() {
        run("Await background event checks", correlator::awaitAllBackgroundChecks);
    }

    /**
     * Collects background event checks and releases the check executor.
     */
    public void tearDown() {
        try {
            awaitAllEventChecks();
        } finally {
            correlator.close();
        }
    }

    // ----------- internals -----------

    static BigInteger parseDigits(String text) {
        if (text == null) {
            return null;
        }
        String digits = text.replaceAll("\\D+", "");
        return digits.isEmpty() ? null : new BigInteger(digits);
    }

    private static String require(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new MisconfigurationException("Cannot open deeplink: " + what + " is not configured");
        }
        return value;
    }

    private void run(String name, Runnable action) {
        step(name, () -> {
            action.run();
            return null;
        });
    }

    private <T> T step(String name, Supplier<T> action) {
        StepReporter.Step step = stepReporter.start(name);
        try {
            return action.get();
        } catch (RuntimeException | Error e) {
            step.fail(e);
            throw e;
        } finally {
            step.close();
        }
    }
}
