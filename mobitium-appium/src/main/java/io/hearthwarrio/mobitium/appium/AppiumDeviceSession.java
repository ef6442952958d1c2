package io.hearthwarrio.mobitium.appium;

import io.appium.java_client.AppiumBy;
import io.appium.java_client.AppiumDriver;
import io.hearthwarrio.mobitium.core.gesture.Bounds;
import io.hearthwarrio.mobitium.core.locator.Query;
import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.KeyInput;
import org.openqa.selenium.interactions.Pause;
import org.openqa.selenium.interactions.PointerInput;
import org.openqa.selenium.interactions.Sequence;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DeviceSession} backed by an Appium java-client driver.
 */
public final class AppiumDeviceSession implements DeviceSession {

    private final AppiumDriver driver;

    public AppiumDeviceSession(AppiumDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
    }

    public AppiumDriver getDriver() {
        return driver;
    }

    /**
     * Maps a query onto the matching Selenium/Appium locator strategy.
     */
    public static By toBy(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        String expr = query.getExpression();
        switch (query.getStrategy()) {
            case XPATH:
                return By.xpath(expr);
            case ACCESSIBILITY_ID:
                return AppiumBy.accessibilityId(expr);
            case ANDROID_UIAUTOMATOR:
                return AppiumBy.androidUIAutomator(expr);
            case IOS_CLASS_CHAIN:
                return AppiumBy.iOSClassChain(expr);
            case IOS_PREDICATE_STRING:
                return AppiumBy.iOSNsPredicateString(expr);
            case CSS_SELECTOR:
                return By.cssSelector(expr);
            default:
                throw new IllegalArgumentException("Unsupported query strategy: " + query.getStrategy());
        }
    }

    /**
     * Encodes a gesture as a W3C pointer action sequence for a touch finger.
     */
    public static Sequence toSequence(Gesture gesture) {
        Objects.requireNonNull(gesture, "gesture must not be null");
        PointerInput finger = new PointerInput(PointerInput.Kind.TOUCH, "finger1");
        Sequence sequence = new Sequence(finger, 0);

        sequence.addAction(finger.createPointerMove(Duration.ZERO, PointerInput.Origin.viewport(),
                gesture.getStartX(), gesture.getStartY()));
        sequence.addAction(finger.createPointerDown(PointerInput.MouseButton.LEFT.asArg()));
        if (gesture.getKind() == Gesture.Kind.SWIPE) {
            sequence.addAction(new Pause(finger, gesture.getDwell()));
            sequence.addAction(finger.createPointerMove(gesture.getMoveDuration(), PointerInput.Origin.viewport(),
                    gesture.getEndX(), gesture.getEndY()));
        }
        sequence.addAction(finger.createPointerUp(PointerInput.MouseButton.LEFT.asArg()));
        return sequence;
    }

    @Override
    public List<DeviceElement> findElements(Query query) {
        List<WebElement> found = driver.findElements(toBy(query));
        if (found.isEmpty()) {
            return Collections.emptyList();
        }
        List<DeviceElement> out = new ArrayList<>(found.size());
        for (WebElement element : found) {
            out.add(new AppiumElement(element));
        }
        return out;
    }

    @Override
    public String getPageSource() {
        return driver.getPageSource();
    }

    @Override
    public Bounds getWindowSize() {
        Dimension size = driver.manage().window().getSize();
        return Bounds.viewport(size.getWidth(), size.getHeight());
    }

    @Override
    public void perform(Gesture gesture) {
        try {
            driver.perform(Collections.singletonList(toSequence(gesture)));
        } finally {
            driver.resetInputState();
        }
    }

    @Override
    public Object executeScript(String script, Map<String, Object> args) {
        return driver.executeScript(script, args == null ? new HashMap<>() : args);
    }

    @Override
    public void pressAndroidKey(int keyCode) {
        Map<String, Object> args = new HashMap<>();
        args.put("keycode", keyCode);
        driver.executeScript("mobile: pressKey", args);
    }

    @Override
    public void typeKeys(CharSequence keys) {
        KeyInput keyboard = new KeyInput("keyboard");
        Sequence sequence = new Sequence(keyboard, 0);
        String text = keys.toString();
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            sequence.addAction(keyboard.createKeyDown(codePoint));
            sequence.addAction(keyboard.createKeyUp(codePoint));
            i += Character.charCount(codePoint);
        }
        driver.perform(Collections.singletonList(sequence));
    }

    @Override
    public String getAlertText() {
        return driver.switchTo().alert().getText();
    }

    @Override
    public void acceptAlert() {
        driver.switchTo().alert().accept();
    }

    @Override
    public void dismissAlert() {
        driver.switchTo().alert().dismiss();
    }

    @Override
    public byte[] getScreenshot() {
        return driver.getScreenshotAs(OutputType.BYTES);
    }

    private static final class AppiumElement implements DeviceElement {

        private final WebElement element;

        private AppiumElement(WebElement element) {
            this.element = element;
        }

        @Override
        public void click() {
            element.click();
        }

        @Override
        public void setValue(String text) {
            element.clear();
            element.sendKeys(text);
        }

        @Override
        public String getText() {
            return element.getText();
        }

        @Override
        public String getAttribute(String name) {
            return element.getAttribute(name);
        }

        @Override
        public boolean isDisplayed() {
            return element.isDisplayed();
        }

        @Override
        public Bounds getBounds() {
            Rectangle rect = element.getRect();
            return new Bounds(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight());
        }

        @Override
        public String toString() {
            return element.toString();
        }
    }
}
