package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.ActionOptions;
import io.hearthwarrio.mobitium.core.ElementNotFoundException;
import io.hearthwarrio.mobitium.core.MisconfigurationException;
import io.hearthwarrio.mobitium.core.locator.Locator;
import io.hearthwarrio.mobitium.core.locator.Platform;
import io.hearthwarrio.mobitium.core.locator.Queries;
import io.hearthwarrio.mobitium.core.locator.Query;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriverException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ElementResolverTest {

    private static final Query CATALOG = Queries.accessibilityId("catalog");
    private static final Query CATALOG_TEXT = Queries.text("Catalog");

    private final ManualClock clock = new ManualClock();
    private final FakeDeviceSession device = new FakeDeviceSession();
    private final List<String> resolved = new ArrayList<>();

    private final ElementResolver resolver = new ElementResolver(device, Platform.ANDROID, clock.polling(),
            new GesturePerformer(device),
            (target, query, ordinal, scrolls, failed) ->
                    resolved.add(query + "#" + ordinal + " scrolls=" + scrolls + " failed=" + failed.size()));

    private final ActionOptions fast = ActionOptions.defaults().withSearchTimeout(Duration.ZERO);

    @Test
    void returnsFirstVisibleMatch() {
        FakeElement element = new FakeElement("Catalog");
        device.show(CATALOG, element);

        DeviceElement found = resolver.resolve(Locator.of(CATALOG), ActionOptions.defaults());

        assertSame(element, found);
        assertEquals(1, device.searches.size());
        assertEquals(Duration.ZERO, clock.elapsed());
        assertEquals(Arrays.asList(CATALOG + "#1 scrolls=0 failed=0"), resolved);
    }

    @Test
    void fallsBackToNextAlternative() {
        FakeElement element = new FakeElement("Catalog");
        device.show(CATALOG_TEXT, element);
        Locator locator = Locator.builder().androidAlternatives(CATALOG, CATALOG_TEXT).build();

        DeviceElement found = resolver.resolve(locator, fast);

        assertSame(element, found);
        assertEquals(Arrays.asList(CATALOG, CATALOG_TEXT), device.searches);
        assertEquals(Arrays.asList(CATALOG_TEXT + "#1 scrolls=0 failed=1"), resolved);
    }

    @Test
    void ordinalAppliesPerAlternative() {
        FakeElement second = new FakeElement("second");
        device.show(CATALOG, new FakeElement("only"));
        device.show(CATALOG_TEXT, new FakeElement("first"), second);
        Locator locator = Locator.builder().androidAlternatives(CATALOG, CATALOG_TEXT).build();

        DeviceElement found = resolver.resolve(locator, ActionOptions.defaults().withOrdinal(2));

        assertSame(second, found);
        assertEquals(2, device.searches.size());
    }

    @Test
    void reportsOrdinalOutOfRange() {
        device.show(CATALOG, new FakeElement("only"));

        ElementNotFoundException ex = assertThrows(ElementNotFoundException.class,
                () -> resolver.resolve(Locator.of(CATALOG), fast.withOrdinal(3)));

        assertTrue(ex.getMessage().contains("Element 3 out of range (found: 1)"), ex.getMessage());
        assertEquals(Arrays.asList(CATALOG), ex.getFailedQueries());
    }

    @Test
    void hiddenElementIsNotResolved() {
        device.show(CATALOG, new FakeElement("Catalog").hidden());

        ElementNotFoundException ex = assertThrows(ElementNotFoundException.class,
                () -> resolver.resolve(Locator.of(CATALOG), fast));

        assertTrue(ex.getMessage().contains("Element found but not displayed"), ex.getMessage());
    }

    @Test
    void pollsUntilSearchTimeout() {
        ActionOptions options = ActionOptions.defaults()
                .withSearchTimeout(Duration.ofSeconds(3))
                .withPollInterval(Duration.ofSeconds(1));

        ElementNotFoundException ex = assertThrows(ElementNotFoundException.class,
                () -> resolver.resolve(Locator.of(CATALOG), options));

        assertEquals(4, device.searches.size());
        assertEquals(Duration.ofSeconds(3), clock.elapsed());
        assertTrue(ex.getMessage().startsWith("Elements not found within 3000 ms after 0 scrolls."), ex.getMessage());
        assertTrue(resolved.isEmpty());
    }

    @Test
    void invalidCapacityFailsBeforeAnyDeviceCall() {
        assertThrows(MisconfigurationException.class,
                () -> resolver.resolve(Locator.of(CATALOG), fast.withScrollCapacity(0)));
        assertThrows(MisconfigurationException.class,
                () -> resolver.resolve(Locator.of(CATALOG), fast.withScrollCapacity(1.5)));

        assertTrue(device.searches.isEmpty());
        assertTrue(device.gestures.isEmpty());
        assertEquals(0, device.pageSourceCalls);
    }

    @Test
    void missingPlatformQueryFailsImmediately() {
        ElementResolver ios = new ElementResolver(device, Platform.IOS, clock.polling(), new GesturePerformer(device),
                null);

        ElementNotFoundException ex = assertThrows(ElementNotFoundException.class,
                () -> ios.resolve(Locator.builder().android(CATALOG).build(), ActionOptions.defaults()));

        assertTrue(ex.getMessage().contains("no locators"), ex.getMessage());
        assertTrue(device.searches.isEmpty());
    }

    @Test
    void scrollsBetweenRoundsUntilElementAppears() {
        FakeElement element = new FakeElement("Catalog");
        device.onGesture(() -> device.show(CATALOG, element));

        DeviceElement found = resolver.resolve(Locator.of(CATALOG), fast.withScrollCount(3));

        assertSame(element, found);
        assertEquals(1, device.gestures.size());
        assertEquals(Gesture.Kind.SWIPE, device.gestures.get(0).getKind());
        assertEquals(Arrays.asList(CATALOG + "#1 scrolls=1 failed=1"), resolved);
    }

    @Test
    void exhaustedScrollBudgetIsReported() {
        Locator locator = Locator.builder().androidAlternatives(CATALOG, CATALOG_TEXT).build();

        ElementNotFoundException ex = assertThrows(ElementNotFoundException.class,
                () -> resolver.resolve(locator, fast.withScrollCount(2)));

        assertEquals(2, device.gestures.size());
        assertEquals(2, ex.getScrollsPerformed());
        assertEquals(6, ex.getAttemptedQueries().size());
        assertTrue(ex.getMessage().contains("after 2 scrolls"), ex.getMessage());
    }

    @Test
    void protocolErrorBecomesCause() {
        device.fail(CATALOG, new WebDriverException("socket hang up"));

        ElementNotFoundException ex = assertThrows(ElementNotFoundException.class,
                () -> resolver.resolve(Locator.of(CATALOG), fast));

        assertTrue(ex.getCause() instanceof WebDriverException);
        assertTrue(ex.getMessage().contains("socket hang up"), ex.getMessage());
    }

    @Test
    void protocolErrorOfEarlierAlternativeDoesNotLeakIntoLaterOne() {
        device.fail(CATALOG, new WebDriverException("socket hang up"));
        Locator locator = Locator.builder().androidAlternatives(CATALOG, CATALOG_TEXT).build();

        ElementNotFoundException ex = assertThrows(ElementNotFoundException.class,
                () -> resolver.resolve(locator, fast));

        assertTrue(ex.getMessage().contains("no elements found by " + CATALOG_TEXT), ex.getMessage());
        assertFalse(ex.getMessage().contains("socket hang up"), ex.getMessage());
        assertNull(ex.getCause());
    }

    @Test
    void ordinalSkipsEmptyAlternativeAndPicksFromNextOne() {
        FakeElement second = new FakeElement("second");
        device.show(CATALOG_TEXT, new FakeElement("first"), second, new FakeElement("third"));
        Locator locator = Locator.builder().androidAlternatives(CATALOG, CATALOG_TEXT).build();

        DeviceElement found = resolver.resolve(locator, fast.withOrdinal(2));

        assertSame(second, found);
        assertEquals(2, device.searches.size());
    }

    @Test
    void waitsForStablePageSourceBeforeSearching() {
        device.pageSources("<a/>", "<b/>", "<b/>");
        device.show(CATALOG, new FakeElement("Catalog"));
        ActionOptions options = ActionOptions.defaults()
                .withPreDelay(Duration.ofSeconds(5))
                .withPollInterval(Duration.ofMillis(500));

        resolver.resolve(Locator.of(CATALOG), options);

        assertEquals(3, device.pageSourceCalls);
        assertEquals(Duration.ofSeconds(1), clock.elapsed());
    }
}
