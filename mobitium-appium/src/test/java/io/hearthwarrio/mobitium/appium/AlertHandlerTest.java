package io.hearthwarrio.mobitium.appium;

import org.junit.jupiter.api.Test;
import org.openqa.selenium.TimeoutException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class AlertHandlerTest {

    private final ManualClock clock = new ManualClock();
    private final FakeDeviceSession device = new FakeDeviceSession();
    private final AlertHandler alert = new AlertHandler(device, Duration.ofSeconds(2), Duration.ofMillis(500),
            clock.polling());

    @Test
    void notPresentAfterTimeout() {
        assertFalse(alert.isPresent());
        assertFalse(clock.elapsed().compareTo(Duration.ofSeconds(2)) < 0);
    }

    @Test
    void readsTextOnceAlertShowsUp() {
        device.alert("Allow notifications?", 2);

        assertEquals("Allow notifications?", alert.getText());
        assertEquals(Duration.ofSeconds(1), clock.elapsed());
    }

    @Test
    void acceptsAndDismisses() {
        device.alert("Allow location?", 0);
        alert.accept();
        assertEquals(1, device.alertAccepted);

        device.alert("Allow camera?", 1);
        alert.dismiss();
        assertEquals(1, device.alertDismissed);
    }

    @Test
    void acceptWithoutAlertTimesOut() {
        assertThrows(TimeoutException.class, alert::accept);
        assertEquals(0, device.alertAccepted);
    }
}
