package io.hearthwarrio.mobitium.allure;

import io.hearthwarrio.mobitium.core.event.EventMatchLogger;
import io.hearthwarrio.mobitium.core.event.TelemetryEvent;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reports consumed telemetry events as Allure steps with the request body attached.
 * <p>
 * Stored events and background matches happen off the test thread, where Allure has no running test case; they are
 * not reported.
 */
public final class AllureEventMatchLogger implements EventMatchLogger {

    @Override
    public void eventStored(TelemetryEvent event) {
        // off the test thread
    }

    @Override
    public void eventMatched(TelemetryEvent event, String pattern, boolean background) {
        if (background) {
            return;
        }
        Allure.step("Mobitium event: " + event.getName() + " #" + event.getSequenceNumber(), () -> {
            if (pattern != null) {
                attach("Pattern", pattern);
            }
            if (event.getData() != null && event.getData().getBody() != null) {
                attach("Event body", event.getData().getBody());
            }
        });
    }

    private static void attach(String name, String json) {
        Allure.addAttachment(
                name,
                "application/json",
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)),
                ".json"
        );
    }
}
