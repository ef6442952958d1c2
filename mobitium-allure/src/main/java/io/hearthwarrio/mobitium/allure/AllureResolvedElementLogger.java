package io.hearthwarrio.mobitium.allure;

import io.hearthwarrio.mobitium.appium.DeviceSession;
import io.hearthwarrio.mobitium.appium.ResolvedElementLogger;
import io.hearthwarrio.mobitium.core.locator.Query;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Allure logger for resolved elements.
 * <p>
 * Lives in mobitium-allure to avoid leaking Allure dependency into core/appium.
 */
public final class AllureResolvedElementLogger implements ResolvedElementLogger {

    private final DeviceSession device;
    private final boolean attachScreenshot;

    public AllureResolvedElementLogger(DeviceSession device, boolean attachScreenshot) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public void logResolvedElement(String target, Query query, int ordinal, int scrolls, List<Query> failedQueries) {
        boolean fallback = failedQueries != null && !failedQueries.isEmpty();
        String title = "Mobitium: " + safe(target) + (fallback ? " (fallback)" : "");

        Allure.step(title, () -> {
            StringBuilder sb = new StringBuilder(512);
            sb.append("target: ").append(safe(target)).append('\n')
                    .append("query: ").append(query).append('\n')
                    .append("ordinal: ").append(ordinal).append('\n')
                    .append("scrolls: ").append(scrolls).append('\n');
            if (fallback) {
                sb.append("failed before: ").append(failedQueries).append('\n');
            }

            Allure.addAttachment(
                    "Resolved element",
                    "text/plain",
                    new ByteArrayInputStream(sb.toString().getBytes(StandardCharsets.UTF_8)),
                    ".txt"
            );

            if (attachScreenshot) {
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(device.getScreenshot()),
                        ".png"
                );
            }
        });
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
