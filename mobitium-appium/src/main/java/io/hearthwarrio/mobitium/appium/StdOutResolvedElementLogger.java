package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.locator.Query;

import java.util.List;

/**
 * Default stdout logger for resolved elements.
 * <p>
 * Adds a "fallback" marker when earlier alternatives of the locator failed.
 */
public final class StdOutResolvedElementLogger implements ResolvedElementLogger {

    @Override
    public void logResolvedElement(String target, Query query, int ordinal, int scrolls, List<Query> failedQueries) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[Mobitium] target='").append(safe(target)).append('\'')
                .append(", query=").append(query);

        if (ordinal > 1) {
            sb.append(", ordinal=").append(ordinal);
        }
        if (scrolls > 0) {
            sb.append(", scrolls=").append(scrolls);
        }
        if (failedQueries != null && !failedQueries.isEmpty()) {
            sb.append(", fallback after ").append(failedQueries);
        }

        System.out.println(sb);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
