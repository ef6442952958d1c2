package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.locator.Query;

import java.util.List;

/**
 * Receives information about a resolved element.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface ResolvedElementLogger {

    /**
     * Called after an element was found and is visible.
     *
     * @param target        human-readable target description
     * @param query         query that produced the element
     * @param ordinal       1-based index of the element among the query's matches
     * @param scrolls       scrolls performed before the element was found
     * @param failedQueries alternatives that failed before {@code query} succeeded (empty when none)
     */
    void logResolvedElement(String target, Query query, int ordinal, int scrolls, List<Query> failedQueries);
}
