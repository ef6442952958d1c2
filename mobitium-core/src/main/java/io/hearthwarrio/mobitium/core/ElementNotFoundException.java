package io.hearthwarrio.mobitium.core;

import io.hearthwarrio.mobitium.core.locator.Query;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when no visible element matched within the search and scroll budget.
 * <p>
 * Carries every query that was tried, the ones that failed, the number of scrolls performed and the last underlying
 * error (also available as {@link #getCause()}).
 */
public class ElementNotFoundException extends RuntimeException {

    private final List<Query> attemptedQueries;
    private final List<Query> failedQueries;
    private final int scrollsPerformed;
    private final Duration searchTimeout;

    public ElementNotFoundException(
            String message,
            List<Query> attemptedQueries,
            List<Query> failedQueries,
            int scrollsPerformed,
            Duration searchTimeout,
            Throwable lastError
    ) {
        super(message, lastError);
        this.attemptedQueries = Collections.unmodifiableList(attemptedQueries);
        this.failedQueries = Collections.unmodifiableList(failedQueries);
        this.scrollsPerformed = scrollsPerformed;
        this.searchTimeout = searchTimeout;
    }

    public List<Query> getAttemptedQueries() {
        return attemptedQueries;
    }

    public List<Query> getFailedQueries() {
        return failedQueries;
    }

    public int getScrollsPerformed() {
        return scrollsPerformed;
    }

    public Duration getSearchTimeout() {
        return searchTimeout;
    }
}
