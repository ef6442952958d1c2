package io.hearthwarrio.mobitium.core;

import io.hearthwarrio.mobitium.core.gesture.ScrollDirection;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call knobs of a UI action: which match to take, how long to wait and how to scroll.
 * <p>
 * Immutable; every {@code withX} call returns a modified copy.
 *
 * <pre>
 * ActionOptions.defaults().withOrdinal(2).withScrollCount(3)
 * </pre>
 */
public final class ActionOptions {

    private static final ActionOptions DEFAULTS = new ActionOptions(
            null,
            MobitiumDefaults.PRE_DELAY,
            MobitiumDefaults.SEARCH_TIMEOUT,
            MobitiumDefaults.POLL_INTERVAL,
            MobitiumDefaults.SCROLL_COUNT,
            MobitiumDefaults.SCROLL_CAPACITY,
            MobitiumDefaults.SCROLL_DIRECTION
    );

    private final Integer ordinal;
    private final Duration preDelay;
    private final Duration searchTimeout;
    private final Duration pollInterval;
    private final int scrollCount;
    private final double scrollCapacity;
    private final ScrollDirection scrollDirection;

    private ActionOptions(
            Integer ordinal,
            Duration preDelay,
            Duration searchTimeout,
            Duration pollInterval,
            int scrollCount,
            double scrollCapacity,
            ScrollDirection scrollDirection
    ) {
        this.ordinal = ordinal;
        this.preDelay = Objects.requireNonNull(preDelay, "preDelay must not be null");
        this.searchTimeout = Objects.requireNonNull(searchTimeout, "searchTimeout must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.scrollCount = scrollCount;
        this.scrollCapacity = scrollCapacity;
        this.scrollDirection = Objects.requireNonNull(scrollDirection, "scrollDirection must not be null");
    }

    public static ActionOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 1-based index among the matches of one query; {@code null} means the first match.
     */
    public ActionOptions withOrdinal(Integer ordinal) {
        if (ordinal != null && ordinal < 1) {
            throw new MisconfigurationException("ordinal must be >= 1, got " + ordinal);
        }
        return new ActionOptions(ordinal, preDelay, searchTimeout, pollInterval, scrollCount, scrollCapacity, scrollDirection);
    }

    public ActionOptions withPreDelay(Duration preDelay) {
        return new ActionOptions(ordinal, preDelay, searchTimeout, pollInterval, scrollCount, scrollCapacity, scrollDirection);
    }

    public ActionOptions withSearchTimeout(Duration searchTimeout) {
        return new ActionOptions(ordinal, preDelay, searchTimeout, pollInterval, scrollCount, scrollCapacity, scrollDirection);
    }

    public ActionOptions withPollInterval(Duration pollInterval) {
        return new ActionOptions(ordinal, preDelay, searchTimeout, pollInterval, scrollCount, scrollCapacity, scrollDirection);
    }

    public ActionOptions withScrollCount(int scrollCount) {
        if (scrollCount < 0) {
            throw new MisconfigurationException("scrollCount must be >= 0, got " + scrollCount);
        }
        return new ActionOptions(ordinal, preDelay, searchTimeout, pollInterval, scrollCount, scrollCapacity, scrollDirection);
    }

    /**
     * Not validated here: an out-of-range capacity is reported by the action that uses it, before any device call.
     */
    public ActionOptions withScrollCapacity(double scrollCapacity) {
        return new ActionOptions(ordinal, preDelay, searchTimeout, pollInterval, scrollCount, scrollCapacity, scrollDirection);
    }

    public ActionOptions withScrollDirection(ScrollDirection scrollDirection) {
        return new ActionOptions(ordinal, preDelay, searchTimeout, pollInterval, scrollCount, scrollCapacity, scrollDirection);
    }

    public Integer getOrdinal() {
        return ordinal;
    }

    /**
     * Ordinal with the "first match" default applied.
     */
    public int effectiveOrdinal() {
        return ordinal == null ? 1 : ordinal;
    }

    public Duration getPreDelay() {
        return preDelay;
    }

    public Duration getSearchTimeout() {
        return searchTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getScrollCount() {
        return scrollCount;
    }

    public double getScrollCapacity() {
        return scrollCapacity;
    }

    public ScrollDirection getScrollDirection() {
        return scrollDirection;
    }

    @Override
    public String toString() {
        return "ActionOptions{" +
                "ordinal=" + ordinal +
                ", preDelay=" + preDelay +
                ", searchTimeout=" + searchTimeout +
                ", pollInterval=" + pollInterval +
                ", scrollCount=" + scrollCount +
                ", scrollCapacity=" + scrollCapacity +
                ", scrollDirection=" + scrollDirection +
                '}';
    }
}
