package io.hearthwarrio.mobitium.core;

import io.hearthwarrio.mobitium.core.gesture.ScrollDirection;

import java.time.Duration;

/**
 * Default timeouts, scroll settings and gesture tuning.
 */
public final class MobitiumDefaults {

    /** Wait for the UI to settle before searching; zero disables it. */
    public static final Duration PRE_DELAY = Duration.ZERO;

    /** Search budget per query. */
    public static final Duration SEARCH_TIMEOUT = Duration.ofSeconds(10);

    public static final Duration EVENT_TIMEOUT = Duration.ofSeconds(15);

    public static final Duration POLL_INTERVAL = Duration.ofMillis(1000);

    public static final Duration EVENT_POLL_INTERVAL = Duration.ofMillis(500);

    /** 0 means no scrolling while searching. */
    public static final int SCROLL_COUNT = 0;

    /** 1.0 scrolls one full page. */
    public static final double SCROLL_CAPACITY = 1.0;

    public static final ScrollDirection SCROLL_DIRECTION = ScrollDirection.DOWN;

    /** Inset from the screen edge for full-screen scrolls. */
    public static final double SCROLL_COEFFICIENT = 0.75;

    /** Inset from the element edge for element-local swipes. */
    public static final double SWIPE_COEFFICIENT = 0.95;

    /** Event-derived clicks scroll once by default, with a shorter stroke. */
    public static final int EVENT_CLICK_SCROLL_COUNT = 1;

    public static final double EVENT_CLICK_SCROLL_CAPACITY = 0.7;

    public static final Duration GESTURE_DWELL = Duration.ofMillis(500);

    public static final Duration GESTURE_MOVE_DURATION = Duration.ofMillis(500);

    private MobitiumDefaults() {
        // constants
    }
}
