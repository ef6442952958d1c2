package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.MobitiumDefaults;
import io.hearthwarrio.mobitium.core.gesture.SwipePath;

import java.time.Duration;
import java.util.Objects;

/**
 * One single-finger touch gesture.
 * <p>
 * A {@link Kind#TAP} is: move to start (0 ms), down, up.
 * A {@link Kind#SWIPE} is: move to start (0 ms), down, pause {@code dwell}, move to end over {@code moveDuration}, up.
 */
public final class Gesture {

    public enum Kind {
        TAP,
        SWIPE
    }

    private final Kind kind;
    private final int startX;
    private final int startY;
    private final int endX;
    private final int endY;
    private final Duration dwell;
    private final Duration moveDuration;

    private Gesture(Kind kind, int startX, int startY, int endX, int endY, Duration dwell, Duration moveDuration) {
        this.kind = kind;
        this.startX = startX;
        this.startY = startY;
        this.endX = endX;
        this.endY = endY;
        this.dwell = Objects.requireNonNull(dwell, "dwell must not be null");
        this.moveDuration = Objects.requireNonNull(moveDuration, "moveDuration must not be null");
    }

    public static Gesture tap(int x, int y) {
        return new Gesture(Kind.TAP, x, y, x, y, Duration.ZERO, Duration.ZERO);
    }

    public static Gesture swipe(SwipePath path) {
        return swipe(path, MobitiumDefaults.GESTURE_DWELL, MobitiumDefaults.GESTURE_MOVE_DURATION);
    }

    public static Gesture swipe(SwipePath path, Duration dwell, Duration moveDuration) {
        Objects.requireNonNull(path, "path must not be null");
        return new Gesture(Kind.SWIPE, path.getStartX(), path.getStartY(), path.getEndX(), path.getEndY(),
                dwell, moveDuration);
    }

    public Kind getKind() {
        return kind;
    }

    public int getStartX() {
        return startX;
    }

    public int getStartY() {
        return startY;
    }

    public int getEndX() {
        return endX;
    }

    public int getEndY() {
        return endY;
    }

    public Duration getDwell() {
        return dwell;
    }

    public Duration getMoveDuration() {
        return moveDuration;
    }

    /**
     * @return start/end coordinates of a swipe
     */
    public SwipePath path() {
        return new SwipePath(startX, startY, endX, endY);
    }

    @Override
    public String toString() {
        if (kind == Kind.TAP) {
            return "tap(" + startX + "," + startY + ")";
        }
        return "swipe" + path();
    }
}
