package io.hearthwarrio.mobitium.core.gesture;

import io.hearthwarrio.mobitium.core.MisconfigurationException;
import io.hearthwarrio.mobitium.core.MobitiumDefaults;

import java.util.Objects;

/**
 * Computes gesture coordinates for scrolls and swipes.
 * <p>
 * Two flavours:
 * <ul>
 *   <li>{@link #viewportScroll}: full-screen scroll, starts at {@link MobitiumDefaults#SCROLL_COEFFICIENT} of the
 *       traversed extent and runs to its edge</li>
 *   <li>{@link #elementSwipe}: swipe inside an element, kept {@link MobitiumDefaults#SWIPE_COEFFICIENT} away from both
 *       ends so the gesture does not start on a system edge</li>
 * </ul>
 * The traversed extent is {@code size * capacity} along the gesture axis; the other axis is centred.
 */
public final class SwipeGeometry {

    private final double scrollCoefficient;
    private final double swipeCoefficient;

    public SwipeGeometry() {
        this(MobitiumDefaults.SCROLL_COEFFICIENT, MobitiumDefaults.SWIPE_COEFFICIENT);
    }

    public SwipeGeometry(double scrollCoefficient, double swipeCoefficient) {
        this.scrollCoefficient = scrollCoefficient;
        this.swipeCoefficient = swipeCoefficient;
    }

    /**
     * Rejects capacities outside {@code (0, 1]}.
     *
     * @throws MisconfigurationException when the capacity is out of range
     */
    public static void requireValidCapacity(double capacity) {
        if (!(capacity > 0 && capacity <= 1.0)) {
            throw new MisconfigurationException("scrollCapacity=" + capacity + ", allowed range is (0.0; 1.0]");
        }
    }

    public SwipePath viewportScroll(Bounds viewport, ScrollDirection direction, double capacity) {
        Objects.requireNonNull(viewport, "viewport must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        requireValidCapacity(capacity);

        if (direction.isHorizontal()) {
            boolean right = direction == ScrollDirection.RIGHT;
            double width = viewport.getWidth() * capacity;
            int centerY = round(viewport.getHeight() / 2.0);
            int startX = round(right ? width * scrollCoefficient : width * (1 - scrollCoefficient));
            int endX = round(right ? 0 : width);
            return new SwipePath(startX, centerY, endX, centerY);
        }

        boolean down = direction == ScrollDirection.DOWN;
        double height = viewport.getHeight() * capacity;
        int centerX = round(viewport.getWidth() / 2.0);
        int startY = round(down ? height * scrollCoefficient : height * (1 - scrollCoefficient));
        int endY = round(down ? 0 : height);
        return new SwipePath(centerX, startY, centerX, endY);
    }

    public SwipePath elementSwipe(Bounds bounds, ScrollDirection direction, double capacity) {
        Objects.requireNonNull(bounds, "bounds must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        requireValidCapacity(capacity);

        if (direction.isHorizontal()) {
            boolean right = direction == ScrollDirection.RIGHT;
            double width = bounds.getWidth() * capacity;
            int centerY = round(bounds.getY() + bounds.getHeight() / 2.0);
            int startX = round(bounds.getX() + (right ? width * swipeCoefficient : width * (1 - swipeCoefficient)));
            int endX = round(bounds.getX() + (right ? width * (1 - swipeCoefficient) : width * swipeCoefficient));
            return new SwipePath(startX, centerY, endX, centerY);
        }

        boolean down = direction == ScrollDirection.DOWN;
        double height = bounds.getHeight() * capacity;
        int centerX = round(bounds.getX() + bounds.getWidth() / 2.0);
        int startY = round(bounds.getY() + (down ? height * swipeCoefficient : height * (1 - swipeCoefficient)));
        int endY = round(bounds.getY() + (down ? height * (1 - swipeCoefficient) : height * swipeCoefficient));
        return new SwipePath(centerX, startY, centerX, endY);
    }

    private static int round(double value) {
        return (int) Math.round(value);
    }
}
