package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.gesture.Bounds;
import io.hearthwarrio.mobitium.core.gesture.ScrollDirection;
import io.hearthwarrio.mobitium.core.gesture.SwipeGeometry;

import java.util.Objects;

/**
 * Executes viewport scrolls and element-local swipes.
 * <p>
 * The capacity is validated before the device is touched; geometry comes from {@link SwipeGeometry}.
 */
public final class GesturePerformer {

    private final DeviceSession session;
    private final SwipeGeometry geometry;

    public GesturePerformer(DeviceSession session) {
        this(session, new SwipeGeometry());
    }

    public GesturePerformer(DeviceSession session, SwipeGeometry geometry) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.geometry = Objects.requireNonNull(geometry, "geometry must not be null");
    }

    /**
     * Scrolls the whole screen {@code count} times.
     *
     * @throws io.hearthwarrio.mobitium.core.MisconfigurationException if the capacity is outside {@code (0, 1]}
     */
    public void scroll(int count, double capacity, ScrollDirection direction) {
        Objects.requireNonNull(direction, "direction must not be null");
        SwipeGeometry.requireValidCapacity(capacity);
        if (count <= 0) {
            return;
        }
        Bounds viewport = session.getWindowSize();
        for (int i = 0; i < count; i++) {
            session.perform(Gesture.swipe(geometry.viewportScroll(viewport, direction, capacity)));
        }
    }

    /**
     * Swipes inside the element's bounds {@code count} times.
     *
     * @throws io.hearthwarrio.mobitium.core.MisconfigurationException if the capacity is outside {@code (0, 1]}
     */
    public void swipe(DeviceElement element, int count, double capacity, ScrollDirection direction) {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        SwipeGeometry.requireValidCapacity(capacity);
        if (count <= 0) {
            return;
        }
        Bounds bounds = element.getBounds();
        for (int i = 0; i < count; i++) {
            session.perform(Gesture.swipe(geometry.elementSwipe(bounds, direction, capacity)));
        }
    }
}
