package io.hearthwarrio.mobitium.core.gesture;

import java.util.Objects;

/**
 * Start and end coordinates of one directional gesture.
 */
public final class SwipePath {

    private final int startX;
    private final int startY;
    private final int endX;
    private final int endY;

    public SwipePath(int startX, int startY, int endX, int endY) {
        this.startX = startX;
        this.startY = startY;
        this.endX = endX;
        this.endY = endY;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SwipePath)) {
            return false;
        }
        SwipePath other = (SwipePath) o;
        return startX == other.startX && startY == other.startY && endX == other.endX && endY == other.endY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startX, startY, endX, endY);
    }

    @Override
    public String toString() {
        return "(" + startX + "," + startY + ") -> (" + endX + "," + endY + ")";
    }
}
