package io.hearthwarrio.mobitium.core.gesture;

/**
 * Direction in which content is scrolled (the finger travels the opposite way).
 */
public enum ScrollDirection {
    DOWN,
    UP,
    LEFT,
    RIGHT;

    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT;
    }
}
