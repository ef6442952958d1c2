package io.hearthwarrio.mobitium.core.gesture;

/**
 * On-screen rectangle in device pixels.
 */
public final class Bounds {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public Bounds(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * Full viewport of the given size, anchored at the origin.
     */
    public static Bounds viewport(int width, int height) {
        return new Bounds(0, 0, width, height);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "Bounds{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + '}';
    }
}
