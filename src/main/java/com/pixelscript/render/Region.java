package com.pixelscript.render;

/** Named area registered by {@code region:}; corners are inclusive and ordered. */
public final class Region {

    private final String id;
    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;
    private final RegionShape shape;

    public Region(String id, int x1, int y1, int x2, int y2, RegionShape shape) {
        this.id = id;
        this.x1 = Math.min(x1, x2);
        this.y1 = Math.min(y1, y2);
        this.x2 = Math.max(x1, x2);
        this.y2 = Math.max(y1, y2);
        this.shape = shape == null ? RegionShape.RECT : shape;
    }

    public String id() { return id; }
    public int x1() { return x1; }
    public int y1() { return y1; }
    public int x2() { return x2; }
    public int y2() { return y2; }
    public RegionShape shape() { return shape; }

    public int boxWidth() { return x2 - x1 + 1; }
    public int boxHeight() { return y2 - y1 + 1; }

    /** Whether absolute pixel (x, y) is covered by this region's mask. */
    public boolean covers(int x, int y) {
        if (x < x1 || x > x2 || y < y1 || y > y2) return false;
        return shape.contains(x - x1, y - y1, boxWidth(), boxHeight());
    }

    @Override
    public String toString() {
        return id + "=(" + x1 + "," + y1 + ")-(" + x2 + "," + y2 + ") " + shape.displayName();
    }
}
