package com.pixelscript.render;

/** Named color registered by {@code color:}. Channels are already clamped to 0-255. */
public final class RgbaColor {

    private final int r;
    private final int g;
    private final int b;
    private final int a;

    public RgbaColor(int r, int g, int b, int a) {
        this.r = r;
        this.g = g;
        this.b = b;
        this.a = a;
    }

    public int r() { return r; }
    public int g() { return g; }
    public int b() { return b; }
    public int a() { return a; }

    public boolean isOpaque() { return a >= 255; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RgbaColor)) return false;
        RgbaColor c = (RgbaColor) o;
        return r == c.r && g == c.g && b == c.b && a == c.a;
    }

    @Override
    public int hashCode() {
        return ((a * 31 + r) * 31 + g) * 31 + b;
    }

    @Override
    public String toString() {
        return "(" + r + "," + g + "," + b + "," + a + ")";
    }
}
