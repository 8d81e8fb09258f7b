package com.pixelscript.image;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Mutable ARGB raster. Pixels are packed 0xAARRGGBB, row-major.
 */
public final class PixelBuffer {

    /** 4096 x 4096. */
    public static final int MAX_PIXELS = 1 << 24;

    private final int width;
    private final int height;
    private final int[] argb;

    public PixelBuffer(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + width + "x" + height);
        }
        if ((long) width * height > MAX_PIXELS) {
            throw new IllegalArgumentException("Buffer too large: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.argb = new int[width * height];
    }

    private PixelBuffer(int width, int height, int[] argb) {
        this.width = width;
        this.height = height;
        this.argb = argb;
    }

    /** Fully opaque buffer filled with one color. */
    public static PixelBuffer filled(int width, int height, int r, int g, int b) {
        PixelBuffer buf = new PixelBuffer(width, height);
        Arrays.fill(buf.argb, pack(r, g, b, 255));
        return buf;
    }

    public int width() { return width; }
    public int height() { return height; }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, Arrays.copyOf(argb, argb.length));
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int getPixel(int x, int y) {
        return argb[y * width + x];
    }

    public void setPixel(int x, int y, int r, int g, int b, int a) {
        if (!contains(x, y)) return;
        argb[y * width + x] = pack(r, g, b, a);
    }

    /** Source-over blend of a translucent color onto the pixel at (x, y). */
    public void blendPixel(int x, int y, int r, int g, int b, int a) {
        if (!contains(x, y)) return;
        if (a >= 255) {
            setPixel(x, y, r, g, b, 255);
            return;
        }
        if (a <= 0) return;

        int cur = getPixel(x, y);
        double alpha = a / 255.0;
        double curA = ((cur >>> 24) & 0xFF) / 255.0;
        double outA = alpha + curA * (1 - alpha);

        int nr = (int) Math.round((r * alpha + ((cur >> 16) & 0xFF) * curA * (1 - alpha)) / outA);
        int ng = (int) Math.round((g * alpha + ((cur >> 8) & 0xFF) * curA * (1 - alpha)) / outA);
        int nb = (int) Math.round((b * alpha + (cur & 0xFF) * curA * (1 - alpha)) / outA);
        setPixel(x, y, nr, ng, nb, (int) Math.round(outA * 255));
    }

    public BufferedImage toBufferedImage() {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, width, height, argb, 0, width);
        return img;
    }

    public static int clampChannel(int v) {
        return Math.max(0, Math.min(255, v));
    }

    public static int pack(int r, int g, int b, int a) {
        return (clampChannel(a) << 24) | (clampChannel(r) << 16) | (clampChannel(g) << 8) | clampChannel(b);
    }
}
