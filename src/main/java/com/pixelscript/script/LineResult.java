package com.pixelscript.script;

import com.pixelscript.image.PixelBuffer;

/** Outcome of executing one line: success flag plus the buffer and size to carry forward. */
public final class LineResult {

    private final boolean success;
    private final PixelBuffer buffer;
    private final int width;
    private final int height;

    public LineResult(boolean success, PixelBuffer buffer, int width, int height) {
        this.success = success;
        this.buffer = buffer;
        this.width = width;
        this.height = height;
    }

    public static LineResult ok(PixelBuffer buffer, int width, int height) {
        return new LineResult(true, buffer, width, height);
    }

    public static LineResult failed(PixelBuffer buffer, int width, int height) {
        return new LineResult(false, buffer, width, height);
    }

    public boolean success() { return success; }
    public PixelBuffer buffer() { return buffer; }
    public int width() { return width; }
    public int height() { return height; }

    /** Same buffer and size, with the success flag combined by AND. */
    public LineResult and(boolean ok) {
        if (ok || !success) return this;
        return new LineResult(false, buffer, width, height);
    }

    @Override
    public String toString() {
        return "LineResult{success=" + success + ", size=" + width + "x" + height + "}";
    }
}
