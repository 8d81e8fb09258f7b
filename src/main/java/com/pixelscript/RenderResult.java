package com.pixelscript;

import java.util.List;

import com.pixelscript.debug.Diagnostic;
import com.pixelscript.image.PixelBuffer;

/** Final state of a run: the buffer (if a canvas was configured), stats and diagnostics. */
public final class RenderResult {

    private final PixelBuffer buffer;
    private final int width;
    private final int height;
    private final RunStats stats;
    private final List<Diagnostic> diagnostics;

    RenderResult(PixelBuffer buffer, int width, int height, RunStats stats, List<Diagnostic> diagnostics) {
        this.buffer = buffer;
        this.width = width;
        this.height = height;
        this.stats = stats;
        this.diagnostics = diagnostics;
    }

    /** A 1x1 buffer means no {@code config:} line ever ran. */
    public boolean hasImage() {
        return width > 1 && height > 1;
    }

    public PixelBuffer buffer() { return buffer; }
    public int width() { return width; }
    public int height() { return height; }
    public RunStats stats() { return stats; }
    public List<Diagnostic> diagnostics() { return diagnostics; }
}
