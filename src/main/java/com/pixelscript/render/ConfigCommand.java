package com.pixelscript.render;

import java.util.List;

import com.pixelscript.debug.Debug;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineResult;

/** {@code config:W\H\R\G\B} replaces the buffer with a fresh opaque canvas. */
public class ConfigCommand extends BaseCommand {

    @Override
    public String name() { return "config"; }

    @Override
    public LineResult apply(List<String> params, DrawingContext context, PixelBuffer buffer, int width, int height) {
        requireCount(params, 5, 5);
        int w = parseInt(params.get(0), "width");
        int h = parseInt(params.get(1), "height");
        if (w <= 0 || h <= 0) {
            throw new CommandException("config: image size must be positive, got " + w + "x" + h);
        }
        if ((long) w * h > PixelBuffer.MAX_PIXELS) {
            throw new CommandException("config: image size " + w + "x" + h + " exceeds "
                    + PixelBuffer.MAX_PIXELS + " pixels");
        }
        int r = clampChannel(parseInt(params.get(2), "red"), "red");
        int g = clampChannel(parseInt(params.get(3), "green"), "green");
        int b = clampChannel(parseInt(params.get(4), "blue"), "blue");

        Debug.get().i(TAG, "canvas " + w + "x" + h + ", background (" + r + "," + g + "," + b + ")");
        return LineResult.ok(PixelBuffer.filled(w, h, r, g, b), w, h);
    }
}
