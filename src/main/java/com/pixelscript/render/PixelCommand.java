package com.pixelscript.render;

import java.util.List;

import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineResult;

/** One {@code name:params} drawing instruction. Parameters arrive already split and resolved. */
public interface PixelCommand {

    String name();

    /**
     * @throws CommandException when the parameters are unusable; the runner
     *         turns this into a failed line
     */
    LineResult apply(List<String> params, DrawingContext context, PixelBuffer buffer, int width, int height);
}
