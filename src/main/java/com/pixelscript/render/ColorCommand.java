package com.pixelscript.render;

import java.util.List;

import com.pixelscript.debug.Debug;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineResult;

/** {@code color:ID\R\G\B[\A]}; alpha defaults to 255. */
public class ColorCommand extends BaseCommand {

    @Override
    public String name() { return "color"; }

    @Override
    public LineResult apply(List<String> params, DrawingContext context, PixelBuffer buffer, int width, int height) {
        requireCount(params, 4, 5);
        String id = params.get(0);
        if (id.isEmpty()) throw new CommandException("color: id must not be empty");

        int r = clampChannel(parseInt(params.get(1), "red"), "red");
        int g = clampChannel(parseInt(params.get(2), "green"), "green");
        int b = clampChannel(parseInt(params.get(3), "blue"), "blue");
        int a = params.size() == 5 ? clampChannel(parseInt(params.get(4), "alpha"), "alpha") : 255;

        RgbaColor color = new RgbaColor(r, g, b, a);
        context.defineColor(id, color);
        Debug.get().d(TAG, "color " + id + " = " + color);
        return LineResult.ok(buffer, width, height);
    }
}
