package com.pixelscript.render;

import java.util.List;

import com.pixelscript.debug.Debug;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineResult;

/** {@code fill:REGION\COLOR} paints a region's mask, clipped to the buffer. */
public class FillCommand extends BaseCommand {

    @Override
    public String name() { return "fill"; }

    @Override
    public LineResult apply(List<String> params, DrawingContext context, PixelBuffer buffer, int width, int height) {
        requireCount(params, 2, 2);
        Region region = context.region(params.get(0));
        if (region == null) throw new CommandException("fill: unknown region '" + params.get(0) + "'");
        RgbaColor color = context.color(params.get(1));
        if (color == null) throw new CommandException("fill: unknown color '" + params.get(1) + "'");

        int xs = Math.max(0, region.x1());
        int ys = Math.max(0, region.y1());
        int xe = Math.min(buffer.width() - 1, region.x2());
        int ye = Math.min(buffer.height() - 1, region.y2());
        if (xs > xe || ys > ye) {
            Debug.get().w(TAG, "fill: region " + region.id() + " is outside the image, skipped");
            return LineResult.ok(buffer, width, height);
        }

        int painted = 0;
        for (int y = ys; y <= ye; y++) {
            for (int x = xs; x <= xe; x++) {
                if (!region.covers(x, y)) continue;
                if (color.isOpaque()) {
                    buffer.setPixel(x, y, color.r(), color.g(), color.b(), 255);
                } else {
                    buffer.blendPixel(x, y, color.r(), color.g(), color.b(), color.a());
                }
                painted++;
            }
        }
        Debug.get().d(TAG, "fill " + region.id() + " with " + params.get(1) + ": " + painted + " px");
        return LineResult.ok(buffer, width, height);
    }
}
