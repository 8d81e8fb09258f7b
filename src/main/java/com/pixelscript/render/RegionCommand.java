package com.pixelscript.render;

import java.util.List;

import com.pixelscript.debug.Debug;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineResult;

/**
 * {@code region:ID\x1|y1\x2|y2[\shape]}. Corners may come in any order and
 * may be fractional; unknown shapes fall back to {@code rect}.
 */
public class RegionCommand extends BaseCommand {

    @Override
    public String name() { return "region"; }

    @Override
    public LineResult apply(List<String> params, DrawingContext context, PixelBuffer buffer, int width, int height) {
        requireCount(params, 3, 4);
        String id = params.get(0);
        if (id.isEmpty()) throw new CommandException("region: id must not be empty");

        int[] p1 = parsePoint(params.get(1));
        int[] p2 = parsePoint(params.get(2));

        RegionShape shape = RegionShape.RECT;
        if (params.size() == 4) {
            shape = RegionShape.fromName(params.get(3));
            if (shape == null) {
                Debug.get().w(TAG, "region " + id + ": unknown shape '" + params.get(3) + "', using rect");
                shape = RegionShape.RECT;
            }
        }

        Region region = new Region(id, p1[0], p1[1], p2[0], p2[1], shape);
        context.defineRegion(region);
        Debug.get().d(TAG, "region " + region);
        return LineResult.ok(buffer, width, height);
    }

    private int[] parsePoint(String text) {
        int bar = text.indexOf('|');
        if (bar < 0) {
            throw new CommandException("region: corner must be 'x|y', got '" + text + "'");
        }
        return new int[] {
                parseCoordinate(text.substring(0, bar), "x"),
                parseCoordinate(text.substring(bar + 1), "y")
        };
    }
}
