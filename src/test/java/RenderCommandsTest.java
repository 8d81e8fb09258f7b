import org.junit.jupiter.api.Test;

import com.pixelscript.image.PixelBuffer;
import com.pixelscript.render.ColorCommand;
import com.pixelscript.render.CommandException;
import com.pixelscript.render.CommandRegistry;
import com.pixelscript.render.ConfigCommand;
import com.pixelscript.render.DrawingContext;
import com.pixelscript.render.FillCommand;
import com.pixelscript.render.Region;
import com.pixelscript.render.RegionCommand;
import com.pixelscript.render.RegionShape;
import com.pixelscript.render.RgbaColor;
import com.pixelscript.render.VarCommand;
import com.pixelscript.script.LineResult;
import com.pixelscript.script.expr.Value;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RenderCommandsTest {

    private static final int WHITE = PixelBuffer.pack(255, 255, 255, 255);
    private static final int RED = PixelBuffer.pack(255, 0, 0, 255);

    private final DrawingContext ctx = new DrawingContext();
    private final PixelBuffer canvas = PixelBuffer.filled(4, 4, 255, 255, 255);

    private LineResult run(com.pixelscript.render.PixelCommand cmd, String... params) {
        return cmd.apply(Arrays.asList(params), ctx, canvas, 4, 4);
    }

    @Test
    void configCreatesFreshCanvas() {
        LineResult r = run(new ConfigCommand(), "3", "2", "10", "20", "30");
        assertTrue(r.success());
        assertNotSame(canvas, r.buffer());
        assertEquals(3, r.width());
        assertEquals(2, r.height());
        assertEquals(PixelBuffer.pack(10, 20, 30, 255), r.buffer().getPixel(2, 1));
    }

    @Test
    void configRejectsBadSizes() {
        assertThrows(CommandException.class, () -> run(new ConfigCommand(), "0", "2", "0", "0", "0"));
        assertThrows(CommandException.class, () -> run(new ConfigCommand(), "x", "2", "0", "0", "0"));
        assertThrows(CommandException.class, () -> run(new ConfigCommand(), "4", "2", "0", "0"));
        assertThrows(CommandException.class, () -> run(new ConfigCommand(), "46341", "46341", "0", "0", "0"));
        assertThrows(CommandException.class, () -> run(new ConfigCommand(), "65536", "65536", "0", "0", "0"));
        assertTrue(run(new ConfigCommand(), "4096", "4096", "0", "0", "0").success());
    }

    @Test
    void colorChannelsAreClampedAndAlphaDefaults() {
        run(new ColorCommand(), "hot", "300", "-5", "128");
        assertEquals(new RgbaColor(255, 0, 128, 255), ctx.color("hot"));
        run(new ColorCommand(), "glass", "0", "0", "0", "128");
        assertEquals(128, ctx.color("glass").a());
        assertThrows(CommandException.class, () -> run(new ColorCommand(), "c", "1", "2"));
        assertThrows(CommandException.class, () -> run(new ColorCommand(), "c", "1", "2", "blue"));
    }

    @Test
    void regionCornersAreOrderedAndTruncated() {
        run(new RegionCommand(), "r", "3.9|3", "0|0.7");
        Region r = ctx.region("r");
        assertEquals(0, r.x1());
        assertEquals(0, r.y1());
        assertEquals(3, r.x2());
        assertEquals(3, r.y2());
        assertEquals(RegionShape.RECT, r.shape());
        assertThrows(CommandException.class, () -> run(new RegionCommand(), "r", "3,3", "0|0"));
    }

    @Test
    void unknownShapeFallsBackToRect() {
        run(new RegionCommand(), "h", "0|0", "3|3", "hexagon");
        assertEquals(RegionShape.RECT, ctx.region("h").shape());
        run(new RegionCommand(), "e", "0|0", "3|3", "Ellipse");
        assertEquals(RegionShape.ELLIPSE, ctx.region("e").shape());
    }

    @Test
    void fillPaintsOpaqueRegion() {
        run(new ColorCommand(), "red", "255", "0", "0");
        run(new RegionCommand(), "box", "1|1", "2|2");
        assertTrue(run(new FillCommand(), "box", "red").success());
        assertEquals(RED, canvas.getPixel(1, 1));
        assertEquals(RED, canvas.getPixel(2, 2));
        assertEquals(WHITE, canvas.getPixel(0, 0));
        assertEquals(WHITE, canvas.getPixel(3, 3));
    }

    @Test
    void fillClipsToBuffer() {
        run(new ColorCommand(), "red", "255", "0", "0");
        run(new RegionCommand(), "edge", "-5|-5", "1|1");
        run(new RegionCommand(), "away", "10|10", "12|12");
        assertTrue(run(new FillCommand(), "edge", "red").success());
        assertTrue(run(new FillCommand(), "away", "red").success());
        assertEquals(RED, canvas.getPixel(0, 0));
        assertEquals(RED, canvas.getPixel(1, 1));
        assertEquals(WHITE, canvas.getPixel(2, 2));
    }

    @Test
    void translucentFillBlends() {
        run(new ColorCommand(), "shade", "0", "0", "0", "128");
        run(new RegionCommand(), "all", "0|0", "3|3");
        run(new FillCommand(), "all", "shade");
        assertEquals(PixelBuffer.pack(127, 127, 127, 255), canvas.getPixel(2, 2));
    }

    @Test
    void fillNeedsKnownNames() {
        run(new ColorCommand(), "red", "255", "0", "0");
        assertThrows(CommandException.class, () -> run(new FillCommand(), "nowhere", "red"));
        run(new RegionCommand(), "box", "0|0", "1|1");
        assertThrows(CommandException.class, () -> run(new FillCommand(), "box", "mauve"));
    }

    @Test
    void varStoresNumbersAndText() {
        run(new VarCommand(), "size", "10");
        run(new VarCommand(), "ratio", "-0.5");
        run(new VarCommand(), "theme", "dark");
        assertEquals(Value.number(10), ctx.variables().get("size"));
        assertEquals(Value.number(-0.5), ctx.variables().get("ratio"));
        assertEquals(Value.string("dark"), ctx.variables().get("theme"));
        assertThrows(CommandException.class, () -> run(new VarCommand(), "1bad", "x"));
        assertThrows(CommandException.class, () -> run(new VarCommand(), "lonely"));
    }

    @Test
    void shapeMasks() {
        assertTrue(RegionShape.ELLIPSE.contains(4, 4, 9, 9));
        assertTrue(RegionShape.ELLIPSE.contains(0, 4, 9, 9));
        assertFalse(RegionShape.ELLIPSE.contains(0, 0, 9, 9));

        assertTrue(RegionShape.TRIANGLE.contains(4, 4, 9, 9));
        assertFalse(RegionShape.TRIANGLE.contains(0, 0, 9, 9));
        assertFalse(RegionShape.TRIANGLE.contains(8, 0, 9, 9));

        assertTrue(RegionShape.DIAMOND.contains(4, 4, 9, 9));
        assertFalse(RegionShape.DIAMOND.contains(0, 0, 9, 9));
        assertFalse(RegionShape.DIAMOND.contains(8, 8, 9, 9));

        assertTrue(RegionShape.CROSS.contains(4, 0, 9, 9));
        assertTrue(RegionShape.CROSS.contains(0, 4, 9, 9));
        assertFalse(RegionShape.CROSS.contains(0, 0, 9, 9));

        assertTrue(RegionShape.RECT.contains(0, 0, 9, 9));
        assertNull(RegionShape.fromName("star"));
    }

    @Test
    void registryLookupIgnoresCase() {
        CommandRegistry registry = CommandRegistry.withDefaults();
        assertNotNull(registry.get("FILL"));
        assertNotNull(registry.get(" config "));
        assertNull(registry.get("paint"));
        assertEquals(5, registry.all().size());
    }
}
