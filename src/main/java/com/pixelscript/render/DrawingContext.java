package com.pixelscript.render;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.pixelscript.script.VariableStore;

/**
 * Per-run tables read and written by the drawing commands. Owned by the
 * runner and passed to every command; nothing here is static.
 */
public final class DrawingContext {

    private final Map<String, RgbaColor> colors = new LinkedHashMap<>();
    private final Map<String, Region> regions = new LinkedHashMap<>();
    private final VariableStore variables;

    public DrawingContext() {
        this(new VariableStore());
    }

    public DrawingContext(VariableStore variables) {
        this.variables = variables;
    }

    public void defineColor(String id, RgbaColor color) { colors.put(id, color); }
    public RgbaColor color(String id) { return colors.get(id); }
    public Map<String, RgbaColor> colors() { return Collections.unmodifiableMap(colors); }

    public void defineRegion(Region region) { regions.put(region.id(), region); }
    public Region region(String id) { return regions.get(id); }
    public Map<String, Region> regions() { return Collections.unmodifiableMap(regions); }

    public VariableStore variables() { return variables; }

    /** Drops colors, regions and variables. */
    public void clear() {
        colors.clear();
        regions.clear();
        variables.clear();
    }
}
