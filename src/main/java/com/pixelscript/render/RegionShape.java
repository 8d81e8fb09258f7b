package com.pixelscript.render;

import java.util.Locale;

/**
 * Masks for the predefined region shapes. Coordinates passed to
 * {@link #contains} are relative to the region's top-left corner, with
 * {@code w} and {@code h} the inclusive box size in pixels.
 */
public enum RegionShape {
    RECT {
        @Override
        public boolean contains(int x, int y, int w, int h) {
            return true;
        }
    },
    ELLIPSE {
        @Override
        public boolean contains(int x, int y, int w, int h) {
            int cx = w / 2;
            int cy = h / 2;
            double dx = (x - cx) / (w / 2.0);
            double dy = (y - cy) / (h / 2.0);
            return dx * dx + dy * dy <= 1.0;
        }
    },
    TRIANGLE {
        @Override
        public boolean contains(int x, int y, int w, int h) {
            int[][] poly = { { w / 2, 0 }, { 0, h - 1 }, { w - 1, h - 1 } };
            return insidePolygon(x, y, poly);
        }
    },
    DIAMOND {
        @Override
        public boolean contains(int x, int y, int w, int h) {
            int cx = w / 2;
            int cy = h / 2;
            int[][] poly = { { cx, 0 }, { w - 1, cy }, { cx, h - 1 }, { 0, cy } };
            return insidePolygon(x, y, poly);
        }
    },
    CROSS {
        @Override
        public boolean contains(int x, int y, int w, int h) {
            int half = (Math.min(w, h) / 3) / 2;
            return Math.abs(y - h / 2) <= half || Math.abs(x - w / 2) <= half;
        }
    };

    public abstract boolean contains(int x, int y, int w, int h);

    /** Case-insensitive lookup; null when the name is not a known shape. */
    public static RegionShape fromName(String name) {
        if (name == null) return null;
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (RegionShape s : values()) {
            if (s.name().equals(n)) return s;
        }
        return null;
    }

    // Ray casting; a point exactly on a vertex row is counted once.
    static boolean insidePolygon(int x, int y, int[][] poly) {
        boolean inside = false;
        int n = poly.length;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            int xi = poly[i][0], yi = poly[i][1];
            int xj = poly[j][0], yj = poly[j][1];
            if (y > Math.min(yi, yj) && y <= Math.max(yi, yj) && x <= Math.max(xi, xj)) {
                double xCross = (double) (y - yj) * (xi - xj) / (yi - yj) + xj;
                if (xi == xj || x <= xCross) inside = !inside;
            }
        }
        return inside;
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
