package com.pixelscript.render;

import java.util.List;

import com.pixelscript.debug.Debug;
import com.pixelscript.image.PixelBuffer;

/** Shared parameter checks for the built-in commands. */
public abstract class BaseCommand implements PixelCommand {

    protected static final String TAG = "pixelscript.cmd";

    protected void requireCount(List<String> params, int min, int max) {
        int n = params.size();
        if (n < min || n > max) {
            String expected = (min == max) ? String.valueOf(min) : min + "-" + max;
            throw new CommandException(name() + " needs " + expected + " parameters, got " + n);
        }
    }

    protected int parseInt(String text, String what) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new CommandException(name() + ": " + what + " must be an integer, got '" + text + "'", e);
        }
    }

    /** Integer or floating text, truncated toward zero. */
    protected int parseCoordinate(String text, String what) {
        String t = text.trim();
        try {
            return Integer.parseInt(t);
        } catch (NumberFormatException notInt) {
            try {
                double d = Double.parseDouble(t);
                if (Double.isNaN(d) || Double.isInfinite(d)) throw notInt;
                return (int) d;
            } catch (NumberFormatException e) {
                throw new CommandException(name() + ": " + what + " must be a number, got '" + text + "'", e);
            }
        }
    }

    protected int clampChannel(int value, String what) {
        int c = PixelBuffer.clampChannel(value);
        if (c != value) {
            Debug.get().w(TAG, name() + ": " + what + " " + value + " out of range, clamped to " + c);
        }
        return c;
    }
}
