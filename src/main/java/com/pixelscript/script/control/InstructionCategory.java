package com.pixelscript.script.control;

import java.util.Locale;

/** Execution order inside an expanded instruction list: colors, then regions, then everything else. */
public enum InstructionCategory {
    COLOR,
    REGION,
    OTHER;

    public static InstructionCategory classify(String instruction) {
        String s = instruction == null ? "" : instruction.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("color:")) return COLOR;
        if (s.startsWith("region:")) return REGION;
        return OTHER;
    }
}
