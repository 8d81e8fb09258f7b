package com.pixelscript.script.control;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineExecutor;
import com.pixelscript.script.LineResult;
import com.pixelscript.script.expr.Value;
import com.pixelscript.script.text.InstructionTokenizer;

/**
 * Runs a comma-separated instruction list through the line executor.
 *
 * Elements are reordered by {@link InstructionCategory} across the whole
 * list, every bound variable is substituted, and each element is executed
 * once. A failing element does not stop the others; the buffer returned is
 * always the one produced by the last executed element.
 */
public class InstructionParser {

    private static final String TAG = "pixelscript.list";

    private final VariableBinder binder;
    private final Diagnostics diagnostics;

    public InstructionParser(VariableBinder binder, Diagnostics diagnostics) {
        this.binder = binder;
        this.diagnostics = diagnostics;
    }

    public LineResult runInstructionList(String text, Map<String, Value> context,
                                         PixelBuffer buffer, int width, int height,
                                         int lineNumber, LineExecutor executor) {
        return runInstructionList(InstructionTokenizer.splitInstructions(text), context,
                buffer, width, height, lineNumber, executor);
    }

    public LineResult runInstructionList(List<String> instructions, Map<String, Value> context,
                                         PixelBuffer buffer, int width, int height,
                                         int lineNumber, LineExecutor executor) {
        List<String> ordered = orderByCategory(instructions);
        Debug.get().d(TAG, "line " + lineNumber + ": running " + ordered.size() + " instructions");

        boolean allOk = true;
        PixelBuffer current = buffer;
        int w = width;
        int h = height;

        for (String instruction : ordered) {
            String bound = substituteAll(instruction, context);
            if (bound.indexOf(':') < 0) {
                diagnostics.syntax("Instruction '" + bound + "' has no ':' separator");
                allOk = false;
                continue;
            }

            LineResult r = executor.execute(bound, current, w, h, lineNumber);
            if (r == null) {
                allOk = false;
                continue;
            }
            current = r.buffer();
            w = r.width();
            h = r.height();
            if (!r.success()) {
                Debug.get().w(TAG, "line " + lineNumber + ": instruction failed: " + bound);
                allOk = false;
            }
        }
        return new LineResult(allOk, current, w, h);
    }

    /** Stable partition into colors, regions and others. */
    public static List<String> orderByCategory(List<String> instructions) {
        Map<InstructionCategory, List<String>> groups = groupByCategory(instructions);
        List<String> out = new ArrayList<>(instructions.size());
        for (List<String> group : groups.values()) out.addAll(group);
        return out;
    }

    static Map<InstructionCategory, List<String>> groupByCategory(List<String> instructions) {
        Map<InstructionCategory, List<String>> groups = new EnumMap<>(InstructionCategory.class);
        for (InstructionCategory c : InstructionCategory.values()) {
            groups.put(c, new ArrayList<>());
        }
        for (String instruction : instructions) {
            groups.get(InstructionCategory.classify(instruction)).add(instruction);
        }
        return groups;
    }

    private String substituteAll(String instruction, Map<String, Value> context) {
        String out = instruction;
        if (context == null) return out;
        for (Map.Entry<String, Value> e : context.entrySet()) {
            out = binder.bind(out, e.getKey(), e.getValue(), context);
        }
        return out;
    }
}
