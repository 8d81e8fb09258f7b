package com.pixelscript.script.control;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineExecutor;
import com.pixelscript.script.LineResult;
import com.pixelscript.script.expr.Value;
import com.pixelscript.script.text.InstructionTokenizer;

/**
 * Expands {@code loop:VAR\START\END\STEP;BODY}.
 *
 * The body is grouped into colors, regions and others, and each group runs
 * over all iterations before the next group starts. Work happens on a copy
 * of the incoming buffer; that copy is returned whether or not every
 * iteration succeeded.
 */
public class LoopProcessor {

    private static final String TAG = "pixelscript.loop";
    private static final Pattern LOOP_VARIABLE = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final ParamParser params;
    private final VariableBinder binder;
    private final Diagnostics diagnostics;

    public LoopProcessor(ParamParser params, VariableBinder binder, Diagnostics diagnostics) {
        this.params = params;
        this.binder = binder;
        this.diagnostics = diagnostics;
    }

    /** Splits {@code header;body} at the first semicolon and runs the loop. */
    public LineResult process(String param, Map<String, Value> context,
                              PixelBuffer buffer, int width, int height,
                              int lineNumber, LineExecutor executor) {
        int semi = param == null ? -1 : param.indexOf(';');
        if (semi < 0) {
            diagnostics.syntax("loop needs 'VAR\\START\\END\\STEP;INSTRUCTIONS', got '" + param + "'");
            return LineResult.failed(buffer, width, height);
        }
        return runLoop(param.substring(0, semi).trim(), param.substring(semi + 1).trim(),
                context, buffer, width, height, lineNumber, executor);
    }

    public LineResult runLoop(String header, String body, Map<String, Value> context,
                              PixelBuffer buffer, int width, int height,
                              int lineNumber, LineExecutor executor) {
        LoopDescriptor loop = parseHeader(header, context);
        if (loop == null) {
            return LineResult.failed(buffer, width, height);
        }

        long requested = loop.requestedIterations();
        if (requested > LoopDescriptor.MAX_ITERATIONS) {
            diagnostics.limit("Loop " + loop + " requests " + requested
                    + " iterations, clamped to " + LoopDescriptor.MAX_ITERATIONS);
        }
        int maxIterations = loop.iterations();
        Debug.get().i(TAG, "line " + lineNumber + ": loop " + loop + " (" + maxIterations + " iterations)");

        List<String> instructions = InstructionTokenizer.splitInstructions(body);
        Map<InstructionCategory, List<String>> groups = InstructionParser.groupByCategory(instructions);

        LineResult working = LineResult.ok(buffer.copy(), width, height);
        boolean allOk = true;
        for (Map.Entry<InstructionCategory, List<String>> group : groups.entrySet()) {
            if (group.getValue().isEmpty()) continue;
            working = runGroup(loop, maxIterations, group.getValue(), context, working, lineNumber, executor);
            if (!working.success()) {
                Debug.get().w(TAG, "line " + lineNumber + ": " + group.getKey() + " instructions failed in loop");
                allOk = false;
            }
        }
        return new LineResult(allOk, working.buffer(), working.width(), working.height());
    }

    private LineResult runGroup(LoopDescriptor loop, int maxIterations, List<String> instructions,
                                Map<String, Value> context, LineResult start,
                                int lineNumber, LineExecutor executor) {
        PixelBuffer buf = start.buffer();
        int w = start.width();
        int h = start.height();
        boolean ok = true;

        double current = loop.start();
        int count = 0;
        while (loop.inRange(current) && count < maxIterations) {
            Value value = Value.number(current);
            Map<String, Value> scope = new LinkedHashMap<>();
            if (context != null) scope.putAll(context);
            scope.put(loop.variable(), value);

            for (String instruction : instructions) {
                String bound = binder.bind(instruction, loop.variable(), value, scope);
                LineResult r = executor.execute(bound, buf, w, h, lineNumber);
                if (r == null) {
                    ok = false;
                    continue;
                }
                buf = r.buffer();
                w = r.width();
                h = r.height();
                if (!r.success()) {
                    Debug.get().w(TAG, "line " + lineNumber + ": " + loop.variable() + "="
                            + value.toText() + ": failed: " + bound);
                    ok = false;
                }
            }
            current += loop.step();
            count++;
        }
        Debug.get().d(TAG, "line " + lineNumber + ": group done after " + count + " iterations");
        return new LineResult(ok, buf, w, h);
    }

    /** Parses and validates the four header fields; returns null after recording why it failed. */
    LoopDescriptor parseHeader(String header, Map<String, Value> context) {
        List<String> fields = params.splitParams(header, context);
        if (fields.size() != 4) {
            diagnostics.syntax("loop header needs 4 fields (VAR\\START\\END\\STEP), got "
                    + fields.size() + " in '" + header + "'");
            return null;
        }

        String name = fields.get(0);
        if (!LOOP_VARIABLE.matcher(name).matches()) {
            diagnostics.syntax("loop variable must be alphanumeric, got '" + name + "'");
            return null;
        }

        for (int i = 1; i < 4; i++) {
            if (!NUMBER.matcher(fields.get(i)).matches()) {
                diagnostics.syntax("loop start/end/step must be numbers, got '" + fields.get(i) + "'");
                return null;
            }
        }

        double start;
        double end;
        double step;
        try {
            start = Double.parseDouble(fields.get(1));
            end = Double.parseDouble(fields.get(2));
            step = Double.parseDouble(fields.get(3));
        } catch (NumberFormatException e) {
            diagnostics.syntax("loop start/end/step must be numbers, got '" + header + "'");
            return null;
        }
        if (Double.isNaN(start) || Double.isNaN(end) || Double.isNaN(step)
                || Double.isInfinite(start) || Double.isInfinite(end) || Double.isInfinite(step)) {
            diagnostics.syntax("loop start/end/step must be finite, got '" + header + "'");
            return null;
        }

        if (step == 0) {
            diagnostics.syntax("loop step must not be zero");
            return null;
        }
        if ((end - start) * step < 0) {
            diagnostics.syntax("loop step " + Value.formatNumber(step) + " never reaches "
                    + Value.formatNumber(end) + " from " + Value.formatNumber(start));
            return null;
        }
        return new LoopDescriptor(name, start, end, step);
    }
}
