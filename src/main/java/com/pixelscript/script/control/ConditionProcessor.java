package com.pixelscript.script.control;

import java.util.LinkedHashMap;
import java.util.Map;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineExecutor;
import com.pixelscript.script.LineResult;
import com.pixelscript.script.expr.Value;

/** {@code if:COND;INSTR[,INSTR...]}. A false condition is a successful no-op. */
public class ConditionProcessor {

    private static final String TAG = "pixelscript.if";

    private final ConditionEvaluator conditions;
    private final InstructionParser instructions;
    private final Diagnostics diagnostics;

    public ConditionProcessor(ConditionEvaluator conditions, InstructionParser instructions, Diagnostics diagnostics) {
        this.conditions = conditions;
        this.instructions = instructions;
        this.diagnostics = diagnostics;
    }

    public LineResult runIf(String param, Map<String, Value> globals,
                            PixelBuffer buffer, int width, int height,
                            int lineNumber, LineExecutor executor) {
        int semi = param == null ? -1 : param.indexOf(';');
        if (semi < 0) {
            diagnostics.syntax("if needs 'CONDITION;INSTRUCTION', got '" + param + "'");
            return LineResult.failed(buffer, width, height);
        }
        String condition = param.substring(0, semi).trim();
        String body = param.substring(semi + 1).trim();

        Map<String, Value> context = new LinkedHashMap<>();
        context.put("width", Value.number(width));
        context.put("height", Value.number(height));
        if (globals != null) context.putAll(globals);

        if (!conditions.evaluate(condition, context)) {
            Debug.get().d(TAG, "line " + lineNumber + ": '" + condition + "' is false, skipping");
            return LineResult.ok(buffer, width, height);
        }

        if (body.indexOf(',') >= 0 && body.indexOf(':') >= 0) {
            return instructions.runInstructionList(body, context, buffer, width, height, lineNumber, executor);
        }
        if (body.indexOf(':') >= 0) {
            LineResult r = executor.execute(body, buffer, width, height, lineNumber);
            return r != null ? r : LineResult.failed(buffer, width, height);
        }
        diagnostics.syntax("if body '" + body + "' is not an instruction");
        return LineResult.failed(buffer, width, height);
    }
}
