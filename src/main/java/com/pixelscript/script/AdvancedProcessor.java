package com.pixelscript.script;

import java.util.List;
import java.util.Map;

import com.pixelscript.debug.Diagnostics;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.control.ConditionEvaluator;
import com.pixelscript.script.control.ConditionProcessor;
import com.pixelscript.script.control.InstructionParser;
import com.pixelscript.script.control.LoopProcessor;
import com.pixelscript.script.control.ParamParser;
import com.pixelscript.script.control.TernaryEvaluator;
import com.pixelscript.script.control.VariableBinder;
import com.pixelscript.script.expr.ExpressionCache;
import com.pixelscript.script.expr.ExpressionEvaluator;
import com.pixelscript.script.expr.Value;

/**
 * Entry point for the control layer: {@code if:}, {@code loop:}, comma lists
 * and placeholder-aware parameter splitting.
 *
 * Owns the expression cache and diagnostics for a run and reads globals
 * from the {@link VariableStore} it was given; {@code var:} writes to that
 * same store. Each call takes a snapshot of the store, so a running loop
 * never sees its parent scope change underneath it.
 */
public class AdvancedProcessor {

    private final VariableStore variables;
    private final Diagnostics diagnostics;
    private final ExpressionCache cache;

    private final ExpressionEvaluator expressions;
    private final ConditionEvaluator conditions;
    private final TernaryEvaluator ternaries;
    private final VariableBinder binder;
    private final ParamParser params;
    private final InstructionParser instructions;
    private final LoopProcessor loops;
    private final ConditionProcessor ifs;

    public AdvancedProcessor(VariableStore variables, Diagnostics diagnostics) {
        this(variables, diagnostics, new ExpressionCache());
    }

    public AdvancedProcessor(VariableStore variables, Diagnostics diagnostics, ExpressionCache cache) {
        this.variables = variables;
        this.diagnostics = diagnostics;
        this.cache = cache;

        this.expressions = new ExpressionEvaluator(cache, diagnostics);
        this.conditions = new ConditionEvaluator(diagnostics);
        this.ternaries = new TernaryEvaluator(conditions, expressions, diagnostics);
        this.binder = new VariableBinder(expressions, ternaries);
        this.params = new ParamParser(ternaries);
        this.instructions = new InstructionParser(binder, diagnostics);
        this.loops = new LoopProcessor(params, binder, diagnostics);
        this.ifs = new ConditionProcessor(conditions, instructions, diagnostics);
    }

    public LineResult processIf(String param, PixelBuffer buffer, int width, int height,
                                int lineNumber, LineExecutor executor) {
        return ifs.runIf(param, variables.snapshot(), buffer, width, height, lineNumber, executor);
    }

    public LineResult processLoop(String param, PixelBuffer buffer, int width, int height,
                                  int lineNumber, LineExecutor executor) {
        return loops.process(param, variables.snapshot(), buffer, width, height, lineNumber, executor);
    }

    public LineResult runLoop(String header, String body, Map<String, Value> context,
                              PixelBuffer buffer, int width, int height,
                              int lineNumber, LineExecutor executor) {
        return loops.runLoop(header, body, context, buffer, width, height, lineNumber, executor);
    }

    public LineResult processInstructionList(String text, PixelBuffer buffer, int width, int height,
                                             int lineNumber, LineExecutor executor) {
        return instructions.runInstructionList(text, variables.snapshot(), buffer, width, height, lineNumber, executor);
    }

    public LineResult processInstructionList(List<String> list, PixelBuffer buffer, int width, int height,
                                             int lineNumber, LineExecutor executor) {
        return instructions.runInstructionList(list, variables.snapshot(), buffer, width, height, lineNumber, executor);
    }

    public List<String> splitParams(String text) {
        return params.splitParams(text, variables.snapshot());
    }

    public List<String> splitParams(String text, Map<String, Value> vars) {
        return params.splitParams(text, vars);
    }

    public String bind(String instruction, String name, Value value, Map<String, Value> context) {
        return binder.bind(instruction, name, value, context);
    }

    public boolean evaluateCondition(String condition, Map<String, Value> context) {
        return conditions.evaluate(condition, context);
    }

    public String evaluateTernary(String text, Map<String, Value> vars) {
        return ternaries.evaluate(text, vars);
    }

    public Value evaluateCached(String expression, Map<String, Value> vars) {
        return expressions.evaluateCached(expression, vars);
    }

    public String substituteBraces(String param, Map<String, Value> vars) {
        return expressions.substituteBraces(param, vars);
    }

    public void clearCache() {
        cache.clear();
    }

    /** Forgets everything from the previous file: globals, cached results and diagnostics. */
    public void reset() {
        variables.clear();
        cache.clear();
        diagnostics.clear();
    }

    public VariableStore variables() { return variables; }
    public Diagnostics diagnostics() { return diagnostics; }
    public ExpressionCache cache() { return cache; }
}
