package com.pixelscript.script.expr;

import java.util.Map;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.script.text.InstructionTokenizer;

/**
 * Evaluates placeholder expressions against a variable snapshot.
 *
 * Failures never escape: a rejected or broken expression is recorded in
 * {@link Diagnostics} and yields {@code null} from the {@code try*} methods
 * or {@code 0} from the plain ones.
 */
public class ExpressionEvaluator {

    private static final String TAG = "pixelscript.expr";
    private static final Value ZERO = Value.number(0);

    private final ExpressionCache cache;
    private final Diagnostics diagnostics;

    public ExpressionEvaluator(ExpressionCache cache, Diagnostics diagnostics) {
        this.cache = cache;
        this.diagnostics = diagnostics;
    }

    public Value evaluate(String text, Map<String, Value> variables) {
        Value v = tryEvaluate(text, variables);
        return v != null ? v : ZERO;
    }

    public Value evaluateCached(String text, Map<String, Value> variables) {
        Value v = tryEvaluateCached(text, variables);
        return v != null ? v : ZERO;
    }

    /** Returns null (with a diagnostic) when the expression is rejected or cannot be computed. */
    public Value tryEvaluate(String text, Map<String, Value> variables) {
        String source = text == null ? "" : text.trim();
        try {
            Expr.ExprInterface ast = Parser.parse(source);
            Value result = new ExpressionInterpreter(variables, false).eval(ast);
            Debug.get().t(TAG, source + " => " + result);
            return result;
        } catch (SecurityRejectionException e) {
            diagnostics.security("Rejected expression '" + source + "': " + e.getMessage());
        } catch (ExpressionException e) {
            diagnostics.evaluation("Cannot evaluate '" + source + "': " + e.getMessage());
        }
        return null;
    }

    public Value tryEvaluateCached(String text, Map<String, Value> variables) {
        String source = text == null ? "" : text.trim();
        Map<String, Value> snapshot = ExpressionCache.snapshot(variables);

        Value hit = cache.get(source, snapshot);
        if (hit != null) return hit;

        Value result = tryEvaluate(source, snapshot);
        cache.put(source, snapshot, result);
        return result;
    }

    /**
     * Replaces each top-level {@code {expr}} span with its formatted value.
     * Nested spans are resolved first; a span that fails stays as written.
     */
    public String substituteBraces(String param, Map<String, Value> variables) {
        return InstructionTokenizer.replaceBraceSpans(param, inner -> {
            String resolvedInner = substituteBraces(inner, variables);
            Value v = tryEvaluateCached(resolvedInner, variables);
            return v != null ? v.toText() : null;
        });
    }

    public ExpressionCache cache() { return cache; }

    public Diagnostics diagnostics() { return diagnostics; }
}
