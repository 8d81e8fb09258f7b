package com.pixelscript.script.control;

import java.util.Map;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.script.expr.ExpressionEvaluator;
import com.pixelscript.script.expr.Value;
import com.pixelscript.script.text.InstructionTokenizer;

/**
 * Textual {@code cond ? a : b} resolution.
 *
 * Only braces count toward nesting: the first {@code ?} at brace depth zero
 * splits off the condition and the first {@code :} at depth zero after it
 * splits the branches. Only the selected branch is looked at.
 */
public class TernaryEvaluator {

    private static final String TAG = "pixelscript.ternary";

    private final ConditionEvaluator conditions;
    private final ExpressionEvaluator expressions;
    private final Diagnostics diagnostics;

    public TernaryEvaluator(ConditionEvaluator conditions, ExpressionEvaluator expressions, Diagnostics diagnostics) {
        this.conditions = conditions;
        this.expressions = expressions;
        this.diagnostics = diagnostics;
    }

    public static boolean isTernary(String text) {
        if (text == null) return false;
        int q = InstructionTokenizer.indexAtDepthZero(text, '?', 0);
        return q >= 0 && InstructionTokenizer.indexAtDepthZero(text, ':', q + 1) >= 0;
    }

    public String evaluate(String text, Map<String, Value> variables) {
        if (text == null) return null;

        int question = InstructionTokenizer.indexAtDepthZero(text, '?', 0);
        if (question < 0) return text;

        int colon = InstructionTokenizer.indexAtDepthZero(text, ':', question + 1);
        if (colon < 0) {
            diagnostics.syntax("Ternary '" + text + "' has no ':' for its '?'");
            return text;
        }

        String condition = text.substring(0, question).trim();
        String whenTrue = text.substring(question + 1, colon).trim();
        String whenFalse = text.substring(colon + 1).trim();

        boolean result = conditions.evaluate(condition, variables);
        String branch = result ? whenTrue : whenFalse;
        Debug.get().d(TAG, "'" + condition + "' is " + result + ", taking '" + branch + "'");

        if (isTernary(branch)) {
            return evaluate(branch, variables);
        }
        return resolveSpans(branch, variables);
    }

    /**
     * Resolves each top-level {@code {...}} span of {@code text}: ternary
     * spans through this evaluator, anything else as an expression. A span
     * that cannot be evaluated is left in place.
     */
    public String resolveSpans(String text, Map<String, Value> variables) {
        return InstructionTokenizer.replaceBraceSpans(text, inner -> resolveSpan(inner, variables));
    }

    /** Text for one span body, or null to keep the span as written. */
    public String resolveSpan(String inner, Map<String, Value> variables) {
        if (isTernary(inner)) {
            return evaluate(inner, variables);
        }
        String resolvedInner = resolveSpans(inner, variables);
        Value v = expressions.tryEvaluateCached(resolvedInner, variables);
        return v != null ? v.toText() : null;
    }
}
