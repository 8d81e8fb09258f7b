package com.pixelscript.script.control;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.pixelscript.debug.Debug;
import com.pixelscript.script.expr.ExpressionEvaluator;
import com.pixelscript.script.expr.Value;
import com.pixelscript.script.text.InstructionTokenizer;

/**
 * Rewrites one bound name into instruction text:
 * <ol>
 *   <li>bare occurrences of the name become the value's text;</li>
 *   <li>every {@code {expr}} span is evaluated with the name bound;</li>
 *   <li>remaining {@code _{expr}} groups become {@code _<result>}.</li>
 * </ol>
 * Spans that cannot be evaluated stay in the text with their braces.
 */
public class VariableBinder {

    private static final String TAG = "pixelscript.bind";
    private static final Pattern UNDERSCORE_GROUP = Pattern.compile("_\\{([^{}]*)\\}");

    private final ExpressionEvaluator expressions;
    private final TernaryEvaluator ternaries;

    public VariableBinder(ExpressionEvaluator expressions, TernaryEvaluator ternaries) {
        this.expressions = expressions;
        this.ternaries = ternaries;
    }

    public String bind(String instruction, String name, Value value, Map<String, Value> context) {
        if (instruction == null || name == null || name.isEmpty() || value == null) return instruction;

        String text = value.toText();
        Map<String, Value> scope = new LinkedHashMap<>();
        if (context != null) scope.putAll(context);
        scope.put(name, value);

        String out = replaceToken(instruction, name, text);

        out = InstructionTokenizer.replaceBraceSpans(out, inner -> {
            String expr = replaceToken(inner, name, text);
            String resolved = ternaries.resolveSpan(expr, scope);
            return resolved != null ? resolved : "{" + expr + "}";
        });

        if (out.contains("_{")) {
            Matcher m = UNDERSCORE_GROUP.matcher(out);
            StringBuffer sb = new StringBuffer(out.length());
            while (m.find()) {
                String expr = replaceToken(m.group(1), name, text);
                Value v = expressions.tryEvaluateCached(expr, scope);
                String group = (v != null) ? "_" + v.toText() : "_{" + expr + "}";
                m.appendReplacement(sb, Matcher.quoteReplacement(group));
            }
            m.appendTail(sb);
            out = sb.toString();
        }

        Debug.get().t(TAG, name + "=" + text + ": '" + instruction + "' -> '" + out + "'");
        return out;
    }

    /** Whole-token replacement: {@code i} matches in {@code i*2} but not in {@code width}. */
    static String replaceToken(String text, String name, String replacement) {
        Pattern p = Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(name) + "(?![A-Za-z0-9_])");
        return p.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }
}
