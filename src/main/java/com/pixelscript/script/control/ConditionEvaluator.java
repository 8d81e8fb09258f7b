package com.pixelscript.script.control;

import java.util.Collections;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.script.expr.Expr;
import com.pixelscript.script.expr.ExpressionException;
import com.pixelscript.script.expr.ExpressionInterpreter;
import com.pixelscript.script.expr.Parser;
import com.pixelscript.script.expr.SecurityRejectionException;
import com.pixelscript.script.expr.Value;

/**
 * Boolean conditions for {@code if:} and ternaries.
 *
 * Bound names are replaced by their values as whole tokens, the text is
 * sanitized and then parsed in bare-word mode: an identifier that is still
 * unbound stands for its own text, so {@code mode == dark} works once
 * {@code mode} has been substituted. Every failure evaluates to false.
 */
public class ConditionEvaluator {

    private static final String TAG = "pixelscript.cond";
    private static final Pattern IDENTIFIER = Pattern.compile("(?<![A-Za-z0-9_.])[A-Za-z_][A-Za-z0-9_]*");

    private final Diagnostics diagnostics;

    public ConditionEvaluator(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public boolean evaluate(String condition, Map<String, Value> context) {
        Map<String, Value> ctx = (context == null) ? Collections.emptyMap() : context;
        String substituted = substitute(condition == null ? "" : condition, ctx);
        String safe = ConditionSanitizer.sanitize(substituted, diagnostics);

        try {
            Expr.ExprInterface ast = Parser.parse(safe);
            boolean result = new ExpressionInterpreter(Collections.emptyMap(), true).eval(ast).isTruthy();
            Debug.get().d(TAG, "'" + condition + "' -> '" + safe + "' = " + result);
            return result;
        } catch (SecurityRejectionException e) {
            diagnostics.security("Rejected condition '" + safe + "': " + e.getMessage());
        } catch (ExpressionException e) {
            diagnostics.evaluation("Cannot evaluate condition '" + safe + "': " + e.getMessage());
        }
        return false;
    }

    /** Replaces every bound identifier by its text; identifiers inside longer words are left alone. */
    static String substitute(String text, Map<String, Value> context) {
        if (context.isEmpty()) return text;
        Matcher m = IDENTIFIER.matcher(text);
        StringBuffer out = new StringBuffer(text.length());
        while (m.find()) {
            Value v = context.get(m.group());
            String replacement = (v != null) ? v.toText() : m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
