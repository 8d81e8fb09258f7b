package com.pixelscript.script.control;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.pixelscript.debug.Diagnostics;

/**
 * Allow-list filter applied to condition text before parsing. Anything that
 * is not a number, an operator, a parenthesis, whitespace or an identifier is
 * dropped and replaced by a single space, so the surviving tokens never fuse
 * into a new word.
 */
public final class ConditionSanitizer {

    private static final Pattern ALLOWED = Pattern.compile(
            "\\d+\\.\\d+|\\d+|==|!=|>=|<=|>|<|\\+|-|\\*\\*|\\*|/|%|\\(|\\)|\\s+|[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ConditionSanitizer() {}

    public static String sanitize(String condition, Diagnostics diagnostics) {
        if (condition == null) return "";

        StringBuilder safe = new StringBuilder(condition.length());
        Matcher m = ALLOWED.matcher(condition);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) safe.append(' ');
            safe.append(m.group());
            last = m.end();
        }
        if (last < condition.length()) safe.append(' ');

        String result = safe.toString().trim();
        if (!stripWhitespace(condition).equals(stripWhitespace(result))) {
            diagnostics.security("Condition '" + condition + "' contained disallowed text, sanitized to '" + result + "'");
        }
        return result;
    }

    private static String stripWhitespace(String s) {
        return WHITESPACE.matcher(s).replaceAll("");
    }
}
