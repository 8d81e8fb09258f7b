package com.pixelscript.script.text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Quote- and brace-aware scanning shared by parameter and instruction
 * splitting.
 *
 * A quote opens when no quote is active and closes only on the same quote
 * character; inside a quote, a quote preceded by a backslash does not close it. Braces count
 * outside quotes, and a stray closing brace is clamped at depth zero.
 * Delimiters split only outside quotes at depth zero.
 */
public final class InstructionTokenizer {

    public static final char PARAM_DELIMITER = '\\';
    public static final char INSTRUCTION_DELIMITER = ',';

    private InstructionTokenizer() {}

    /**
     * Splits on backslashes. Pieces are trimmed; inner empty pieces are kept
     * (an empty parameter is meaningful), a blank trailing piece is dropped.
     */
    public static List<String> splitParams(String text) {
        List<String> parts = split(text, PARAM_DELIMITER);
        if (!parts.isEmpty() && parts.get(parts.size() - 1).isEmpty()) {
            parts.remove(parts.size() - 1);
        }
        return parts;
    }

    /** Splits on commas, trimming and discarding empty instructions. */
    public static List<String> splitInstructions(String text) {
        List<String> out = new ArrayList<>();
        for (String part : split(text, INSTRUCTION_DELIMITER)) {
            if (!part.isEmpty()) out.add(part);
        }
        return out;
    }

    public static List<String> split(String text, char delimiter) {
        List<String> parts = new ArrayList<>();
        if (text == null) return parts;

        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                // a backslash can only escape a quote that is already open
                boolean escaped = quote == c && text.charAt(i - 1) == '\\';
                if (quote == 0) quote = c;
                else if (quote == c && !escaped) quote = 0;
                current.append(c);
            } else if (c == '{' && quote == 0) {
                depth++;
                current.append(c);
            } else if (c == '}' && quote == 0) {
                depth = Math.max(0, depth - 1);
                current.append(c);
            } else if (c == delimiter && quote == 0 && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString().trim());
        return parts;
    }

    public static boolean hasBraceSpan(String text) {
        if (text == null) return false;
        int open = text.indexOf('{');
        return open >= 0 && text.indexOf('}', open) > open;
    }

    /**
     * Rewrites every top-level {@code {...}} span with {@code resolver(inner)}.
     * When the resolver returns null the span is kept verbatim, braces
     * included. An unterminated span is copied through untouched.
     */
    public static String replaceBraceSpans(String text, Function<String, String> resolver) {
        if (!hasBraceSpan(text)) return text;

        StringBuilder out = new StringBuilder(text.length());
        int depth = 0;
        int spanStart = -1;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                if (depth == 0) spanStart = i;
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) {
                    String inner = text.substring(spanStart + 1, i);
                    String replacement = resolver.apply(inner);
                    out.append(replacement != null ? replacement : text.substring(spanStart, i + 1));
                    spanStart = -1;
                }
            } else if (depth == 0) {
                out.append(c);
            }
        }
        if (depth > 0 && spanStart >= 0) {
            out.append(text, spanStart, text.length());
        }
        return out.toString();
    }

    /** Index of the first {@code target} at brace depth zero at or after {@code from}, or -1. */
    public static int indexAtDepthZero(String text, char target, int from) {
        int depth = 0;
        for (int i = Math.max(0, from); i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
