package com.pixelscript.script.expr;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Scalar bound to a variable or produced by an expression.
 * Numbers are doubles; integral results render without a decimal point.
 */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING }

    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, s == null ? "" : s); }

    /**
     * Interprets raw instruction text the way {@code var:} does: integer or
     * decimal literals become numbers, anything else stays a string.
     */
    public static Value parseLiteral(String text) {
        String t = (text == null) ? "" : text.trim();
        if (INTEGER.matcher(t).matches() || DECIMAL.matcher(t).matches()) {
            return number(Double.parseDouble(t));
        }
        return string(t);
    }

    public Type getType() { return type; }

    public boolean isNumber() { return type == Type.NUMBER; }

    public double asNumber() {
        if (type == Type.BOOL) return ((boolean) value) ? 1 : 0;
        if (type != Type.NUMBER) throw new ExpressionException("Expected number, got " + type + " '" + value + "'");
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new ExpressionException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new ExpressionException("Expected string, got " + type);
        return (String) value;
    }

    public boolean isTruthy() {
        switch (type) {
            case BOOL:
                return (boolean) value;
            case NUMBER:
                return (double) value != 0.0;
            default:
                return !((String) value).isEmpty();
        }
    }

    /** Text spliced back into an instruction. */
    public String toText() {
        switch (type) {
            case NUMBER:
                return formatNumber((double) value);
            case BOOL:
                return Boolean.toString((boolean) value);
            default:
                return (String) value;
        }
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
        if (d == Math.rint(d)) {
            if (Math.abs(d) < 9.0e15) return Long.toString((long) d);
            return new BigDecimal(d).toPlainString();
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type == Type.STRING ? '"' + toText() + '"' : toText();
    }
}
