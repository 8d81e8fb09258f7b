package com.pixelscript.script.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MathFunctions
 *
 * The fixed function and constant table visible to placeholder expressions.
 * Nothing outside this table can be called:
 *
 *   abs max min round int float pow sin cos tan sqrt floor ceil
 *   pi e
 *
 * Usage in instruction text:
 *   region:r{i}\{i*10}|0\{min(i*10+9, width-1)}|9
 */
public final class MathFunctions {

    /** Functional interface for table entries. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private static final Map<String, BuiltinFunction> FUNCTIONS;
    private static final Map<String, Value> CONSTANTS;

    static {
        Map<String, BuiltinFunction> fns = new LinkedHashMap<>();

        fns.put("abs", args -> {
            requireArgs("abs", args, 1);
            return Value.number(Math.abs(num(args, 0)));
        });

        fns.put("max", args -> {
            requireAtLeast("max", args, 1);
            double best = num(args, 0);
            for (int i = 1; i < args.size(); i++) best = Math.max(best, num(args, i));
            return Value.number(best);
        });

        fns.put("min", args -> {
            requireAtLeast("min", args, 1);
            double best = num(args, 0);
            for (int i = 1; i < args.size(); i++) best = Math.min(best, num(args, i));
            return Value.number(best);
        });

        // Half-to-even, with an optional digit count: round(2.5) == 2, round(3.14159, 2) == 3.14
        fns.put("round", args -> {
            if (args.size() == 2) {
                double scale = Math.pow(10, (int) num(args, 1));
                return Value.number(Math.rint(num(args, 0) * scale) / scale);
            }
            requireArgs("round", args, 1);
            return Value.number(Math.rint(num(args, 0)));
        });

        fns.put("int", args -> {
            requireArgs("int", args, 1);
            double d = coerce("int", args.get(0));
            return Value.number(d < 0 ? Math.ceil(d) : Math.floor(d));
        });

        fns.put("float", args -> {
            requireArgs("float", args, 1);
            return Value.number(coerce("float", args.get(0)));
        });

        fns.put("pow", args -> {
            requireArgs("pow", args, 2);
            return Value.number(checked("pow", Math.pow(num(args, 0), num(args, 1))));
        });

        fns.put("sin", args -> {
            requireArgs("sin", args, 1);
            return Value.number(Math.sin(num(args, 0)));
        });

        fns.put("cos", args -> {
            requireArgs("cos", args, 1);
            return Value.number(Math.cos(num(args, 0)));
        });

        fns.put("tan", args -> {
            requireArgs("tan", args, 1);
            return Value.number(Math.tan(num(args, 0)));
        });

        fns.put("sqrt", args -> {
            requireArgs("sqrt", args, 1);
            return Value.number(checked("sqrt", Math.sqrt(num(args, 0))));
        });

        fns.put("floor", args -> {
            requireArgs("floor", args, 1);
            return Value.number(Math.floor(num(args, 0)));
        });

        fns.put("ceil", args -> {
            requireArgs("ceil", args, 1);
            return Value.number(Math.ceil(num(args, 0)));
        });

        FUNCTIONS = Collections.unmodifiableMap(fns);

        Map<String, Value> consts = new LinkedHashMap<>();
        consts.put("pi", Value.number(Math.PI));
        consts.put("e", Value.number(Math.E));
        CONSTANTS = Collections.unmodifiableMap(consts);
    }

    private MathFunctions() {}

    public static BuiltinFunction function(String name) {
        return FUNCTIONS.get(name);
    }

    public static Value constant(String name) {
        return CONSTANTS.get(name);
    }

    // ===================== HELPERS =====================

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new ExpressionException(fn + "() expects " + n + " arguments, got " + args.size());
        }
    }

    private static void requireAtLeast(String fn, List<Value> args, int n) {
        if (args.size() < n) {
            throw new ExpressionException(fn + "() expects at least " + n + " arguments, got " + args.size());
        }
    }

    private static double num(List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() == Value.Type.STRING) {
            throw new ExpressionException("Argument " + idx + " must be a number");
        }
        return v.asNumber();
    }

    private static double coerce(String fn, Value v) {
        if (v.getType() != Value.Type.STRING) return v.asNumber();
        try {
            return Double.parseDouble(v.asString().trim());
        } catch (NumberFormatException e) {
            throw new ExpressionException(fn + "() cannot convert '" + v.asString() + "'", e);
        }
    }

    private static double checked(String fn, double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ExpressionException(fn + "(): math domain error");
        }
        return d;
    }
}
