package com.pixelscript.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import com.pixelscript.script.expr.Value;

/** Global variables of one file run, written by {@code var:} and read by every evaluator. */
public final class VariableStore {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, Value> values = new LinkedHashMap<>();

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    public void put(String name, Value value) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid variable name: '" + name + "'");
        }
        if (value == null) throw new IllegalArgumentException("Null value for variable '" + name + "'");
        values.put(name, value);
    }

    public Value get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** Read-only copy; later writes to the store do not show through. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() { return values.size(); }

    public void clear() { values.clear(); }
}
