package com.pixelscript.script.expr;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Memoizes expression results per (expression text, full variable snapshot).
 * A hit requires the snapshot to be exactly equal; entries are never evicted
 * while a file runs, only dropped wholesale by {@link #clear()}.
 */
public final class ExpressionCache {

    private final Map<Key, Value> entries = new HashMap<>();
    private boolean enabled = true;
    private long hits = 0;
    private long misses = 0;

    /** Immutable, order-independent copy of the bindings visible to an expression. */
    public static Map<String, Value> snapshot(Map<String, Value> variables) {
        if (variables == null || variables.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new HashMap<>(variables));
    }

    public Value get(String expression, Map<String, Value> snapshot) {
        if (!enabled) return null;
        Value v = entries.get(new Key(expression, snapshot));
        if (v != null) hits++;
        else misses++;
        return v;
    }

    public void put(String expression, Map<String, Value> snapshot, Value value) {
        if (!enabled || value == null) return;
        entries.put(new Key(expression, snapshot), value);
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) entries.clear();
    }

    public boolean isEnabled() { return enabled; }

    public int size() { return entries.size(); }

    public long hits() { return hits; }

    public long misses() { return misses; }

    public void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    private static final class Key {
        private final String expression;
        private final Map<String, Value> snapshot;

        Key(String expression, Map<String, Value> snapshot) {
            this.expression = expression;
            this.snapshot = snapshot;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return expression.equals(other.expression) && snapshot.equals(other.snapshot);
        }

        @Override
        public int hashCode() {
            return Objects.hash(expression, snapshot);
        }
    }
}
