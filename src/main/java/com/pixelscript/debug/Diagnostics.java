package com.pixelscript.debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates diagnostics for one run and mirrors each one to the debug hub.
 * The host sets the current line before dispatching it.
 */
public final class Diagnostics {

    private static final String TAG = "pixelscript.diag";

    private final List<Diagnostic> entries = new ArrayList<>();
    private int currentLine = 0;

    public void setCurrentLine(int line) { this.currentLine = Math.max(0, line); }

    public int currentLine() { return currentLine; }

    public void syntax(String message) { add(Diagnostic.Kind.SYNTAX, message); }
    public void evaluation(String message) { add(Diagnostic.Kind.EVALUATION, message); }
    public void security(String message) { add(Diagnostic.Kind.SECURITY, message); }
    public void limit(String message) { add(Diagnostic.Kind.LIMIT, message); }

    public void add(Diagnostic.Kind kind, String message) {
        Diagnostic d = new Diagnostic(kind, currentLine, message);
        entries.add(d);
        if (kind == Diagnostic.Kind.LIMIT) {
            Debug.get().i(TAG, d.toString());
        } else {
            Debug.get().w(TAG, d.toString());
        }
    }

    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(entries);
    }

    public long count(Diagnostic.Kind kind) {
        return entries.stream().filter(d -> d.kind() == kind).count();
    }

    public boolean isEmpty() { return entries.isEmpty(); }

    public void clear() {
        entries.clear();
        currentLine = 0;
    }
}
