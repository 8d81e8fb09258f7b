package com.pixelscript.debug;

/** One recoverable problem noticed while interpreting a line. */
public final class Diagnostic {

    public enum Kind {
        /** Missing delimiter, malformed header or ternary. */
        SYNTAX,
        /** Expression or condition could not be computed. */
        EVALUATION,
        /** Expression used a construct outside the closed grammar. */
        SECURITY,
        /** Loop iteration count was clamped. */
        LIMIT
    }

    private final Kind kind;
    private final int line;
    private final String message;

    public Diagnostic(Kind kind, int line, String message) {
        this.kind = kind;
        this.line = line;
        this.message = message;
    }

    public Kind kind() { return kind; }

    /** Source line, or 0 when the problem is not tied to a line. */
    public int line() { return line; }

    public String message() { return message; }

    @Override
    public String toString() {
        return (line > 0 ? "line " + line + ": " : "") + kind + ": " + message;
    }
}
