package com.pixelscript.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide logging hub for the evaluators, commands and runner.
 *
 * Components log through {@code Debug.get()} with a tag such as
 * {@code pixelscript.loop}; the CLI routes that to SLF4J, library users may
 * install any {@link DebugSink}. Until then everything is dropped.
 */
public final class Debug {

    // Must be initialized before INSTANCE, whose constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route everything at INFO and above to stdout, errors to stderr. */
    public static void useSysOut() {
        INSTANCE.setSink(new DebugSink() {
            @Override
            public void log(DebugLevel level, String tag, String message, Throwable error) {
                if (level.ordinal() < DebugLevel.INFO.ordinal()) return;
                PrintStream out = (level == DebugLevel.ERROR) ? System.err : System.out;
                out.println("[" + level + "][" + tag + "] " + message);
                if (error != null) error.printStackTrace(out);
            }
        });
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
