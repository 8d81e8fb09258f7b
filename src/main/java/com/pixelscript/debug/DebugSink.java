package com.pixelscript.debug;

/** Pluggable debug output target (stdout, SLF4J, a test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
