package com.pixelscript.render;

/** Bad or unresolvable parameters for a drawing command; fails only the current line. */
public class CommandException extends RuntimeException {
    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
