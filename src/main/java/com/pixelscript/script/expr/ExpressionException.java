package com.pixelscript.script.expr;

/** Expression text could not be tokenized, parsed or computed. */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
