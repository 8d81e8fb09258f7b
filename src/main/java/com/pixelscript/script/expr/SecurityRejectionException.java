package com.pixelscript.script.expr;

/**
 * Expression reached for something outside the closed grammar: attribute
 * access, dunder names or a reserved host name such as {@code os}.
 */
public class SecurityRejectionException extends ExpressionException {

    public SecurityRejectionException(String message) {
        super(message);
    }
}
