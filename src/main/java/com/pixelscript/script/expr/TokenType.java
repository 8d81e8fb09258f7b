package com.pixelscript.script.expr;

public enum TokenType {
    LEFT_PAREN, RIGHT_PAREN, COMMA, DOT,
    PLUS, MINUS, STAR, DOUBLE_STAR, SLASH, PERCENT,

    EQUAL_EQUAL, BANG_EQUAL,
    GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,

    NUMBER, STRING, IDENTIFIER,

    AND, OR, NOT,

    EOF
}
