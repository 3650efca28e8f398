package com.minipy.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, PLUS, MINUS, STAR, SLASH, PERCENT, PIPE,

    // One or two character tokens.
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Literals.
    IDENTIFIER, STRING, INTEGER,

    // Keywords.
    DEF, IF, ELIF, ELSE, FOR, IN, RETURN, PRINT,
    AND, OR, NOT, TRUE, FALSE, NONE,

    // Layout.
    NEWLINE, INDENT, DEDENT,

    EOF
}
