package com.minipy.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;

    public Token(TokenType type, String lexeme, Object literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    /** Identifier token for names coming from a source other than the lexer. */
    public static Token identifier(String name, int line) {
        return new Token(TokenType.IDENTIFIER, name, null, line);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' (line " + line + ")";
    }
}
