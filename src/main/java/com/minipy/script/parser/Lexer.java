package com.minipy.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns source text into tokens, including the NEWLINE / INDENT / DEDENT layout
 * tokens that carry the block structure. Blank and comment-only lines produce
 * nothing, and line breaks inside brackets are ignored.
 */
public class Lexer {
    private static final int TAB_WIDTH = 8;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int nesting = 0;
    private boolean atLineStart = true;
    private boolean lineHasTokens = false;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("def", TokenType.DEF);
        map.put("if", TokenType.IF);
        map.put("elif", TokenType.ELIF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("return", TokenType.RETURN);
        map.put("print", TokenType.PRINT);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("True", TokenType.TRUE);
        map.put("False", TokenType.FALSE);
        map.put("None", TokenType.NONE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
        indents.push(0);
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            if (atLineStart && nesting == 0) {
                indentation();
                if (isAtEnd()) break;
            }
            start = current;
            scanToken();
        }

        if (lineHasTokens) addLayout(TokenType.NEWLINE);
        while (indents.peek() > 0) {
            indents.pop();
            addLayout(TokenType.DEDENT);
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    /** Measures the indentation of a new logical line and emits INDENT/DEDENT. */
    private void indentation() {
        int column = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') column++;
            else if (c == '\t') column = (column / TAB_WIDTH + 1) * TAB_WIDTH;
            else if (c == '\f') column = 0;
            else break;
            current++;
        }

        // blank or comment-only lines do not count
        if (isAtEnd() || peek() == '\n' || peek() == '\r' || peek() == '#') return;

        atLineStart = false;
        if (column > indents.peek()) {
            indents.push(column);
            addLayout(TokenType.INDENT);
            return;
        }
        while (column < indents.peek()) {
            indents.pop();
            addLayout(TokenType.DEDENT);
        }
        if (column != indents.peek()) {
            throw error("unindent does not match any outer indentation level");
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': nesting++; addToken(TokenType.LEFT_PAREN); break;
            case ')': closeBracket(); addToken(TokenType.RIGHT_PAREN); break;
            case '[': nesting++; addToken(TokenType.LEFT_BRACKET); break;
            case ']': closeBracket(); addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/':
                // '//' and '/' are the same truncating division
                match('/');
                addToken(TokenType.SLASH);
                break;
            case '%': addToken(TokenType.PERCENT); break;
            case '|': addToken(TokenType.PIPE); break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error("Unexpected '!'");
                break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case '\\':
                // explicit line joining
                if (match('\r')) match('\n');
                else if (!match('\n')) throw error("Unexpected character after line continuation");
                line++;
                break;
            case ' ': case '\r': case '\t': case '\f':
                break;
            case '\n':
                newline();
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void newline() {
        if (nesting == 0) {
            if (lineHasTokens) {
                tokens.add(new Token(TokenType.NEWLINE, "\\n", null, line));
                lineHasTokens = false;
            }
            atLineStart = true;
        }
        line++;
    }

    private void closeBracket() {
        if (nesting == 0) throw error("Unmatched '" + source.charAt(current - 1) + "'");
        nesting--;
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (isAlpha(peek())) throw error("Invalid integer literal");
        String text = source.substring(start, current);
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("Integer literal too large: " + text);
        }
        addToken(TokenType.INTEGER, value);
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') throw error("Unterminated string");
            if (c == '\\') {
                if (isAtEnd()) break;
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case '\\': sb.append('\\'); break;
                    case '"': sb.append('"'); break;
                    default: throw error("Invalid escape sequence: \\" + e);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addLayout(TokenType type) {
        tokens.add(new Token(type, "", null, line));
        if (type == TokenType.NEWLINE) lineHasTokens = false;
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
        lineHasTokens = true;
    }

    private ScriptError error(String msg) {
        return ScriptError.syntax(line, msg);
    }
}
