package com.minipy.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.minipy.script.parser.Expr.Binary;
import com.minipy.script.parser.Expr.Call;
import com.minipy.script.parser.Expr.IndexExpr;
import com.minipy.script.parser.Expr.ListLiteral;
import com.minipy.script.parser.Expr.Literal;
import com.minipy.script.parser.Expr.Logical;
import com.minipy.script.parser.Expr.Pipe;
import com.minipy.script.parser.Expr.Unary;
import com.minipy.script.parser.Expr.Variable;
import com.minipy.script.parser.Statement.Block;
import com.minipy.script.parser.Statement.ExprStmt;
import com.minipy.script.parser.Statement.FunctionDef;
import com.minipy.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser. A program is a run of {@code def}s followed by the
 * top-level statements, which are gathered into one block.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public Program parse() {
        match(TokenType.NEWLINE);

        List<FunctionDef> defs = new ArrayList<>();
        while (match(TokenType.DEF)) {
            defs.add(functionDefinition());
        }

        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            if (check(TokenType.DEF)) {
                throw error(peek(), "Function definitions must come before the top-level statements.");
            }
            statements.add(statement());
        }
        return new Program(defs, new Block(statements));
    }

    private FunctionDef functionDefinition() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        consume(TokenType.COLON, "Expect ':' before function body.");

        Stmt body = suite();
        return new FunctionDef(name, params, body);
    }

    /** Either one simple statement on the same line, or an indented block. */
    private Stmt suite() {
        if (match(TokenType.NEWLINE)) {
            consume(TokenType.INDENT, "Expect an indented block.");
            List<Stmt> statements = new ArrayList<Stmt>();
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                statements.add(statement());
            }
            consume(TokenType.DEDENT, "Expect end of indented block.");
            return new Block(statements);
        }
        Stmt stmt = simpleStatement();
        consume(TokenType.NEWLINE, "Expect newline after statement.");
        return stmt;
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (check(TokenType.INDENT)) throw error(peek(), "Unexpected indent.");

        Stmt stmt = simpleStatement();
        consume(TokenType.NEWLINE, "Expect newline after statement.");
        return stmt;
    }

    // if / elif / else; an elif chain becomes nested ifs in the else branch
    private Stmt ifStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = expression();
        consume(TokenType.COLON, "Expect ':' after if condition.");
        Stmt thenBranch = suite();

        Stmt elseBranch = null;
        if (match(TokenType.ELIF)) {
            elseBranch = ifStatement();
        } else if (match(TokenType.ELSE)) {
            consume(TokenType.COLON, "Expect ':' after 'else'.");
            elseBranch = suite();
        }
        return new Statement.If(keyword, condition, thenBranch, elseBranch);
    }

    private Stmt forStatement() {
        Token variable = consume(TokenType.IDENTIFIER, "Expect loop variable after 'for'.");
        consume(TokenType.IN, "Expect 'in' after loop variable.");
        Expr.ExprInterface iterable = expression();
        consume(TokenType.COLON, "Expect ':' after for clause.");
        Stmt body = suite();
        return new Statement.For(variable, iterable, body);
    }

    private Stmt simpleStatement() {
        if (match(TokenType.RETURN)) {
            Token keyword = previous();
            return new Statement.ReturnStmt(keyword, expression());
        }

        if (match(TokenType.PRINT)) {
            Token keyword = previous();
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'print'.");
            Expr.ExprInterface value = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after print argument.");
            return new Statement.Print(keyword, value);
        }

        int line = peek().line;
        Expr.ExprInterface expr = expression();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = expression();
            if (expr instanceof Variable) {
                return new Statement.Assign(((Variable) expr).name, value);
            }
            if (expr instanceof IndexExpr) {
                IndexExpr ix = (IndexExpr) expr;
                return new Statement.SetIndex(ix.target, ix.index, value, ix.bracket);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return new ExprStmt(expr, line);
    }

    // -------------------------
    // Expressions, lowest precedence first
    // -------------------------

    private Expr.ExprInterface expression() { return or(); }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = not();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = not();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface not() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new Unary(op, not());
        }
        return comparison();
    }

    // comparisons do not chain
    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = pipe();
        if (matchComparison()) {
            Token op = previous();
            Expr.ExprInterface right = pipe();
            expr = new Binary(expr, op, right);
            if (matchComparison()) throw error(previous(), "Comparisons cannot be chained.");
        }
        return expr;
    }

    private boolean matchComparison() {
        return match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL);
    }

    private Expr.ExprInterface pipe() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.PIPE)) {
            Token function = consume(TokenType.IDENTIFIER, "Expect function name after '|'.");
            expr = new Pipe(expr, function);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return postfix();
    }

    private Expr.ExprInterface postfix() {
        Expr.ExprInterface expr = primary();
        while (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            Expr.ExprInterface index = expression();
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
            expr = new IndexExpr(expr, index, bracket);
        }
        return expr;
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NONE)) return new Literal(null);
        if (match(TokenType.INTEGER)) return new Literal(previous().literal);
        if (match(TokenType.STRING)) return new Literal(previous().literal);

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) return finishCall(name);
            return new Variable(name);
        }

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after list literal.");
            return new ListLiteral(items, bracket);
        }

        throw error(peek(), "Expect expression.");
    }

    private Expr.ExprInterface finishCall(Token name) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Call(name, arguments);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ScriptError error(Token token, String message) {
        String near = (token.type == TokenType.EOF) ? "end of input"
                : (token.lexeme.isEmpty() ? token.type.toString() : "'" + token.lexeme + "'");
        return ScriptError.syntax(token.line, message + " (near " + near + ")");
    }
}
