package com.minipy.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLogicalExpr(Logical expr);
        R visitVariableExpr(Variable expr);
        R visitCallExpr(Call expr);
        R visitListExpr(ListLiteral expr);
        R visitIndexExpr(IndexExpr expr);
        R visitPipeExpr(Pipe expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    /** Constant: {@code null} (None), Boolean, Long or String. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    /** Arithmetic and comparison operators. */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** {@code and} / {@code or}. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    /** Call of a global function or builtin by name. Functions are not values. */
    public static final class Call implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> arguments;

        public Call(Token name, List<ExprInterface> arguments) {
            this.name = name;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /**
     * {@code left | function}. When {@code left} is a list literal its elements are
     * passed as separate arguments; anything else is passed as the only argument.
     */
    public static final class Pipe implements ExprInterface {
        public final ExprInterface left;
        public final Token function;

        public Pipe(ExprInterface left, Token function) {
            this.left = left;
            this.function = function;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPipeExpr(this);
        }
    }

    // -------------------------
    // Lists
    // -------------------------

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> elements;
        public final Token bracket;

        public ListLiteral(List<ExprInterface> elements, Token bracket) {
            this.elements = elements;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListExpr(this);
        }
    }

    public static final class IndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public IndexExpr(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }
}
