package com.minipy.script.parser;

import java.util.List;

public class Statement {

	public interface Stmt {
        void accept(StmtVisitor visitor);

        /** Source line, or -1 if unknown. */
        int line();
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitPrintStmt(Print stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitAssignStmt(Assign stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitForStmt(For stmt);
        void visitSetIndexStmt(SetIndex stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        private final int line;

        public ExprStmt(Expr.ExprInterface expression, int line) {
            this.expression = expression;
            this.line = line;
        }

        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
        public int line() { return line; }
    }

    public static final class Print implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface expression;

        public Print(Token keyword, Expr.ExprInterface expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
        public int line() { return keyword.line; }
    }

    /** Statement sequence. Shares the enclosing environment. */
    public static final class Block implements Stmt {
        public final List<Stmt> statements;

        public Block(List<Stmt> statements) { this.statements = statements; }

        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
        public int line() { return -1; }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch; // may be null

        public If(Token keyword, Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class Assign implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;

        public Assign(Token name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssignStmt(this); }
        public int line() { return name.line; }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;

        public ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class For implements Stmt {
        public final Token variable;
        public final Expr.ExprInterface iterable;
        public final Stmt body;

        public For(Token variable, Expr.ExprInterface iterable, Stmt body) {
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
        public int line() { return variable.line; }
    }

    /** {@code target[index] = value}. */
    public static final class SetIndex implements Stmt {
        public final Expr.ExprInterface target;
        public final Expr.ExprInterface index;
        public final Expr.ExprInterface value;
        public final Token bracket;

        public SetIndex(Expr.ExprInterface target, Expr.ExprInterface index, Expr.ExprInterface value, Token bracket) {
            this.target = target;
            this.index = index;
            this.value = value;
            this.bracket = bracket;
        }

        public void accept(StmtVisitor visitor) { visitor.visitSetIndexStmt(this); }
        public int line() { return bracket.line; }
    }

    /** Global function definition. Not a statement: definitions are registered before anything runs. */
    public static final class FunctionDef {
        public final Token name;
        public final List<Token> params;
        public final Stmt body;

        public FunctionDef(Token name, List<Token> params, Stmt body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }
    }
}
