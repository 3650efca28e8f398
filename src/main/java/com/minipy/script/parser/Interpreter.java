package com.minipy.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.minipy.debug.Debug;
import com.minipy.debug.DebugLevel;
import com.minipy.script.MiniPython.BuiltinFunction;
import com.minipy.script.MiniPython.Mode;
import com.minipy.script.MiniPython.PrintSink;
import com.minipy.script.parser.Expr.Binary;
import com.minipy.script.parser.Expr.Call;
import com.minipy.script.parser.Expr.ExprInterface;
import com.minipy.script.parser.Expr.ExprVisitor;
import com.minipy.script.parser.Expr.IndexExpr;
import com.minipy.script.parser.Expr.ListLiteral;
import com.minipy.script.parser.Expr.Literal;
import com.minipy.script.parser.Expr.Logical;
import com.minipy.script.parser.Expr.Pipe;
import com.minipy.script.parser.Expr.Unary;
import com.minipy.script.parser.Expr.Variable;
import com.minipy.script.parser.Statement.Assign;
import com.minipy.script.parser.Statement.Block;
import com.minipy.script.parser.Statement.ExprStmt;
import com.minipy.script.parser.Statement.For;
import com.minipy.script.parser.Statement.If;
import com.minipy.script.parser.Statement.Print;
import com.minipy.script.parser.Statement.ReturnStmt;
import com.minipy.script.parser.Statement.SetIndex;
import com.minipy.script.parser.Statement.Stmt;
import com.minipy.script.parser.Statement.StmtVisitor;

/**
 * Tree-walking evaluator. One instance runs one program; it is not thread-safe.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "minipy.interp";

    Environment env;
    private final Map<String, BuiltinFunction> builtins;
    private final FunctionTable functions;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    private final Mode mode;
    private final PrintSink out;
    private int linesPrinted = 0;
    private String failedIn = null;

    public Interpreter(Environment env, Map<String, BuiltinFunction> builtins, int maxDepth, Mode mode, PrintSink out) {
        this.env = env;
        this.builtins = builtins;
        this.functions = new FunctionTable(builtins.keySet());
        this.maxDepth = maxDepth;
        this.mode = (mode == null) ? Mode.STANDARD : mode;
        this.out = out;
    }

    /**
     * Registers every definition, then executes the top-level statement in this
     * interpreter's environment.
     */
    public void run(Program program) {
        functions.defineAll(program.definitions());
        functions.freeze();

        try {
            execute(program.main());
        } catch (ReturnSignal rs) {
            throw new ScriptError(ScriptError.Kind.RETURN_OUTSIDE_FUNCTION, "'return' outside function", rs.line);
        }
    }

    public Environment environment() { return env; }

    public int linesPrinted() { return linesPrinted; }

    /** Innermost user function that was active when the run failed, or null for top level. */
    public String failedFunctionName() { return failedIn; }

    /** Environment for a new call made from {@code caller}, per the linkage mode. */
    Environment newActivation(Environment caller) {
        return (mode == Mode.COMPAT) ? caller.copy() : new Environment();
    }

    // -------------------------
    // Statements
    // -------------------------

    public void execute(Stmt stmt) {
        try {
            stmt.accept(this);
        } catch (ScriptError e) {
            throw e.atLine(stmt.line());
        }
    }

    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    public void visitPrintStmt(Print stmt) {
        Value v = eval(stmt.expression);
        out.println(v.display());
        linesPrinted++;
    }

    public void visitBlockStmt(Block stmt) {
        for (Stmt s : stmt.statements) execute(s);
    }

    public void visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) execute(stmt.thenBranch);
        else if (stmt.elseBranch != null) execute(stmt.elseBranch);
    }

    public void visitAssignStmt(Assign stmt) {
        Value value = eval(stmt.value);
        env.assign(stmt.name.lexeme, value);
    }

    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(eval(stmt.value), stmt.keyword.line);
    }

    public void visitForStmt(For stmt) {
        Value iterable = eval(stmt.iterable);
        if (iterable.getType() != Value.Type.LIST) {
            throw ScriptError.type("'" + iterable.typeName() + "' object is not iterable");
        }

        // Iterate over the elements present when the loop starts.
        Value[] items = iterable.asList().clone();
        String name = stmt.variable.lexeme;
        for (Value item : items) {
            env.assign(name, item);
            execute(stmt.body);
        }
    }

    public void visitSetIndexStmt(SetIndex stmt) {
        Value target = eval(stmt.target);
        Value idx = eval(stmt.index);
        Value value = eval(stmt.value);

        requireList(target, "does not support item assignment");
        requireIndex(idx);
        target.set(idx.asInt(), value);
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value eval(ExprInterface expr) { return expr.accept(this); }

    public Value visitLiteralExpr(Literal expr) {
        if (expr.value == null) return Value.none();
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Long) return Value.integer((Long) expr.value);
        if (expr.value instanceof Integer) return Value.integer((Integer) expr.value);
        if (expr.value instanceof String) return Value.string((String) expr.value);
        throw new IllegalStateException("Unsupported literal value: " + expr.value);
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        TokenType op = expr.operator.type;

        switch (op) {
            case PLUS: {
                if (left.getType() == Value.Type.INT && right.getType() == Value.Type.INT) {
                    return Value.integer(left.asInt() + right.asInt());
                }
                if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                if (left.getType() == Value.Type.LIST && right.getType() == Value.Type.LIST) {
                    return left.concat(right);
                }
                throw unsupported(expr.operator, left, right);
            }
            case MINUS:
                requireInts(left, right, expr.operator);
                return Value.integer(left.asInt() - right.asInt());
            case STAR:
                requireInts(left, right, expr.operator);
                return Value.integer(left.asInt() * right.asInt());
            case SLASH:
                requireInts(left, right, expr.operator);
                if (right.asInt() == 0L) throw ScriptError.division("integer division by zero");
                return Value.integer(left.asInt() / right.asInt());
            case PERCENT:
                requireInts(left, right, expr.operator);
                if (right.asInt() == 0L) throw ScriptError.division("integer modulo by zero");
                return Value.integer(left.asInt() % right.asInt());

            case EQUAL_EQUAL:
                return Value.bool(left.equals(right));
            case BANG_EQUAL:
                return Value.bool(!left.equals(right));
            case LESS:
                return Value.bool(left.compareTo(right) < 0);
            case LESS_EQUAL:
                return Value.bool(left.compareTo(right) <= 0);
            case GREATER:
                return Value.bool(left.compareTo(right) > 0);
            case GREATER_EQUAL:
                return Value.bool(left.compareTo(right) >= 0);

            default:
                throw new IllegalStateException("Unsupported binary operator: " + op);
        }
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case MINUS:
                if (right.getType() != Value.Type.INT) {
                    throw ScriptError.type("bad operand type for unary -: '" + right.typeName() + "'");
                }
                return Value.integer(-right.asInt());
            case NOT:
                return Value.bool(!requireBool(right, "not"));
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    public Value visitLogicalExpr(Logical expr) {
        boolean left = requireBool(eval(expr.left), expr.operator.lexeme);

        if (expr.operator.type == TokenType.AND) {
            if (!left) return Value.bool(false);
            return Value.bool(requireBool(eval(expr.right), expr.operator.lexeme));
        }

        if (expr.operator.type == TokenType.OR) {
            if (mode == Mode.COMPAT) {
                // Both operands are always evaluated in this mode.
                boolean right = requireBool(eval(expr.right), expr.operator.lexeme);
                return Value.bool(left || right);
            }
            if (left) return Value.bool(true);
            return Value.bool(requireBool(eval(expr.right), expr.operator.lexeme));
        }

        throw new IllegalStateException("Unsupported logical operator: " + expr.operator.type);
    }

    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name.lexeme);
    }

    public Value visitCallExpr(Call expr) {
        return call(expr.name, expr.arguments);
    }

    public Value visitPipeExpr(Pipe expr) {
        List<ExprInterface> args = (expr.left instanceof ListLiteral)
                ? ((ListLiteral) expr.left).elements
                : Collections.singletonList(expr.left);
        return call(expr.function, args);
    }

    public Value visitListExpr(ListLiteral expr) {
        Value[] items = new Value[expr.elements.size()];
        for (int i = 0; i < items.length; i++) items[i] = eval(expr.elements.get(i));
        return Value.list(items);
    }

    public Value visitIndexExpr(IndexExpr expr) {
        Value target = eval(expr.target);
        Value idx = eval(expr.index);

        requireList(target, "is not subscriptable");
        requireIndex(idx);
        return target.get(idx.asInt());
    }

    // -------------------------
    // Calls
    // -------------------------

    private Value call(Token name, List<ExprInterface> argExprs) {
        String fnName = name.lexeme;

        BuiltinFunction builtin = builtins.get(fnName);
        UserFunction fn = (builtin == null) ? functions.lookup(fnName) : null;

        // Arguments are evaluated left to right in the caller's environment.
        List<Value> args = new ArrayList<Value>(argExprs.size());
        for (ExprInterface a : argExprs) args.add(eval(a));

        if (builtin != null) {
            Value result = builtin.call(args);
            return (result == null) ? Value.none() : result;
        }

        if (callStack.size() >= maxDepth) {
            throw new ScriptError(ScriptError.Kind.RECURSION_ERROR,
                    "maximum call depth exceeded (" + maxDepth + ") calling " + fnName, name.line);
        }

        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "call " + fnName + args + " depth=" + callStack.size());
        }

        callStack.push(new CallFrame(fnName, args));
        try {
            return fn.call(this, args);
        } catch (ScriptError e) {
            if (failedIn == null) failedIn = fnName;
            throw e;
        } finally {
            CallFrame done = callStack.pop();
            if (Debug.get().isEnabled(DebugLevel.TRACE)) {
                Debug.get().t(TAG, "leave " + done.functionName + done.arguments);
            }
        }
    }

    // -------------------------
    // Checks
    // -------------------------

    private static boolean requireBool(Value v, String op) {
        if (v.getType() != Value.Type.BOOL) {
            throw ScriptError.type("operand of '" + op + "' must be bool, got '" + v.typeName() + "'");
        }
        return v.asBool();
    }

    private static void requireInts(Value a, Value b, Token op) {
        if (a.getType() != Value.Type.INT || b.getType() != Value.Type.INT) {
            throw unsupported(op, a, b);
        }
    }

    private static void requireList(Value target, String what) {
        if (target.getType() != Value.Type.LIST) {
            throw ScriptError.type("'" + target.typeName() + "' object " + what);
        }
    }

    private static void requireIndex(Value idx) {
        if (idx.getType() != Value.Type.INT) {
            throw ScriptError.type("list indices must be integers, not '" + idx.typeName() + "'");
        }
    }

    private static ScriptError unsupported(Token op, Value a, Value b) {
        return ScriptError.type("unsupported operand type(s) for " + op.lexeme + ": '"
                + a.typeName() + "' and '" + b.typeName() + "'");
    }

    /**
     * Non-local exit raised by {@code return} and caught where the function was
     * called. Not an error.
     */
    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        final int line;

        ReturnSignal(Value value, int line) {
            super(null, null, false, false);
            this.value = value;
            this.line = line;
        }
    }
}
