package com.minipy.protocol;

import com.minipy.debug.Debug;
import com.minipy.script.parser.Expr;
import com.minipy.script.parser.Expr.ExprInterface;
import com.minipy.script.parser.Program;
import com.minipy.script.parser.ScriptError;
import com.minipy.script.parser.Statement;
import com.minipy.script.parser.Statement.FunctionDef;
import com.minipy.script.parser.Statement.Stmt;
import com.minipy.script.parser.Token;
import com.minipy.script.parser.TokenType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON interchange format for parsed programs, so a front end other than
 * {@link com.minipy.script.parser.Parser} can hand programs to the interpreter.
 *
 * <pre>
 * {"defs": [{"name": "f", "params": ["x"], "body": STMT}], "main": STMT}
 *
 * STMT: {"stmt": "expr",   "expr": EXPR}
 *       {"stmt": "print",  "expr": EXPR}
 *       {"stmt": "block",  "body": [STMT...]}
 *       {"stmt": "if",     "cond": EXPR, "then": STMT, "else": STMT?}
 *       {"stmt": "assign", "name": "x", "value": EXPR}
 *       {"stmt": "return", "value": EXPR}
 *       {"stmt": "for",    "var": "x", "iter": EXPR, "body": STMT}
 *       {"stmt": "set",    "target": EXPR, "index": EXPR, "value": EXPR}
 *
 * EXPR: {"expr": "const", "value": null|true|false|123|"text"}
 *       {"expr": "binop", "op": "+", "left": EXPR, "right": EXPR}
 *       {"expr": "unop",  "op": "-"|"not", "operand": EXPR}
 *       {"expr": "ident", "name": "x"}
 *       {"expr": "call",  "name": "f", "args": [EXPR...]}
 *       {"expr": "list",  "items": [EXPR...]}
 *       {"expr": "get",   "target": EXPR, "index": EXPR}
 *       {"expr": "pipe",  "left": EXPR, "func": "f"}
 * </pre>
 *
 * Every node may carry an optional integer {@code "line"}.
 */
public final class ProgramJson {
    private static final String TAG = "minipy.json";

    private static final Map<String, TokenType> BINARY_OPS;
    private static final Map<TokenType, String> BINARY_NAMES;
    static {
        Map<String, TokenType> m = new HashMap<>();
        m.put("+", TokenType.PLUS);
        m.put("-", TokenType.MINUS);
        m.put("*", TokenType.STAR);
        m.put("/", TokenType.SLASH);
        m.put("//", TokenType.SLASH);
        m.put("%", TokenType.PERCENT);
        m.put("==", TokenType.EQUAL_EQUAL);
        m.put("!=", TokenType.BANG_EQUAL);
        m.put("<", TokenType.LESS);
        m.put("<=", TokenType.LESS_EQUAL);
        m.put(">", TokenType.GREATER);
        m.put(">=", TokenType.GREATER_EQUAL);
        m.put("and", TokenType.AND);
        m.put("or", TokenType.OR);
        BINARY_OPS = Collections.unmodifiableMap(m);

        Map<TokenType, String> n = new EnumMap<>(TokenType.class);
        for (Map.Entry<String, TokenType> e : m.entrySet()) {
            if (!"//".equals(e.getKey())) n.put(e.getValue(), e.getKey());
        }
        BINARY_NAMES = Collections.unmodifiableMap(n);
    }

    private final ObjectMapper om = new ObjectMapper();

    // -------------------------- Reading --------------------------

    public Program read(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw ScriptError.syntax(e.getLocation() == null ? -1 : e.getLocation().getLineNr(),
                    "Malformed program JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) throw malformed(root, "program must be a JSON object");

        List<FunctionDef> defs = new ArrayList<>();
        JsonNode defsNode = root.path("defs");
        if (!defsNode.isMissingNode()) {
            for (JsonNode d : array(defsNode, "defs")) defs.add(readDef(d));
        }

        Stmt main = readStmt(required(root, "main"));
        Debug.get().d(TAG, "loaded program: " + defs.size() + " function(s)");
        return new Program(defs, main);
    }

    private FunctionDef readDef(JsonNode d) {
        int line = line(d);
        Token name = Token.identifier(text(d, "name"), line);
        List<Token> params = new ArrayList<>();
        for (JsonNode p : array(required(d, "params"), "params")) {
            if (!p.isTextual()) throw malformed(d, "parameter names must be strings");
            params.add(Token.identifier(p.asText(), line));
        }
        return new FunctionDef(name, params, readStmt(required(d, "body")));
    }

    private Stmt readStmt(JsonNode n) {
        if (!n.isObject()) throw malformed(n, "statement must be an object");
        int line = line(n);
        String kind = text(n, "stmt");

        switch (kind) {
            case "expr":
                return new Statement.ExprStmt(readExpr(required(n, "expr")), line);
            case "print":
                return new Statement.Print(keyword(TokenType.PRINT, "print", line), readExpr(required(n, "expr")));
            case "block": {
                List<Stmt> body = new ArrayList<>();
                for (JsonNode s : array(required(n, "body"), "body")) body.add(readStmt(s));
                return new Statement.Block(body);
            }
            case "if": {
                JsonNode elseNode = n.path("else");
                Stmt elseBranch = (elseNode.isMissingNode() || elseNode.isNull()) ? null : readStmt(elseNode);
                return new Statement.If(keyword(TokenType.IF, "if", line),
                        readExpr(required(n, "cond")), readStmt(required(n, "then")), elseBranch);
            }
            case "assign":
                return new Statement.Assign(Token.identifier(text(n, "name"), line), readExpr(required(n, "value")));
            case "return":
                return new Statement.ReturnStmt(keyword(TokenType.RETURN, "return", line), readExpr(required(n, "value")));
            case "for":
                return new Statement.For(Token.identifier(text(n, "var"), line),
                        readExpr(required(n, "iter")), readStmt(required(n, "body")));
            case "set":
                return new Statement.SetIndex(readExpr(required(n, "target")), readExpr(required(n, "index")),
                        readExpr(required(n, "value")), keyword(TokenType.LEFT_BRACKET, "[", line));
            default:
                throw malformed(n, "unknown statement kind '" + kind + "'");
        }
    }

    private ExprInterface readExpr(JsonNode n) {
        if (!n.isObject()) throw malformed(n, "expression must be an object");
        int line = line(n);
        String kind = text(n, "expr");

        switch (kind) {
            case "const":
                return new Expr.Literal(constant(n));
            case "binop": {
                String op = text(n, "op");
                TokenType type = BINARY_OPS.get(op);
                if (type == null) throw malformed(n, "unknown binary operator '" + op + "'");
                Token token = new Token(type, op, null, line);
                ExprInterface left = readExpr(required(n, "left"));
                ExprInterface right = readExpr(required(n, "right"));
                if (type == TokenType.AND || type == TokenType.OR) return new Expr.Logical(left, token, right);
                return new Expr.Binary(left, token, right);
            }
            case "unop": {
                String op = text(n, "op");
                TokenType type;
                if ("-".equals(op)) type = TokenType.MINUS;
                else if ("not".equals(op)) type = TokenType.NOT;
                else throw malformed(n, "unknown unary operator '" + op + "'");
                return new Expr.Unary(new Token(type, op, null, line), readExpr(required(n, "operand")));
            }
            case "ident":
                return new Expr.Variable(Token.identifier(text(n, "name"), line));
            case "call": {
                List<ExprInterface> args = new ArrayList<>();
                for (JsonNode a : array(required(n, "args"), "args")) args.add(readExpr(a));
                return new Expr.Call(Token.identifier(text(n, "name"), line), args);
            }
            case "list": {
                List<ExprInterface> items = new ArrayList<>();
                for (JsonNode a : array(required(n, "items"), "items")) items.add(readExpr(a));
                return new Expr.ListLiteral(items, keyword(TokenType.LEFT_BRACKET, "[", line));
            }
            case "get":
                return new Expr.IndexExpr(readExpr(required(n, "target")), readExpr(required(n, "index")),
                        keyword(TokenType.LEFT_BRACKET, "[", line));
            case "pipe":
                return new Expr.Pipe(readExpr(required(n, "left")), Token.identifier(text(n, "func"), line));
            default:
                throw malformed(n, "unknown expression kind '" + kind + "'");
        }
    }

    private Object constant(JsonNode n) {
        JsonNode v = n.path("value");
        if (v.isMissingNode() || v.isNull()) return null;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isIntegralNumber()) {
            if (!v.canConvertToLong()) throw malformed(n, "integer constant out of range: " + v.asText());
            return v.longValue();
        }
        if (v.isTextual()) return v.textValue();
        throw malformed(n, "unsupported constant: " + v);
    }

    // -------------------------- Writing --------------------------

    public String write(Program program) {
        ObjectNode root = om.createObjectNode();
        ArrayNode defs = root.putArray("defs");
        for (FunctionDef def : program.definitions()) {
            ObjectNode d = defs.addObject();
            d.put("name", def.name.lexeme);
            ArrayNode params = d.putArray("params");
            for (Token p : def.params) params.add(p.lexeme);
            d.set("body", writeStmt(def.body));
        }
        root.set("main", writeStmt(program.main()));

        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize program", e);
        }
    }

    private ObjectNode writeStmt(Stmt stmt) {
        ObjectNode n = om.createObjectNode();
        if (stmt instanceof Statement.ExprStmt) {
            n.put("stmt", "expr");
            n.set("expr", writeExpr(((Statement.ExprStmt) stmt).expression));
        } else if (stmt instanceof Statement.Print) {
            n.put("stmt", "print");
            n.set("expr", writeExpr(((Statement.Print) stmt).expression));
        } else if (stmt instanceof Statement.Block) {
            n.put("stmt", "block");
            ArrayNode body = n.putArray("body");
            for (Stmt s : ((Statement.Block) stmt).statements) body.add(writeStmt(s));
        } else if (stmt instanceof Statement.If) {
            Statement.If s = (Statement.If) stmt;
            n.put("stmt", "if");
            n.set("cond", writeExpr(s.condition));
            n.set("then", writeStmt(s.thenBranch));
            if (s.elseBranch != null) n.set("else", writeStmt(s.elseBranch));
        } else if (stmt instanceof Statement.Assign) {
            Statement.Assign s = (Statement.Assign) stmt;
            n.put("stmt", "assign");
            n.put("name", s.name.lexeme);
            n.set("value", writeExpr(s.value));
        } else if (stmt instanceof Statement.ReturnStmt) {
            n.put("stmt", "return");
            n.set("value", writeExpr(((Statement.ReturnStmt) stmt).value));
        } else if (stmt instanceof Statement.For) {
            Statement.For s = (Statement.For) stmt;
            n.put("stmt", "for");
            n.put("var", s.variable.lexeme);
            n.set("iter", writeExpr(s.iterable));
            n.set("body", writeStmt(s.body));
        } else if (stmt instanceof Statement.SetIndex) {
            Statement.SetIndex s = (Statement.SetIndex) stmt;
            n.put("stmt", "set");
            n.set("target", writeExpr(s.target));
            n.set("index", writeExpr(s.index));
            n.set("value", writeExpr(s.value));
        } else {
            throw new IllegalArgumentException("Unsupported statement: " + stmt.getClass().getName());
        }
        if (stmt.line() >= 0) n.put("line", stmt.line());
        return n;
    }

    private ObjectNode writeExpr(ExprInterface expr) {
        ObjectNode n = om.createObjectNode();
        if (expr instanceof Expr.Literal) {
            Object v = ((Expr.Literal) expr).value;
            n.put("expr", "const");
            if (v == null) n.putNull("value");
            else if (v instanceof Boolean) n.put("value", (Boolean) v);
            else if (v instanceof Long) n.put("value", (Long) v);
            else if (v instanceof Integer) n.put("value", (Integer) v);
            else n.put("value", v.toString());
        } else if (expr instanceof Expr.Binary) {
            Expr.Binary b = (Expr.Binary) expr;
            writeBinary(n, b.operator, b.left, b.right);
        } else if (expr instanceof Expr.Logical) {
            Expr.Logical b = (Expr.Logical) expr;
            writeBinary(n, b.operator, b.left, b.right);
        } else if (expr instanceof Expr.Unary) {
            Expr.Unary u = (Expr.Unary) expr;
            n.put("expr", "unop");
            n.put("op", u.operator.type == TokenType.NOT ? "not" : "-");
            n.set("operand", writeExpr(u.right));
            n.put("line", u.operator.line);
        } else if (expr instanceof Expr.Variable) {
            Token name = ((Expr.Variable) expr).name;
            n.put("expr", "ident");
            n.put("name", name.lexeme);
            n.put("line", name.line);
        } else if (expr instanceof Expr.Call) {
            Expr.Call c = (Expr.Call) expr;
            n.put("expr", "call");
            n.put("name", c.name.lexeme);
            ArrayNode args = n.putArray("args");
            for (ExprInterface a : c.arguments) args.add(writeExpr(a));
            n.put("line", c.name.line);
        } else if (expr instanceof Expr.ListLiteral) {
            n.put("expr", "list");
            ArrayNode items = n.putArray("items");
            for (ExprInterface a : ((Expr.ListLiteral) expr).elements) items.add(writeExpr(a));
        } else if (expr instanceof Expr.IndexExpr) {
            Expr.IndexExpr ix = (Expr.IndexExpr) expr;
            n.put("expr", "get");
            n.set("target", writeExpr(ix.target));
            n.set("index", writeExpr(ix.index));
        } else if (expr instanceof Expr.Pipe) {
            Expr.Pipe p = (Expr.Pipe) expr;
            n.put("expr", "pipe");
            n.set("left", writeExpr(p.left));
            n.put("func", p.function.lexeme);
        } else {
            throw new IllegalArgumentException("Unsupported expression: " + expr.getClass().getName());
        }
        return n;
    }

    private void writeBinary(ObjectNode n, Token op, ExprInterface left, ExprInterface right) {
        String name = BINARY_NAMES.get(op.type);
        if (name == null) throw new IllegalArgumentException("Unsupported operator: " + op.type);
        n.put("expr", "binop");
        n.put("op", name);
        n.set("left", writeExpr(left));
        n.set("right", writeExpr(right));
        n.put("line", op.line);
    }

    // -------------------------- Helpers --------------------------

    private static Token keyword(TokenType type, String lexeme, int line) {
        return new Token(type, lexeme, null, line);
    }

    private static int line(JsonNode n) {
        JsonNode l = n.path("line");
        return l.canConvertToInt() ? l.intValue() : -1;
    }

    private static JsonNode required(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) throw malformed(n, "missing field '" + field + "'");
        return v;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = required(n, field);
        if (!v.isTextual()) throw malformed(n, "field '" + field + "' must be a string");
        return v.textValue();
    }

    private static JsonNode array(JsonNode v, String field) {
        if (!v.isArray()) throw malformed(v, "field '" + field + "' must be an array");
        return v;
    }

    private static ScriptError malformed(JsonNode n, String msg) {
        return ScriptError.syntax(n == null ? -1 : line(n), "Malformed program JSON: " + msg);
    }
}
