package com.minipy.script.parser;

/**
 * Fatal interpreter error. Every kind aborts the whole run; there is no
 * recovery construct in the language.
 */
public class ScriptError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        NAME_ERROR("NameError"),
        TYPE_ERROR("TypeError"),
        ARITY_ERROR("ArityError"),
        INDEX_ERROR("IndexError"),
        DIVISION_ERROR("DivisionError"),
        VALUE_ERROR("ValueError"),
        SYNTAX_ERROR("SyntaxError"),
        RECURSION_ERROR("RecursionError"),
        RETURN_OUTSIDE_FUNCTION("ReturnOutsideFunction");

        public final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    private final Kind kind;
    private final int line;

    public ScriptError(Kind kind, String message) {
        this(kind, message, -1);
    }

    public ScriptError(Kind kind, String message, int line) {
        super(message);
        this.kind = kind;
        this.line = line;
    }

    public Kind kind() { return kind; }

    /** Source line, or -1 when the failing node carries none. */
    public int line() { return line; }

    /** Returns a copy carrying {@code line} unless a line is already known. */
    public ScriptError atLine(int line) {
        if (this.line >= 0 || line < 0) return this;
        ScriptError located = new ScriptError(kind, getMessage(), line);
        located.setStackTrace(getStackTrace());
        if (getCause() != null) located.initCause(getCause());
        return located;
    }

    @Override
    public String toString() {
        String where = (line >= 0) ? "[line " + line + "] " : "";
        return where + kind.label + ": " + getMessage();
    }

    public static ScriptError name(String msg) { return new ScriptError(Kind.NAME_ERROR, msg); }
    public static ScriptError type(String msg) { return new ScriptError(Kind.TYPE_ERROR, msg); }
    public static ScriptError arity(String msg) { return new ScriptError(Kind.ARITY_ERROR, msg); }
    public static ScriptError index(String msg) { return new ScriptError(Kind.INDEX_ERROR, msg); }
    public static ScriptError division(String msg) { return new ScriptError(Kind.DIVISION_ERROR, msg); }
    public static ScriptError value(String msg) { return new ScriptError(Kind.VALUE_ERROR, msg); }
    public static ScriptError syntax(int line, String msg) { return new ScriptError(Kind.SYNTAX_ERROR, msg, line); }
}
