package com.minipy.script;

import com.minipy.debug.Debug;
import com.minipy.script.parser.Environment;
import com.minipy.script.parser.Interpreter;
import com.minipy.script.parser.Lexer;
import com.minipy.script.parser.Parser;
import com.minipy.script.parser.Program;
import com.minipy.script.parser.ScriptError;
import com.minipy.script.parser.Token;
import com.minipy.script.parser.Value;

import java.io.PrintStream;
import java.util.*;

/**
 * MiniPython engine.
 *
 * - Python-like syntax (def / if / elif / else / for-in / print / return / |)
 * - Types: None, bool, int (64-bit), str, list (fixed length, shared by reference)
 * - Function calls:
 *     - Built-ins: len, range, plus anything registered via registerFunction
 *     - Global user-defined functions (def name(a, b): ...)
 * - Mode:
 *     - STANDARD (default): a call sees only its parameters; 'or' short-circuits
 *     - COMPAT: a call starts from a copy of the caller's variables and 'or'
 *               always evaluates both operands
 */
public class MiniPython {
    private static final String TAG = "minipy.engine";

    /** Evaluation mode. Default STANDARD. */
    public enum Mode {
        STANDARD,
        COMPAT
    }

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /** Receives one line per executed {@code print}. */
    public interface PrintSink {
        void println(String line);
    }

    /** Error reporter hook used to surface fatal errors to the host before they are rethrown. */
    public interface SystemErrorReporter {
        void report(ScriptError error, String functionName);
    }

    // ===================== ENGINE PUBLIC API =====================

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<String, BuiltinFunction>();
    private int maxCallDepth = 500;
    private Mode mode = Mode.STANDARD;
    private PrintSink output = stdout(System.out);
    private SystemErrorReporter errorReporter = null;

    public MiniPython() {
        registerCoreBuiltins();
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.STANDARD : mode; }

    public Mode getMode() { return mode; }

    public void setOutput(PrintSink sink) { this.output = (sink == null) ? stdout(System.out) : sink; }

    public void setErrorReporter(SystemErrorReporter reporter) { this.errorReporter = reporter; }

    public void registerFunction(String name, BuiltinFunction fn) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("builtin name must not be empty");
        if (fn == null) throw new IllegalArgumentException("builtin must not be null: " + name);
        functions.put(name, fn);
    }

    public boolean hasFunction(String name) { return functions.containsKey(name); }

    /** Print sink writing to {@code out}, flushed after every line. */
    public static PrintSink stdout(PrintStream out) {
        return line -> {
            out.println(line);
            out.flush();
        };
    }

    /** Lex and parse source text. Fails with a SYNTAX_ERROR {@link ScriptError}. */
    public Program parse(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(tokens);
        try {
            return parser.parse();
        } catch (StackOverflowError so) {
            ScriptError e = ScriptError.syntax(-1, "source is nested too deeply to parse");
            e.initCause(so);
            throw e;
        }
    }

    public RunResult run(String source) {
        Program program;
        try {
            program = parse(source);
        } catch (ScriptError e) {
            onError(e, null);
            throw e;
        }
        return run(program);
    }

    /** Registers the program's functions, then runs its top-level statement in a fresh environment. */
    public RunResult run(Program program) {
        Environment env = new Environment();
        Interpreter interpreter = new Interpreter(env, functions, maxCallDepth, mode, output);

        Debug.get().i(TAG, "run: " + program.definitions().size() + " function(s), mode=" + mode);
        try {
            interpreter.run(program);
        } catch (ScriptError e) {
            onError(e, interpreter);
            throw e;
        } catch (StackOverflowError so) {
            ScriptError e = new ScriptError(ScriptError.Kind.RECURSION_ERROR,
                    "host stack exhausted (deep recursion or a self-containing list)");
            e.initCause(so);
            onError(e, interpreter);
            throw e;
        }

        Debug.get().i(TAG, "run finished: " + interpreter.linesPrinted() + " line(s) printed");
        return new RunResult(interpreter.environment().snapshot(), interpreter.linesPrinted());
    }

    private void onError(ScriptError e, Interpreter interpreter) {
        String fn = (interpreter == null) ? null : interpreter.failedFunctionName();
        Debug.get().e(TAG, e.toString() + (fn == null ? "" : " (in " + fn + ")"));

        if (errorReporter == null) return;
        try {
            errorReporter.report(e, fn);
        } catch (RuntimeException re) {
            Debug.get().e(TAG, "error reporter failed", re);
        }
    }

    private void registerCoreBuiltins() {
        registerFunction("len", args -> {
            requireArgCount("len", args, 1);
            Value v = args.get(0);
            if (v.getType() != Value.Type.LIST) {
                throw ScriptError.type("object of type '" + v.typeName() + "' has no len()");
            }
            return Value.integer(v.length());
        });

        registerFunction("range", args -> {
            requireArgCount("range", args, 1);
            Value v = args.get(0);
            if (v.getType() != Value.Type.INT) {
                throw ScriptError.type("range() argument must be int, not '" + v.typeName() + "'");
            }
            long n = v.asInt();
            if (n < 0) throw ScriptError.value("range() argument must be non-negative, got " + n);
            if (n > Integer.MAX_VALUE - 8) throw ScriptError.value("range() argument too large: " + n);

            Value[] items = new Value[(int) n];
            for (int i = 0; i < items.length; i++) items[i] = Value.integer(i);
            return Value.list(items);
        });
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw ScriptError.arity(name + "() takes " + expected + " argument(s) but " + args.size() + " were given");
        }
    }
}
