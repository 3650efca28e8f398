package com.minipy.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.minipy.script.parser.Interpreter.ReturnSignal;
import com.minipy.script.parser.Statement.Stmt;

public class UserFunction {
    final String name;
    final List<String> params;
    final Stmt body;

    UserFunction(String name, List<String> params, Stmt body) {
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
    }

    public String name() { return name; }
    public List<String> params() { return params; }
    public int arity() { return params.size(); }

    /**
     * Runs the body in a fresh activation. {@code args} are already evaluated in the
     * caller's environment.
     */
    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw ScriptError.arity(name + "() takes " + params.size() + " argument(s) but " + args.size() + " were given");
        }

        Environment previous = interpreter.env;
        Environment frame = interpreter.newActivation(previous);
        for (int i = 0; i < params.size(); i++) {
            frame.assign(params.get(i), args.get(i));
        }

        interpreter.env = frame;
        try {
            try {
                interpreter.execute(body);
            } catch (ReturnSignal rs) {
                return rs.value;
            }
            return Value.none();
        } finally {
            interpreter.env = previous;
        }
    }
}
