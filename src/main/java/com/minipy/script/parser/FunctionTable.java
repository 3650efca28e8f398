package com.minipy.script.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.minipy.debug.Debug;
import com.minipy.script.parser.Statement.FunctionDef;

/**
 * Registry of global function definitions.
 *
 * Filled once before the top-level statement runs, then frozen; lookups after
 * that never see a change.
 */
public class FunctionTable {
    private static final String TAG = "minipy.functions";

    private final Map<String, UserFunction> functions = new LinkedHashMap<>();
    private final Set<String> reserved;
    private boolean frozen = false;

    /** @param reserved builtin names a definition may not take */
    public FunctionTable(Collection<String> reserved) {
        this.reserved = (reserved == null) ? Collections.emptySet() : new LinkedHashSet<>(reserved);
    }

    public void define(FunctionDef def) {
        if (frozen) throw new IllegalStateException("Function table is frozen; cannot define " + def.name.lexeme);

        String name = def.name.lexeme;
        if (reserved.contains(name)) {
            throw new ScriptError(ScriptError.Kind.NAME_ERROR, "Function name conflicts with builtin: " + name, def.name.line);
        }
        if (functions.containsKey(name)) {
            throw new ScriptError(ScriptError.Kind.NAME_ERROR, "Function already defined: " + name, def.name.line);
        }

        List<String> params = new ArrayList<>(def.params.size());
        for (Token p : def.params) {
            if (params.contains(p.lexeme)) {
                throw new ScriptError(ScriptError.Kind.NAME_ERROR,
                        "Duplicate parameter '" + p.lexeme + "' in function " + name, p.line);
            }
            params.add(p.lexeme);
        }

        functions.put(name, new UserFunction(name, params, def.body));
        Debug.get().d(TAG, "defined " + name + "/" + params.size());
    }

    public void defineAll(List<FunctionDef> defs) {
        for (FunctionDef def : defs) define(def);
    }

    public void freeze() { frozen = true; }

    public boolean isFrozen() { return frozen; }

    public boolean contains(String name) { return functions.containsKey(name); }

    public UserFunction lookup(String name) {
        UserFunction fn = functions.get(name);
        if (fn == null) throw ScriptError.name("function '" + name + "' is not defined");
        return fn;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}
