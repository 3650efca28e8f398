package com.minipy.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local bindings of one activation (a function call or the top-level program).
 *
 * Assignment replaces any earlier binding for the name; there is no shadow
 * stack and blocks do not open new scopes.
 */
public class Environment {

    private final Map<String, Value> vars;

    public Environment() {
        this.vars = new LinkedHashMap<>();
    }

    public Environment(Map<String, Value> initial) {
        this.vars = new LinkedHashMap<>();
        if (initial != null) vars.putAll(initial); // values are shared, not copied
    }

    /**
     * New activation environment seeded with this environment's bindings.
     * Bound values (lists included) are shared with this environment; only the
     * name table is independent.
     */
    public Environment copy() {
        return new Environment(vars);
    }

    // -------------------------
    // Vars API
    // -------------------------
    public void assign(String name, Value value) {
        if (value == null) throw new IllegalArgumentException("Cannot bind null to " + name);
        vars.put(name, value);
    }

    public Value get(String name) {
        Value v = vars.get(name);
        if (v == null) throw ScriptError.name("name '" + name + "' is not defined");
        return v;
    }

    public boolean exists(String name) {
        return vars.containsKey(name);
    }

    public int size() {
        return vars.size();
    }

    /** Read-only view of the bindings in assignment order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(vars));
    }
}
