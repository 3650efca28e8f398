package com.minipy.script;

import java.util.Map;

import com.minipy.script.parser.Value;

public class RunResult {
    private final Map<String, Value> env;
    private final int linesPrinted;

    public RunResult(Map<String, Value> env, int linesPrinted) {
        this.env = env;
        this.linesPrinted = linesPrinted;
    }

    /** Top-level bindings after the run. */
    public Map<String, Value> env() { return env; }
    public int linesPrinted() { return linesPrinted; }
}
