package com.minipy.script.parser;

import java.util.Collections;
import java.util.List;

import com.minipy.script.parser.Statement.FunctionDef;
import com.minipy.script.parser.Statement.Stmt;

/** A parsed program: the global function definitions plus the top-level statement. */
public class Program {
    private final List<FunctionDef> definitions;
    private final Stmt main;

    public Program(List<FunctionDef> definitions, Stmt main) {
        if (main == null) throw new IllegalArgumentException("main statement must not be null");
        this.definitions = (definitions == null) ? Collections.emptyList() : Collections.unmodifiableList(definitions);
        this.main = main;
    }

    public List<FunctionDef> definitions() { return definitions; }
    public Stmt main() { return main; }
}
