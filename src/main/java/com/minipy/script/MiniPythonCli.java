package com.minipy.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.minipy.debug.Debug;
import com.minipy.debug.DebugLevel;
import com.minipy.protocol.ProgramJson;
import com.minipy.script.parser.Program;
import com.minipy.script.parser.ScriptError;

/**
 * Usage: MiniPythonCli [--compat] [--verbose] [--dump-ast] &lt;file.py|file.json&gt;
 *
 * A {@code .json} file is read as an already-parsed program (see {@link ProgramJson}).
 */
public final class MiniPythonCli {

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String[] args) {
        boolean compat = false;
        boolean verbose = false;
        boolean dumpAst = false;
        String file = null;

        for (String a : args) {
            switch (a) {
                case "--compat": compat = true; break;
                case "--verbose": verbose = true; break;
                case "--dump-ast": dumpAst = true; break;
                default:
                    if (a.startsWith("--") || file != null) return usage();
                    file = a;
            }
        }
        if (file == null) return usage();

        if (verbose) Debug.useStdErr(DebugLevel.DEBUG);

        final Path scriptPath = Path.of(file);
        final String text;
        try {
            text = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath + " (" + e.getMessage() + ")");
            return EXIT_IO;
        }

        final MiniPython engine = new MiniPython();
        engine.setMode(compat ? MiniPython.Mode.COMPAT : MiniPython.Mode.STANDARD);
        final ProgramJson json = new ProgramJson();

        try {
            Program program = file.endsWith(".json") ? json.read(text) : engine.parse(text);
            if (dumpAst) {
                System.out.println(json.write(program));
                return EXIT_OK;
            }
            engine.run(program);
            return EXIT_OK;
        } catch (ScriptError e) {
            System.out.flush();
            System.err.println(e);
            return EXIT_SCRIPT_ERROR;
        }
    }

    private static int usage() {
        System.err.println("Usage: MiniPythonCli [--compat] [--verbose] [--dump-ast] <file.py|file.json>");
        return EXIT_USAGE;
    }

    private MiniPythonCli() {}
}
