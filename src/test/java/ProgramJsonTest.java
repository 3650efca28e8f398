import com.minipy.protocol.ProgramJson;
import com.minipy.script.MiniPython;
import com.minipy.script.parser.Program;
import com.minipy.script.parser.ScriptError;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramJsonTest {

    private final ProgramJson json = new ProgramJson();

    private static List<String> run(Program program, MiniPython.Mode mode) {
        MiniPython mp = new MiniPython();
        mp.setMode(mode);
        List<String> out = new ArrayList<>();
        mp.setOutput(out::add);
        mp.run(program);
        return out;
    }

    @Test
    void read_runsHandWrittenProgram() {
        String src = "{"
                + "\"defs\": [{\"name\": \"inc\", \"params\": [\"x\"], \"body\":"
                + "  {\"stmt\": \"return\", \"value\": {\"expr\": \"binop\", \"op\": \"+\","
                + "    \"left\": {\"expr\": \"ident\", \"name\": \"x\"}, \"right\": {\"expr\": \"const\", \"value\": 1}}}}],"
                + "\"main\": {\"stmt\": \"block\", \"body\": ["
                + "  {\"stmt\": \"assign\", \"name\": \"L\", \"value\": {\"expr\": \"list\", \"items\": ["
                + "    {\"expr\": \"const\", \"value\": 1}, {\"expr\": \"const\", \"value\": \"two\"}, {\"expr\": \"const\", \"value\": null}]}},"
                + "  {\"stmt\": \"print\", \"expr\": {\"expr\": \"ident\", \"name\": \"L\"}},"
                + "  {\"stmt\": \"print\", \"expr\": {\"expr\": \"pipe\", \"left\": {\"expr\": \"const\", \"value\": 41}, \"func\": \"inc\"}},"
                + "  {\"stmt\": \"if\", \"cond\": {\"expr\": \"unop\", \"op\": \"not\", \"operand\": {\"expr\": \"const\", \"value\": false}},"
                + "    \"then\": {\"stmt\": \"print\", \"expr\": {\"expr\": \"get\", \"target\": {\"expr\": \"ident\", \"name\": \"L\"},"
                + "      \"index\": {\"expr\": \"const\", \"value\": 1}}}}"
                + "]}}";

        assertEquals(List.of("[1, two, None]", "42", "two"), run(json.read(src), MiniPython.Mode.STANDARD));
    }

    @Test
    void logicalOperators_keepTheirEvaluationRules() {
        String src = "{\"defs\": [{\"name\": \"side\", \"params\": [], \"body\": {\"stmt\": \"block\", \"body\": ["
                + "  {\"stmt\": \"print\", \"expr\": {\"expr\": \"const\", \"value\": \"side\"}},"
                + "  {\"stmt\": \"return\", \"value\": {\"expr\": \"const\", \"value\": true}}]}}],"
                + "\"main\": {\"stmt\": \"print\", \"expr\": {\"expr\": \"binop\", \"op\": \"or\","
                + "  \"left\": {\"expr\": \"const\", \"value\": true}, \"right\": {\"expr\": \"call\", \"name\": \"side\", \"args\": []}}}}";

        Program p = json.read(src);
        assertEquals(List.of("True"), run(p, MiniPython.Mode.STANDARD));
        assertEquals(List.of("side", "True"), run(p, MiniPython.Mode.COMPAT));
    }

    @Test
    void lineFields_reachRuntimeErrors() {
        String src = "{\"main\": {\"stmt\": \"block\", \"body\": ["
                + "  {\"stmt\": \"print\", \"line\": 7, \"expr\": {\"expr\": \"binop\", \"op\": \"/\","
                + "    \"left\": {\"expr\": \"const\", \"value\": 1}, \"right\": {\"expr\": \"const\", \"value\": 0}}}]}}";

        MiniPython mp = new MiniPython();
        mp.setOutput(line -> { });
        ScriptError e = assertThrows(ScriptError.class, () -> mp.run(json.read(src)));
        assertEquals(ScriptError.Kind.DIVISION_ERROR, e.kind());
        assertEquals(7, e.line());
    }

    @Test
    void malformedInput_isSyntaxError() {
        String[] bad = {
                "{not json",
                "[]",
                "{}",
                "{\"main\": {\"stmt\": \"loop\"}}",
                "{\"main\": {\"stmt\": \"print\", \"expr\": {\"expr\": \"lambda\"}}}",
                "{\"main\": {\"stmt\": \"print\", \"expr\": {\"expr\": \"binop\", \"op\": \"**\","
                        + " \"left\": {\"expr\": \"const\", \"value\": 1}, \"right\": {\"expr\": \"const\", \"value\": 1}}}}",
                "{\"main\": {\"stmt\": \"print\", \"expr\": {\"expr\": \"const\", \"value\": 1.5}}}",
                "{\"main\": {\"stmt\": \"print\", \"expr\": {\"expr\": \"const\", \"value\": 99999999999999999999999}}}",
                "{\"defs\": [{\"name\": \"f\", \"params\": [1], \"body\": {\"stmt\": \"block\", \"body\": []}}],"
                        + " \"main\": {\"stmt\": \"block\", \"body\": []}}",
        };
        for (String s : bad) {
            ScriptError e = assertThrows(ScriptError.class, () -> json.read(s), s);
            assertEquals(ScriptError.Kind.SYNTAX_ERROR, e.kind(), s);
        }
    }

    @Test
    void writtenProgram_readsBackAndBehavesTheSame() {
        MiniPython mp = new MiniPython();
        String source = String.join("\n",
                "def total(L):",
                "    s = 0",
                "    for x in L:",
                "        if x % 2 == 0 and not x == 4:",
                "            s = s + x",
                "        elif x > 6 or x < 0:",
                "            s = s - 1",
                "    return s",
                "L = range(10)",
                "L[0] = -3",
                "print(L | total)",
                "print([L, \"done\"])",
                "");
        Program parsed = mp.parse(source);

        String text = json.write(parsed);
        assertTrue(text.contains("\"defs\""));
        assertTrue(text.contains("\"pipe\""));

        Program reread = json.read(text);
        assertEquals(run(parsed, MiniPython.Mode.STANDARD), run(reread, MiniPython.Mode.STANDARD));
        assertEquals(text, json.write(reread));
    }
}
