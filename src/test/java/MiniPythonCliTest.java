import com.minipy.script.MiniPythonCli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MiniPythonCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream savedOut;
    private PrintStream savedErr;

    @BeforeEach
    void capture() {
        savedOut = System.out;
        savedErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restore() {
        System.setOut(savedOut);
        System.setErr(savedErr);
    }

    private Path script(String name, String text) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, text, StandardCharsets.UTF_8);
        return p;
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"); }
    private String stderr() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void runsScript() throws IOException {
        Path p = script("ok.py", "def f(x):\n    return x + 1\nprint(f(41))\n");
        assertEquals(0, MiniPythonCli.execute(new String[] { p.toString() }));
        assertEquals("42\n", stdout());
    }

    @Test
    void compatFlag_switchesLinkage() throws IOException {
        Path p = script("compat.py", "def show():\n    print(v)\nv = 7\nshow()\n");

        assertEquals(1, MiniPythonCli.execute(new String[] { p.toString() }));
        assertTrue(stderr().contains("NameError"), stderr());

        out.reset();
        assertEquals(0, MiniPythonCli.execute(new String[] { "--compat", p.toString() }));
        assertEquals("7\n", stdout());
    }

    @Test
    void scriptError_exitsWithOneAfterEarlierOutput() throws IOException {
        Path p = script("bad.py", "print(\"first\")\nprint(1 / 0)\n");
        assertEquals(1, MiniPythonCli.execute(new String[] { p.toString() }));
        assertEquals("first\n", stdout());
        assertTrue(stderr().contains("[line 2] DivisionError:"), stderr());
    }

    @Test
    void syntaxError_exitsWithOne() throws IOException {
        Path p = script("syntax.py", "print(1 < 2 < 3)\n");
        assertEquals(1, MiniPythonCli.execute(new String[] { p.toString() }));
        assertEquals("", stdout());
    }

    @Test
    void usageErrors_exitWithTwo() {
        assertEquals(2, MiniPythonCli.execute(new String[0]));
        assertEquals(2, MiniPythonCli.execute(new String[] { "--nope", "x.py" }));
        assertEquals(2, MiniPythonCli.execute(new String[] { "a.py", "b.py" }));
        assertTrue(stderr().contains("Usage"));
    }

    @Test
    void unreadableFile_exitsWithThree() {
        assertEquals(3, MiniPythonCli.execute(new String[] { dir.resolve("missing.py").toString() }));
    }

    @Test
    void dumpAst_thenRunTheDumpedJson() throws IOException {
        Path p = script("prog.py", "def sq(x): return x * x\nprint([3] | sq)\n");

        assertEquals(0, MiniPythonCli.execute(new String[] { "--dump-ast", p.toString() }));
        String dumped = stdout();
        assertTrue(dumped.contains("\"defs\""), dumped);
        assertTrue(dumped.contains("\"sq\""), dumped);

        Path json = script("prog.json", dumped);
        out.reset();
        assertEquals(0, MiniPythonCli.execute(new String[] { json.toString() }));
        assertEquals("9\n", stdout());
    }

    @Test
    void deeplyNestedSource_exitsWithOne() throws IOException {
        Path p = script("deep.py", "x = " + "[".repeat(50000) + "]".repeat(50000) + "\n");
        assertEquals(1, MiniPythonCli.execute(new String[] { p.toString() }));
        assertTrue(stderr().contains("SyntaxError"), stderr());
    }
}
