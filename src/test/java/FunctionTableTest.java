import com.minipy.script.parser.Expr;
import com.minipy.script.parser.FunctionTable;
import com.minipy.script.parser.ScriptError;
import com.minipy.script.parser.Statement;
import com.minipy.script.parser.Statement.FunctionDef;
import com.minipy.script.parser.Token;
import com.minipy.script.parser.TokenType;
import com.minipy.script.parser.UserFunction;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionTableTest {

    private static FunctionDef def(String name, int line, String... params) {
        List<Token> ps = new ArrayList<>();
        for (String p : params) ps.add(Token.identifier(p, line));
        Statement.ReturnStmt body = new Statement.ReturnStmt(
                new Token(TokenType.RETURN, "return", null, line + 1), new Expr.Literal(null));
        return new FunctionDef(Token.identifier(name, line), ps, body);
    }

    @Test
    void define_thenLookup() {
        FunctionTable table = new FunctionTable(Set.of("len"));
        table.define(def("f", 1, "a", "b"));

        UserFunction f = table.lookup("f");
        assertEquals("f", f.name());
        assertEquals(List.of("a", "b"), f.params());
        assertEquals(2, f.arity());
        assertTrue(table.contains("f"));
        assertEquals(Set.of("f"), table.names());
    }

    @Test
    void duplicateDefinition_isNameErrorAtSecondDef() {
        FunctionTable table = new FunctionTable(null);
        table.define(def("f", 1));

        ScriptError e = assertThrows(ScriptError.class, () -> table.define(def("f", 4, "x")));
        assertEquals(ScriptError.Kind.NAME_ERROR, e.kind());
        assertEquals(4, e.line());
    }

    @Test
    void builtinName_isReserved() {
        FunctionTable table = new FunctionTable(Set.of("len", "range"));
        ScriptError e = assertThrows(ScriptError.class, () -> table.define(def("range", 2, "n")));
        assertEquals(ScriptError.Kind.NAME_ERROR, e.kind());
    }

    @Test
    void duplicateParameter_isNameError() {
        FunctionTable table = new FunctionTable(null);
        ScriptError e = assertThrows(ScriptError.class, () -> table.define(def("g", 3, "a", "a")));
        assertEquals(ScriptError.Kind.NAME_ERROR, e.kind());
        assertFalse(table.contains("g"));
    }

    @Test
    void frozenTable_rejectsDefinitions() {
        FunctionTable table = new FunctionTable(null);
        table.defineAll(List.of(def("a", 1), def("b", 2)));
        table.freeze();

        assertTrue(table.isFrozen());
        assertThrows(IllegalStateException.class, () -> table.define(def("c", 3)));
        assertEquals(Set.of("a", "b"), table.names());
    }

    @Test
    void lookupMissing_isNameError() {
        FunctionTable table = new FunctionTable(null);
        ScriptError e = assertThrows(ScriptError.class, () -> table.lookup("nope"));
        assertEquals(ScriptError.Kind.NAME_ERROR, e.kind());
        assertTrue(e.getMessage().contains("nope"));
    }
}
