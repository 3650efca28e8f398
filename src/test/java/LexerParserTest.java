import com.minipy.script.MiniPython;
import com.minipy.script.parser.Expr;
import com.minipy.script.parser.Lexer;
import com.minipy.script.parser.Program;
import com.minipy.script.parser.ScriptError;
import com.minipy.script.parser.Statement;
import com.minipy.script.parser.Token;
import com.minipy.script.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.minipy.script.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class LexerParserTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    private static ScriptError syntaxError(String src) {
        ScriptError e = assertThrows(ScriptError.class, () -> new MiniPython().parse(src));
        assertEquals(ScriptError.Kind.SYNTAX_ERROR, e.kind(), e.toString());
        return e;
    }

    private static List<String> run(String src) {
        MiniPython mp = new MiniPython();
        List<String> out = new ArrayList<>();
        mp.setOutput(out::add);
        mp.run(src);
        return out;
    }

    // ---------------- lexer ----------------

    @Test
    void layoutTokens_forIndentedBlock() {
        assertEquals(List.of(
                IF, IDENTIFIER, COLON, NEWLINE,
                INDENT, IDENTIFIER, EQUAL, INTEGER, NEWLINE,
                DEDENT, IDENTIFIER, EQUAL, INTEGER, NEWLINE,
                EOF), types("if x:\n    y = 1\nz = 2\n"));
    }

    @Test
    void missingFinalNewline_stillClosesBlocks() {
        assertEquals(List.of(
                FOR, IDENTIFIER, IN, IDENTIFIER, COLON, NEWLINE,
                INDENT, PRINT, LEFT_PAREN, IDENTIFIER, RIGHT_PAREN, NEWLINE,
                DEDENT, EOF), types("for i in L:\n    print(i)"));
    }

    @Test
    void blankAndCommentLines_produceNothing() {
        assertEquals(List.of(IDENTIFIER, EQUAL, INTEGER, NEWLINE, EOF),
                types("# header\n\n   \nx = 1  # trailing\n        # indented comment\n"));
    }

    @Test
    void lineBreaksInsideBrackets_areIgnored() {
        assertEquals(List.of(
                IDENTIFIER, EQUAL, LEFT_BRACKET, INTEGER, COMMA,
                INTEGER, RIGHT_BRACKET, NEWLINE, EOF), types("x = [1,\n        2]\n"));
        assertEquals(List.of("[1, 2]"), run("x = [1,\n  2]\nprint(x)\n"));
    }

    @Test
    void backslashJoinsLines() {
        assertEquals(List.of("3"), run("x = 1 + \\\n    2\nprint(x)\n"));
    }

    @Test
    void keywordsAndLiterals() {
        List<Token> tokens = new Lexer("def f(a): return not True and None or \"s\\n\\\"q\\\"\" | g\n").tokenize();
        List<TokenType> ts = new ArrayList<>();
        for (Token t : tokens) ts.add(t.type);
        assertEquals(List.of(DEF, IDENTIFIER, LEFT_PAREN, IDENTIFIER, RIGHT_PAREN, COLON,
                RETURN, NOT, TRUE, AND, NONE, OR, STRING, PIPE, IDENTIFIER, NEWLINE, EOF), ts);
        assertEquals("s\n\"q\"", tokens.get(12).literal);
    }

    @Test
    void integerLiteral_isLong() {
        Token t = new Lexer("9000000000\n").tokenize().get(0);
        assertEquals(INTEGER, t.type);
        assertEquals(9000000000L, t.literal);
    }

    @Test
    void floorDivisionSpelling_isSameAsSlash() {
        assertEquals(List.of(INTEGER, SLASH, INTEGER, SLASH, INTEGER, NEWLINE, EOF), types("7 // 2 / 1\n"));
        assertEquals(List.of("3", "-3", "3"), run("print(7 // 2)\nprint(-7 / 2)\nprint(7 / 2)\n"));
    }

    @Test
    void tokensCarryLineNumbers() {
        List<Token> tokens = new Lexer("a = 1\n\nb = 2\n").tokenize();
        assertEquals(1, tokens.get(0).line);
        assertEquals("b", tokens.get(4).lexeme);
        assertEquals(3, tokens.get(4).line);
    }

    @Test
    void lexerErrors() {
        assertEquals(3, syntaxError("if x:\n    a = 1\n  b = 2\n").line());
        syntaxError("print(\"abc)\n");
        syntaxError("print(\"abc");
        syntaxError("x = \"\\q\"\n");
        syntaxError("x = 99999999999999999999\n");
        syntaxError("x = 12abc\n");
        syntaxError("x = 1 ! 2\n");
        syntaxError("x = $\n");
        syntaxError("x = 1)\n");
    }

    // ---------------- parser ----------------

    @Test
    void program_splitsDefinitionsFromMain() {
        Program p = new MiniPython().parse("def f(a, b):\n    return a\ndef g(): return 1\nx = f(1, 2)\nprint(x)\n");

        assertEquals(2, p.definitions().size());
        assertEquals("f", p.definitions().get(0).name.lexeme);
        assertEquals(2, p.definitions().get(0).params.size());
        assertEquals(0, p.definitions().get(1).params.size());

        Statement.Block main = (Statement.Block) p.main();
        assertEquals(2, main.statements.size());
        assertTrue(main.statements.get(0) instanceof Statement.Assign);
        assertTrue(main.statements.get(1) instanceof Statement.Print);
    }

    @Test
    void pipe_isItsOwnNodeAndBindsTighterThanComparison() {
        Program p = new MiniPython().parse("x = [1, 2] | f == 3\n");
        Statement.Assign a = (Statement.Assign) ((Statement.Block) p.main()).statements.get(0);

        Expr.Binary eq = (Expr.Binary) a.value;
        assertEquals(EQUAL_EQUAL, eq.operator.type);
        Expr.Pipe pipe = (Expr.Pipe) eq.left;
        assertEquals("f", pipe.function.lexeme);
        assertTrue(pipe.left instanceof Expr.ListLiteral);
    }

    @Test
    void arithmeticPrecedence() {
        assertEquals(List.of("7", "9", "-1", "True", "1"),
                run("print(1 + 2 * 3)\nprint((1 + 2) * 3)\nprint(-3 + 2)\nprint(not 1 > 2 and True)\nprint(10 - 6 - 3)\n"));
    }

    @Test
    void indexAssignment_parsesToSetIndex() {
        Program p = new MiniPython().parse("L[0] = 5\n");
        assertTrue(((Statement.Block) p.main()).statements.get(0) instanceof Statement.SetIndex);
    }

    @Test
    void elifChain_nestsInElseBranch() {
        Program p = new MiniPython().parse("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n");
        Statement.If outer = (Statement.If) ((Statement.Block) p.main()).statements.get(0);
        Statement.If inner = (Statement.If) outer.elseBranch;
        assertNotNull(inner.elseBranch);
    }

    @Test
    void parserErrors() {
        syntaxError("print(1 < 2 < 3)\n");
        syntaxError("x = 1\ndef f(): return 1\n");
        syntaxError("1 = 2\n");
        syntaxError("f(x) = 2\n");
        syntaxError("if x\n    y = 1\n");
        syntaxError("def f(:\n    return 1\n");
        syntaxError("print 1\n");
        syntaxError("x = (1 + 2\n");
        syntaxError("x = 1 2\n");
        syntaxError("    x = 1\n");
        syntaxError("def f():\nreturn 1\n");
        syntaxError("x = [1, 2] | 3\n");
    }

    @Test
    void parserError_mentionsOffendingToken() {
        ScriptError e = syntaxError("x = 1\ny = + \n");
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("near"), e.getMessage());
    }
}
