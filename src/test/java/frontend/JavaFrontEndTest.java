package frontend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import syntax.AstNode;
import syntax.CallNode;
import syntax.FunctionDefNode;
import syntax.IfNode;
import syntax.LoopNode;
import syntax.RaiseNode;
import syntax.SourceUnit;
import syntax.SwitchNode;
import syntax.TryCatchNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaFrontEndTest {

    private JavaFrontEnd frontEnd;

    @BeforeEach
    void setUp() {
        frontEnd = new JavaFrontEnd();
    }

    @Test
    void testCompilationUnitSelectsFirstMethodWithBody() throws ParseException {
        String source =
                "public class Calc {\n" +
                "    public int add(int a, int b) {\n" +
                "        return a + b;\n" +
                "    }\n" +
                "    public int twice(int a) {\n" +
                "        return add(a, a);\n" +
                "    }\n" +
                "}\n";

        SourceUnit unit = frontEnd.parse(source);
        FunctionDefNode fn = unit.getFunction();

        assertEquals("add(a, b)", fn.getSignature());
        assertEquals("public int add(int a, int b)", fn.getText());
        assertEquals(2, fn.getBeginLine());
        assertTrue(unit.getKnownFunctions().contains("twice"));
    }

    @Test
    void testBareMethodDeclaration() throws ParseException {
        String source =
                "int abs(int x) {\n" +
                "    if (x < 0) {\n" +
                "        return -x;\n" +
                "    }\n" +
                "    return x;\n" +
                "}\n";

        SourceUnit unit = frontEnd.parse(source);

        assertEquals("abs(x)", unit.getFunction().getSignature());
        IfNode ifNode = (IfNode) unit.getStatements().get(0);
        assertEquals("if (x < 0)", ifNode.getText());
        assertEquals("x < 0", ifNode.getCondition());
        assertEquals("return -x;", ifNode.getThenBody().getChildren().get(0).getText());
    }

    @Test
    void testNamedMethodSelection() throws ParseException {
        String source =
                "class A {\n" +
                "    void first() { }\n" +
                "    int second(int n) { return n; }\n" +
                "}\n";

        assertEquals("second(n)", frontEnd.parse(source, "second").getFunction().getSignature());
        assertThrows(ParseException.class, () -> frontEnd.parse(source, "third"));
    }

    @Test
    void testSyntaxErrorReportsLine() {
        String source =
                "class Broken {\n" +
                "    void f() {\n" +
                "        int x = ;\n" +
                "    }\n" +
                "}\n";

        ParseException e = assertThrows(ParseException.class, () -> frontEnd.parse(source));
        assertEquals(3, e.getLine());
    }

    @Test
    @DisplayName("Classic for keeps its update expressions for the loop latch")
    void testForLoopUpdate() throws ParseException {
        String source =
                "int sum(int[] xs) {\n" +
                "    int s = 0;\n" +
                "    for (int i = 0; i < xs.length; i++) {\n" +
                "        s += xs[i];\n" +
                "    }\n" +
                "    return s;\n" +
                "}\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();
        LoopNode loop = (LoopNode) statements.get(1);

        assertEquals(LoopNode.LoopKind.FOR, loop.getLoopKind());
        assertEquals("for (int i = 0; i < xs.length; i++)", loop.getText());
        assertEquals(1, loop.getUpdate().size());
        assertEquals("i++", loop.getUpdate().get(0).getText());
        assertEquals(AstNode.Kind.ASSIGN, loop.getBody().getChildren().get(0).getKind());
    }

    @Test
    void testDoWhileAndLabels() throws ParseException {
        String source =
                "void f(int n) {\n" +
                "    outer:\n" +
                "    while (n > 0) {\n" +
                "        do {\n" +
                "            n--;\n" +
                "            if (n == 3) continue outer;\n" +
                "        } while (n % 2 == 0);\n" +
                "    }\n" +
                "}\n";

        LoopNode outer = (LoopNode) frontEnd.parse(source).getStatements().get(0);
        LoopNode inner = (LoopNode) outer.getBody().getChildren().get(0);

        assertEquals("outer", outer.getLabel());
        assertEquals(LoopNode.LoopKind.DO_WHILE, inner.getLoopKind());
        assertEquals("while (n % 2 == 0);", inner.getText());
    }

    @Test
    void testSwitchWithFallThrough() throws ParseException {
        String source =
                "int f(int k) {\n" +
                "    switch (k) {\n" +
                "        case 1:\n" +
                "        case 2:\n" +
                "            k = 10;\n" +
                "            break;\n" +
                "        default:\n" +
                "            k = 0;\n" +
                "    }\n" +
                "    return k;\n" +
                "}\n";

        SwitchNode switchNode = (SwitchNode) frontEnd.parse(source).getStatements().get(0);

        assertEquals("switch (k)", switchNode.getText());
        assertEquals(3, switchNode.getCases().size());
        assertEquals("1", switchNode.getCases().get(0).getValue());
        assertTrue(switchNode.getCases().get(0).getBody().isEmpty());
        assertTrue(switchNode.hasDefault());
        assertTrue(switchNode.isFallThrough());
    }

    @Test
    void testArrowSwitchDoesNotFallThrough() throws ParseException {
        String source =
                "void f(int k) {\n" +
                "    switch (k) {\n" +
                "        case 1, 2 -> k = 10;\n" +
                "        default -> k = 0;\n" +
                "    }\n" +
                "}\n";

        SwitchNode switchNode = (SwitchNode) frontEnd.parse(source).getStatements().get(0);

        assertFalse(switchNode.isFallThrough());
        assertEquals("1, 2", switchNode.getCases().get(0).getValue());
    }

    @Test
    void testTryWithResourcesAndMultiCatch() throws ParseException {
        String source =
                "String read(String p) {\n" +
                "    try (Reader r = open(p)) {\n" +
                "        return r.toString();\n" +
                "    } catch (IOException | RuntimeException e) {\n" +
                "        return null;\n" +
                "    } finally {\n" +
                "        close();\n" +
                "    }\n" +
                "}\n";

        TryCatchNode tryNode = (TryCatchNode) frontEnd.parse(source).getStatements().get(0);

        assertEquals(2, tryNode.getBody().getChildren().size());
        assertEquals(AstNode.Kind.ASSIGN, tryNode.getBody().getChildren().get(0).getKind());
        assertEquals("IOException | RuntimeException", tryNode.getHandlers().get(0).getExceptionKind());
        assertNotNull(tryNode.getFinallyBody());
    }

    @Test
    void testThrowKind() throws ParseException {
        String source =
                "void check(int x) {\n" +
                "    if (x < 0) throw new IllegalArgumentException(\"negative\");\n" +
                "    throw error;\n" +
                "}\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();
        RaiseNode created = (RaiseNode) ((IfNode) statements.get(0)).getThenBody().getChildren().get(0);

        assertEquals("IllegalArgumentException", created.getExceptionKind());
        assertEquals("error", ((RaiseNode) statements.get(1)).getExceptionKind());
    }

    @Test
    @DisplayName("Only calls to methods of the same source become Call nodes")
    void testCallClassification() throws ParseException {
        String source =
                "class F {\n" +
                "    int fib(int n) {\n" +
                "        if (n < 2) return n;\n" +
                "        int a = fib(n - 1);\n" +
                "        this.log(a);\n" +
                "        System.out.println(a);\n" +
                "        other.fib(n);\n" +
                "        return a + fib(n - 2);\n" +
                "    }\n" +
                "    void log(int v) { }\n" +
                "}\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();

        assertEquals("fib", ((CallNode) statements.get(1)).getCallee());
        assertEquals("log", ((CallNode) statements.get(2)).getCallee());
        assertEquals(AstNode.Kind.EXPR_STATEMENT, statements.get(3).getKind());
        assertEquals(AstNode.Kind.EXPR_STATEMENT, statements.get(4).getKind());
        assertEquals(AstNode.Kind.RETURN, statements.get(5).getKind());
    }

    @Test
    void testEmptyStatementsAndNestedBlocksAreFlattened() throws ParseException {
        String source =
                "void f() {\n" +
                "    ;\n" +
                "    {\n" +
                "        int a = 1;\n" +
                "    }\n" +
                "    synchronized (this) {\n" +
                "        a2();\n" +
                "    }\n" +
                "}\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();

        assertEquals(3, statements.size());
        assertEquals("synchronized (this)", statements.get(1).getText());
        assertEquals("a2();", statements.get(2).getText());
    }
}
