package frontend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import syntax.AstNode;
import syntax.CallNode;
import syntax.CatchHandler;
import syntax.FunctionDefNode;
import syntax.IfNode;
import syntax.LoopNode;
import syntax.RaiseNode;
import syntax.SourceUnit;
import syntax.SwitchNode;
import syntax.TryCatchNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonFrontEndTest {

    private PythonFrontEnd frontEnd;

    @BeforeEach
    void setUp() {
        frontEnd = new PythonFrontEnd();
    }

    @Test
    void testSelectsFirstFunctionAndBuildsSignature() throws ParseException {
        String source =
                "import math\n" +
                "\n" +
                "def area(r: float, scale=2):\n" +
                "    return math.pi * r * r * scale\n" +
                "\n" +
                "def other():\n" +
                "    pass\n";

        SourceUnit unit = frontEnd.parse(source);
        FunctionDefNode fn = unit.getFunction();

        assertEquals("area", fn.getName());
        assertEquals("area(r, scale)", fn.getSignature());
        assertEquals("def area(r: float, scale=2):", fn.getText());
        assertEquals(3, fn.getBeginLine());
        assertTrue(unit.getKnownFunctions().contains("other"));
        assertEquals(AstNode.Kind.RETURN, unit.getStatements().get(0).getKind());
    }

    @Test
    void testSelectsNamedFunctionInsideClass() throws ParseException {
        String source =
                "class Stack:\n" +
                "    def push(self, item):\n" +
                "        self.items.append(item)\n" +
                "    def pop(self):\n" +
                "        return self.items.pop()\n";

        FunctionDefNode fn = frontEnd.parse(source, "pop").getFunction();

        assertEquals("pop(self)", fn.getSignature());
        assertEquals(4, fn.getBeginLine());
    }

    @Test
    void testUnknownFunctionName() {
        ParseException e = assertThrows(ParseException.class,
                () -> frontEnd.parse("def f():\n    pass\n", "g"));
        assertTrue(e.getMessage().contains("'g'"));
    }

    @Test
    void testNoFunctionDefinition() {
        assertThrows(ParseException.class, () -> frontEnd.parse("x = 1\n"));
    }

    @Test
    @DisplayName("elif chains become nested If nodes in the else branch")
    void testElifChain() throws ParseException {
        String source =
                "def grade(n):\n" +
                "    if n > 90:\n" +
                "        return 'A'\n" +
                "    elif n > 80:\n" +
                "        return 'B'\n" +
                "    else:\n" +
                "        return 'C'\n";

        IfNode outer = (IfNode) frontEnd.parse(source).getStatements().get(0);

        assertEquals("if n > 90:", outer.getText());
        assertEquals("n > 90", outer.getCondition());
        assertTrue(outer.hasElse());
        IfNode nested = (IfNode) outer.getElseBody().getChildren().get(0);
        assertEquals("elif n > 80:", nested.getText());
        assertTrue(nested.hasElse());
        assertEquals("return 'C'", nested.getElseBody().getChildren().get(0).getText());
    }

    @Test
    void testInlineSuitesAndSemicolons() throws ParseException {
        String source =
                "def f(x):\n" +
                "    if x: return 1\n" +
                "    a = 1; b = 2\n" +
                "    return a + b\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();

        assertEquals(4, statements.size());
        IfNode ifNode = (IfNode) statements.get(0);
        assertEquals(AstNode.Kind.RETURN, ifNode.getThenBody().getChildren().get(0).getKind());
        assertEquals(AstNode.Kind.ASSIGN, statements.get(1).getKind());
        assertEquals("b = 2", statements.get(2).getText());
    }

    @Test
    void testLoopElseClause() throws ParseException {
        String source =
                "def find(xs, t):\n" +
                "    for x in xs:\n" +
                "        if x == t:\n" +
                "            break\n" +
                "    else:\n" +
                "        return -1\n" +
                "    return x\n";

        LoopNode loop = (LoopNode) frontEnd.parse(source).getStatements().get(0);

        assertEquals(LoopNode.LoopKind.FOR, loop.getLoopKind());
        assertEquals("for x in xs:", loop.getText());
        assertNotNull(loop.getElseBody());
        assertEquals(AstNode.Kind.RETURN, loop.getElseBody().getChildren().get(0).getKind());
    }

    @Test
    void testTryExceptElseFinally() throws ParseException {
        String source =
                "def load(path):\n" +
                "    try:\n" +
                "        f = open(path)\n" +
                "    except (IOError, OSError) as e:\n" +
                "        return None\n" +
                "    except ValueError:\n" +
                "        raise\n" +
                "    else:\n" +
                "        data = f.read()\n" +
                "    finally:\n" +
                "        log(path)\n" +
                "    return data\n";

        TryCatchNode tryNode = (TryCatchNode) frontEnd.parse(source).getStatements().get(0);

        assertEquals(2, tryNode.getHandlers().size());
        assertEquals("IOError | OSError", tryNode.getHandlers().get(0).getExceptionKind());
        assertEquals("ValueError", tryNode.getHandlers().get(1).getExceptionKind());
        RaiseNode reraise = (RaiseNode) tryNode.getHandlers().get(1).getBody().getChildren().get(0);
        assertEquals("exception", reraise.getExceptionKind());
        assertNotNull(tryNode.getElseBody());
        assertNotNull(tryNode.getFinallyBody());
    }

    @Test
    void testBareExceptIsWildcard() throws ParseException {
        String source =
                "def f():\n" +
                "    try:\n" +
                "        g()\n" +
                "    except:\n" +
                "        pass\n";

        TryCatchNode tryNode = (TryCatchNode) frontEnd.parse(source).getStatements().get(0);

        assertTrue(tryNode.getHandlers().get(0).isWildcard());
        assertEquals(CatchHandler.WILDCARD, tryNode.getHandlers().get(0).getExceptionKind());
    }

    @Test
    @DisplayName("Calls to functions defined in the same source become Call nodes")
    void testCallClassification() throws ParseException {
        String source =
                "def fact(n):\n" +
                "    if n <= 1:\n" +
                "        return 1\n" +
                "    rest = fact(n - 1)\n" +
                "    helper(n)\n" +
                "    print(rest)\n" +
                "    return n * rest\n" +
                "\n" +
                "def helper(n):\n" +
                "    pass\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();

        assertEquals(AstNode.Kind.CALL, statements.get(1).getKind());
        assertEquals("fact", ((CallNode) statements.get(1)).getCallee());
        assertEquals(AstNode.Kind.CALL, statements.get(2).getKind());
        assertEquals(AstNode.Kind.EXPR_STATEMENT, statements.get(3).getKind());
    }

    @Test
    void testYieldAndRaiseKinds() throws ParseException {
        String source =
                "def gen(n):\n" +
                "    yield n\n" +
                "    x = yield\n" +
                "    raise ValueError('bad') from None\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();

        assertEquals(AstNode.Kind.YIELD, statements.get(0).getKind());
        assertEquals(AstNode.Kind.YIELD, statements.get(1).getKind());
        assertEquals("ValueError", ((RaiseNode) statements.get(2)).getExceptionKind());
    }

    @Test
    void testWithIsFlattened() throws ParseException {
        String source =
                "def read(p):\n" +
                "    with open(p) as f:\n" +
                "        data = f.read()\n" +
                "    return data\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();

        assertEquals(3, statements.size());
        assertEquals("with open(p) as f:", statements.get(0).getText());
        assertEquals(AstNode.Kind.ASSIGN, statements.get(1).getKind());
    }

    @Test
    void testMatchStatement() throws ParseException {
        String source =
                "def describe(cmd):\n" +
                "    match cmd:\n" +
                "        case 'go':\n" +
                "            return 1\n" +
                "        case _:\n" +
                "            return 0\n";

        SwitchNode switchNode = (SwitchNode) frontEnd.parse(source).getStatements().get(0);

        assertEquals("cmd", switchNode.getSelector());
        assertEquals(2, switchNode.getCases().size());
        assertEquals("'go'", switchNode.getCases().get(0).getValue());
        assertTrue(switchNode.hasDefault());
        assertFalse(switchNode.isFallThrough());
    }

    @Test
    void testMatchUsedAsIdentifier() throws ParseException {
        List<AstNode> statements = frontEnd.parse("def f(match):\n    match = 3\n    return match\n")
                .getStatements();

        assertEquals(AstNode.Kind.ASSIGN, statements.get(0).getKind());
    }

    @Test
    void testDocstringSkippingIsConfigurable() throws ParseException {
        String source =
                "def f():\n" +
                "    \"\"\"Doc.\"\"\"\n" +
                "    return 1\n";

        assertEquals(2, frontEnd.parse(source).getStatements().size());
        assertEquals(1, new PythonFrontEnd(8, true).parse(source).getStatements().size());
    }

    @Test
    void testNestedDefIsSingleStatement() throws ParseException {
        String source =
                "def outer():\n" +
                "    def inner():\n" +
                "        return 1\n" +
                "    return inner()\n";

        List<AstNode> statements = frontEnd.parse(source).getStatements();

        assertEquals(2, statements.size());
        assertEquals(AstNode.Kind.FUNCTION_DEF, statements.get(0).getKind());
        assertEquals(AstNode.Kind.RETURN, statements.get(1).getKind());
    }

    @Test
    void testMissingIndentedBlock() {
        ParseException e = assertThrows(ParseException.class,
                () -> frontEnd.parse("def f(x):\n    if x:\n    return 1\n"));
        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().startsWith("expected an indented block"));
    }

    @Test
    void testUnexpectedIndent() {
        ParseException e = assertThrows(ParseException.class,
                () -> frontEnd.parse("def f(x):\n    a = 1\n        b = 2\n"));
        assertEquals(3, e.getLine());
        assertEquals("unexpected indent", e.getMessage());
    }

    @Test
    void testInconsistentDedent() {
        ParseException e = assertThrows(ParseException.class,
                () -> frontEnd.parse("def f(x):\n    if x:\n        a = 1\n      b = 2\n"));
        assertEquals(4, e.getLine());
    }

    @Test
    void testMissingColon() {
        ParseException e = assertThrows(ParseException.class,
                () -> frontEnd.parse("def f(x):\n    while x\n        x -= 1\n"));
        assertEquals("expected ':' after 'while'", e.getMessage());
    }

    @Test
    void testStrayElse() {
        ParseException e = assertThrows(ParseException.class,
                () -> frontEnd.parse("def f(x):\n    else:\n        pass\n"));
        assertTrue(e.getMessage().contains("'else'"));
    }

    @Test
    void testParseErrorFormat() {
        ParseException e = new ParseException(3, "unexpected indent");
        assertEquals("ParseError{line=3, message=unexpected indent}", e.toString());
    }
}
