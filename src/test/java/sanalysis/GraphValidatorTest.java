package sanalysis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import syntax.AstNode;
import syntax.ExprStatementNode;
import syntax.Language;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphValidatorTest {

    private GraphValidator validator;
    private ControlFlowGraph cfg;
    private int entry;
    private int exit;

    @BeforeEach
    void setUp() {
        validator = new GraphValidator();
        cfg = new ControlFlowGraph("g()", Language.JAVA);
        entry = cfg.addBlock(BlockShape.ENTRY, "void g()");
        exit = cfg.addBlock(BlockShape.EXIT, "END");
    }

    @Test
    void testMinimalGraphIsValid() {
        cfg.addEdge(entry, exit, EdgeLabel.unconditional());

        assertTrue(validator.check(cfg).isEmpty());
        assertDoesNotThrow(() -> validator.validate(cfg));
    }

    @Test
    void testDecisionNeedsBothBranches() {
        int decision = block(BlockShape.DECISION, "if (c)");
        cfg.addEdge(entry, decision, EdgeLabel.unconditional());
        cfg.addEdge(decision, exit, EdgeLabel.branchTrue());

        List<String> problems = validator.check(cfg);

        assertEquals(1, problems.size());
        assertTrue(problems.get(0).contains("at least two successors"));
    }

    @Test
    void testDecisionWithTwoTrueEdges() {
        int decision = block(BlockShape.DECISION, "if (c)");
        int other = block(BlockShape.LINEAR, "a();");
        cfg.addEdge(entry, decision, EdgeLabel.unconditional());
        cfg.addEdge(decision, other, EdgeLabel.branchTrue());
        cfg.addEdge(decision, exit, EdgeLabel.branchTrue());
        cfg.addEdge(other, exit, EdgeLabel.unconditional());

        assertFalse(validator.check(cfg).isEmpty());
    }

    @Test
    void testSwitchNeedsExactlyOneDefault() {
        int decision = block(BlockShape.DECISION, "switch (k)");
        int one = block(BlockShape.LINEAR, "a();");
        cfg.addEdge(entry, decision, EdgeLabel.unconditional());
        cfg.addEdge(decision, one, EdgeLabel.caseMatch("1"));
        cfg.addEdge(decision, exit, EdgeLabel.caseMatch("2"));
        cfg.addEdge(one, exit, EdgeLabel.unconditional());

        List<String> problems = validator.check(cfg);

        assertEquals(1, problems.size());
        assertTrue(problems.get(0).contains("default"));
    }

    @Test
    void testUnreachableBlockIsReported() {
        int orphan = block(BlockShape.LINEAR, "a();");
        cfg.addEdge(entry, exit, EdgeLabel.unconditional());
        cfg.addEdge(orphan, exit, EdgeLabel.unconditional());

        List<String> problems = validator.check(cfg);

        assertEquals(1, problems.size());
        assertTrue(problems.get(0).contains("unreachable"));
    }

    @Test
    void testLoopShapes() {
        int header = block(BlockShape.LOOP_HEADER, "while (c)");
        int body = block(BlockShape.LINEAR, "a();");
        int latch = cfg.addBlock(BlockShape.LOOP_LATCH, "(end of iteration)");
        cfg.addEdge(entry, header, EdgeLabel.unconditional());
        cfg.addEdge(header, body, EdgeLabel.unconditional());
        cfg.addEdge(header, exit, EdgeLabel.loopExit());
        cfg.addEdge(body, latch, EdgeLabel.unconditional());
        cfg.addEdge(latch, header, EdgeLabel.loopContinue());

        assertTrue(validator.check(cfg).isEmpty());

        // a second back-edge into the same header breaks the loop shape
        cfg.addEdge(body, header, EdgeLabel.loopContinue());
        assertFalse(validator.check(cfg).isEmpty());
    }

    @Test
    void testExceptionGuardNeedsExceptionEdge() {
        int guard = block(BlockShape.EXCEPTION_GUARD, "a();");
        int next = block(BlockShape.LINEAR, "b();");
        cfg.addEdge(entry, guard, EdgeLabel.unconditional());
        cfg.addEdge(guard, next, EdgeLabel.unconditional());
        cfg.addEdge(guard, exit, EdgeLabel.unconditional());
        cfg.addEdge(next, exit, EdgeLabel.unconditional());

        assertFalse(validator.check(cfg).isEmpty());
    }

    @Test
    void testEntryWithIncomingEdge() {
        int body = block(BlockShape.LINEAR, "a();");
        cfg.addEdge(entry, body, EdgeLabel.unconditional());
        cfg.addEdge(body, entry, EdgeLabel.unconditional());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate(cfg));
        assertTrue(e.getMessage().contains("Entry block has incoming edges"));
    }

    @Test
    void testExitWithOutgoingEdge() {
        int body = block(BlockShape.LINEAR, "a();");
        cfg.addEdge(entry, body, EdgeLabel.unconditional());
        cfg.addEdge(body, exit, EdgeLabel.unconditional());
        cfg.addEdge(exit, body, EdgeLabel.unconditional());

        assertTrue(validator.check(cfg).contains("Exit block has outgoing edges"));
    }

    private int block(BlockShape shape, String text) {
        return cfg.addBlock(shape, null, Collections.<AstNode>singletonList(new ExprStatementNode(1, 1, text)));
    }
}
