package sanalysis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EdgeLabelTest {

    @Test
    void testDisplayNames() {
        assertEquals("Unconditional", EdgeLabel.unconditional().toString());
        assertEquals("BranchTrue", EdgeLabel.branchTrue().toString());
        assertEquals("LoopContinue", EdgeLabel.loopContinue().toString());
        assertEquals("CallEnter", EdgeLabel.callEnter().toString());
        assertEquals("CallReturn", EdgeLabel.callReturn().toString());
        assertEquals("CaseMatch(3)", EdgeLabel.caseMatch("3").toString());
        assertEquals("CaseMatch(default)", EdgeLabel.caseDefault().toString());
        assertEquals("ExceptionRaised(KeyError)", EdgeLabel.exceptionRaised("KeyError").toString());
    }

    @Test
    void testCallLabelsAreDistinct() {
        assertEquals(EdgeLabel.Kind.CALL_ENTER, EdgeLabel.callEnter().getKind());
        assertEquals(EdgeLabel.Kind.CALL_RETURN, EdgeLabel.callReturn().getKind());
        assertNotEquals(EdgeLabel.callEnter(), EdgeLabel.callReturn());
        assertNotEquals(EdgeLabel.unconditional(), EdgeLabel.callReturn());
    }

    @Test
    void testValueEquality() {
        assertEquals(EdgeLabel.caseMatch("1"), EdgeLabel.caseMatch("1"));
        assertEquals(EdgeLabel.caseMatch("1").hashCode(), EdgeLabel.caseMatch("1").hashCode());
        assertNotEquals(EdgeLabel.caseMatch("1"), EdgeLabel.caseDefault());
        assertTrue(EdgeLabel.caseDefault().isDefaultCase());
        assertFalse(EdgeLabel.caseMatch("1").isDefaultCase());
    }
}
