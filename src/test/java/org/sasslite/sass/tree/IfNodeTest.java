package org.sasslite.sass.tree;

import org.junit.jupiter.api.Test;
import org.sasslite.sass.script.VariableReference;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IfNodeTest {

    private static IfNode branch(String variable, int line) {
        return new IfNode(variable == null ? null : new VariableReference(variable), List.of(), null, line, null);
    }

    @Test
    void withElseAppendsToTheEndOfTheChain() {
        IfNode chain = branch("a", 1).withElse(branch("b", 3)).withElse(branch(null, 5));

        assertEquals(new VariableReference("a"), chain.condition());
        assertEquals(3, chain.elseBranch().line());
        assertEquals(5, chain.elseBranch().elseBranch().line());
        assertTrue(chain.elseBranch().elseBranch().isUnconditional());
        assertFalse(chain.isUnconditional());
    }

    @Test
    void withElseLeavesTheOriginalUntouched() {
        IfNode original = branch("a", 1);
        original.withElse(branch(null, 2));
        assertNull(original.elseBranch());
    }
}
