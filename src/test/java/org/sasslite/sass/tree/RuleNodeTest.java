package org.sasslite.sass.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleNodeTest {

    @Test
    void continuedWhenLastLineEndsInComma() {
        assertTrue(new RuleNode("a,", List.of(), 1, null).continued());
        assertFalse(new RuleNode("a, b", List.of(), 1, null).continued());
    }

    @Test
    void mergeKeepsPositionAndTakesChildren() {
        RuleNode first = new RuleNode("h1, h2,", List.of(), 3, "f.sass");
        CommentNode body = new CommentNode("// x", true, 5, "f.sass");
        RuleNode second = new RuleNode("h3", List.of(body), 4, "f.sass");

        RuleNode merged = first.merge(second);

        assertEquals(List.of("h1, h2,", "h3"), merged.rules());
        assertEquals(List.of("h1", "h2", "h3"), merged.selectors());
        assertEquals(3, merged.line());
        assertEquals(List.of(body), merged.children());
        assertFalse(merged.continued());
    }

    @Test
    void needsAtLeastOneRule() {
        assertThrows(IllegalArgumentException.class, () -> new RuleNode(List.of(), List.of(), 1, null));
    }

    @Test
    void selectorsSplitOnlyOnTopLevelCommas() {
        RuleNode rule = new RuleNode(List.of("a:not(.b, .c), d,", "input[value=\"x,y\"], :is(e, f) g"),
                List.of(), 1, null);

        assertEquals(List.of("a:not(.b, .c)", "d", "input[value=\"x,y\"]", ":is(e, f) g"), rule.selectors());
    }

    @Test
    void quotedCommaInsideAttributeSelector() {
        RuleNode rule = new RuleNode("a[title='x, y'], b", List.of(), 1, null);
        assertEquals(List.of("a[title='x, y']", "b"), rule.selectors());
    }
}
