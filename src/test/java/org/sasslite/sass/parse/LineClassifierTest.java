package org.sasslite.sass.parse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sasslite.sass.SassOptions.PropertySyntax;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier(null);

    @Test
    @DisplayName("Old-style properties and pseudo selectors")
    void oldProperties() {
        assertEquals(LineKind.OLD_PROPERTY, classifier.classify(":color red"));
        assertEquals(LineKind.OLD_PROPERTY, classifier.classify(":width= $w"));
        assertEquals(LineKind.RULE, classifier.classify("::selection"));
        assertEquals(LineKind.OLD_PROPERTY, classifier.classify(":hover"));
    }

    @Test
    @DisplayName("With the new property syntax a bare :name is a pseudo-class")
    void pseudoClassUnderNewSyntax() {
        LineClassifier newSyntax = new LineClassifier(PropertySyntax.NEW);
        assertEquals(LineKind.RULE, newSyntax.classify(":hover"));
        assertEquals(LineKind.OLD_PROPERTY, newSyntax.classify(":color red"));
    }

    @Test
    void newProperties() {
        assertEquals(LineKind.NEW_PROPERTY, classifier.classify("color: red"));
        assertEquals(LineKind.NEW_PROPERTY, classifier.classify("color = $c"));
        assertEquals(LineKind.NEW_PROPERTY, classifier.classify("font:"));
        assertEquals(LineKind.RULE, classifier.classify("a:hover"));
        assertEquals(LineKind.RULE, classifier.classify("a[href]"));
        assertEquals(LineKind.RULE, classifier.classify("#main .content"));
    }

    @Test
    void introducerCharacters() {
        assertEquals(LineKind.VARIABLE, classifier.classify("$x = 1"));
        assertEquals(LineKind.COMMENT, classifier.classify("// silent"));
        assertEquals(LineKind.COMMENT, classifier.classify("/* loud"));
        assertEquals(LineKind.RULE, classifier.classify("/foo"));
        assertEquals(LineKind.DIRECTIVE, classifier.classify("@media screen"));
        assertEquals(LineKind.ESCAPED_RULE, classifier.classify("\\=foo"));
        assertEquals(LineKind.MIXIN_DEFINITION, classifier.classify("=button($c)"));
        assertEquals(LineKind.MIXIN_INCLUDE, classifier.classify("+button(red)"));
    }

    @Test
    @DisplayName("A lone + starts an adjacent-sibling selector")
    void loneIncludeMarkerIsARule() {
        assertEquals(LineKind.RULE, classifier.classify("+ p"));
        assertEquals(LineKind.RULE, classifier.classify("+"));
    }
}
