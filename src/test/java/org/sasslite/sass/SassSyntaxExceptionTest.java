package org.sasslite.sass;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SassSyntaxExceptionTest {

    @Test
    void messageCarriesLocation() {
        assertEquals("bad", new SassSyntaxException("bad").getMessage());
        assertEquals("line 3: bad", new SassSyntaxException("bad", 3).getMessage());
        assertEquals("line 3:7: bad", new SassSyntaxException("bad", 3, 7).getMessage());
    }

    @Test
    void contextKeepsKnownLine() {
        SassSyntaxException e = new SassSyntaxException("bad", 3, 7).withContext("f.sass", 1, "a");

        assertEquals(3, e.getLine());
        assertEquals(7, e.getColumn());
        assertEquals("f.sass", e.getFilename());
        assertEquals("a", e.getTemplate());
        assertEquals("line 3:7 of f.sass: bad", e.getMessage());
        assertEquals("bad", e.getRawMessage());
    }

    @Test
    void contextFillsMissingLine() {
        SassSyntaxException e = new SassSyntaxException("bad").withContext(null, 4, "a");
        assertEquals(4, e.getLine());
        assertEquals("line 4: bad", e.getMessage());
    }

    @Test
    void sourceContextMarksTheErrorLine() {
        SassSyntaxException e = new SassSyntaxException("bad", 3).withContext(null, -1, "a\nb\nc\nd\ne");

        assertEquals("  2: b\n> 3: c\n  4: d\n", e.sourceContext(1));
        assertEquals("", new SassSyntaxException("bad", 3).sourceContext(1));
    }

    @Test
    void sourceContextNumbersFromTheStartingLine() {
        SassSyntaxException e = new SassSyntaxException("bad", 9).withContext(null, -1, "a\nb\nc\nd", 8);

        assertEquals("> 9: b\n", e.sourceContext(0));
        assertEquals("   8: a\n>  9: b\n  10: c\n  11: d\n", e.sourceContext(5));
    }

    @Test
    void sourceContextIsEmptyForALineBeforeTheTemplate() {
        SassSyntaxException e = new SassSyntaxException("bad", 2).withContext(null, -1, "a\nb", 5);
        assertEquals("", e.sourceContext(1));
    }
}
