package org.sasslite.sass;

import org.junit.jupiter.api.Test;
import org.sasslite.sass.SassOptions.PropertySyntax;
import org.sasslite.sass.SassOptions.Style;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SassOptionsTest {

    @Test
    void defaults() {
        SassOptions options = SassOptions.defaults();
        assertEquals(Style.NESTED, options.style());
        assertNull(options.filename());
        assertEquals(1, options.line());
        assertNull(options.propertySyntax());
        assertFalse(options.lineComments());
    }

    @Test
    void fromMapReadsAllKeys() {
        SassOptions options = SassOptions.fromMap(Map.of(
                "style", "compressed",
                "filename", "main.sass",
                "line", "5",
                "property_syntax", "new",
                "line_comments", "true"));

        assertEquals(Style.COMPRESSED, options.style());
        assertEquals("main.sass", options.filename());
        assertEquals(5, options.line());
        assertEquals(PropertySyntax.NEW, options.propertySyntax());
        assertTrue(options.lineComments());
    }

    @Test
    void legacyAliases() {
        assertEquals(PropertySyntax.NEW,
                SassOptions.fromMap(Map.of("attribute_syntax", "alternate")).propertySyntax());
        assertEquals(PropertySyntax.OLD,
                SassOptions.fromMap(Map.of("attribute_syntax", "normal")).propertySyntax());
        assertTrue(SassOptions.fromMap(Map.of("line_numbers", "true")).lineComments());
    }

    @Test
    void currentKeysWinOverAliases() {
        SassOptions options = SassOptions.fromMap(Map.of(
                "property_syntax", "old",
                "attribute_syntax", "alternate"));
        assertEquals(PropertySyntax.OLD, options.propertySyntax());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SassOptions.fromMap(Map.of("style", "fancy")));
        assertThrows(IllegalArgumentException.class, () -> SassOptions.fromMap(Map.of("line", "one")));
        assertThrows(IllegalArgumentException.class, () -> SassOptions.fromMap(Map.of("line", "0")));
        assertThrows(IllegalArgumentException.class,
                () -> SassOptions.fromMap(Map.of("property_syntax", "newest")));
    }
}
