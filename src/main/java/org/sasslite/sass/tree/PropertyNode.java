package org.sasslite.sass.tree;

import java.util.List;
import java.util.Objects;

/**
 * A CSS property. Children are nested properties, so
 *
 * <pre>
 * font:
 *   family: serif
 * </pre>
 *
 * yields a {@code font} property with an empty value and one child.
 */
public record PropertyNode(
        String name,
        PropertyValue value,
        Syntax syntax,
        List<SassNode> children,
        int line,
        String filename) implements SassNode {

    /**
     * Which of the two property forms the source used.
     */
    public enum Syntax {
        /** {@code :name value} */
        OLD,
        /** {@code name: value} */
        NEW
    }

    public PropertyNode {
        Objects.requireNonNull(name, "Property name cannot be null");
        Objects.requireNonNull(value, "Property value cannot be null");
        Objects.requireNonNull(syntax, "Syntax cannot be null");
        children = List.copyOf(children);
    }
}
