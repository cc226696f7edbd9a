package org.sasslite.sass.tree;

import org.sasslite.sass.script.SassExpression;

import java.util.Objects;

/**
 * The value of a property: either literal text passed through untouched, or a
 * script expression ({@code :name= expr} / {@code name= expr}).
 */
public sealed interface PropertyValue permits PropertyValue.Literal, PropertyValue.Script {

    record Literal(String text) implements PropertyValue {
        public Literal {
            Objects.requireNonNull(text, "Literal text cannot be null");
        }
    }

    record Script(SassExpression expression) implements PropertyValue {
        public Script {
            Objects.requireNonNull(expression, "Expression cannot be null");
        }
    }

    /**
     * @return true for a literal with no text, as used by namespace properties
     *         like {@code font:} whose children are the real properties
     */
    default boolean isEmpty() {
        return this instanceof Literal literal && literal.text().isEmpty();
    }
}
