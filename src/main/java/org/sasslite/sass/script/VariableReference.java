package org.sasslite.sass.script;

import java.util.Objects;

/**
 * Reference to a script variable, e.g. {@code $width}.
 *
 * @param name The variable name without the {@code $} introducer
 */
public record VariableReference(String name) implements SassExpression {

    public VariableReference {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }
}
