package org.sasslite.sass.tree;

import org.sasslite.sass.script.SassExpression;

import java.util.Objects;

/**
 * A variable assignment.
 *
 * @param name       Variable name without the {@code $} introducer
 * @param expression The assigned value
 * @param guarded    true for {@code ||=} or {@code !default}: assign only if unset
 */
public record VariableNode(String name, SassExpression expression, boolean guarded, int line, String filename)
        implements SassNode {

    public VariableNode {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
    }
}
