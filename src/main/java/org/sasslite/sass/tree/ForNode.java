package org.sasslite.sass.tree;

import org.sasslite.sass.script.SassExpression;

import java.util.List;
import java.util.Objects;

/**
 * {@code @for $var from <expr> to|through <expr>}.
 *
 * @param variable  Loop variable name without the {@code $} introducer
 * @param inclusive true for {@code through}, false for {@code to}
 */
public record ForNode(
        String variable,
        SassExpression from,
        SassExpression to,
        boolean inclusive,
        List<SassNode> children,
        int line,
        String filename) implements SassNode {

    public ForNode {
        Objects.requireNonNull(variable, "Loop variable cannot be null");
        Objects.requireNonNull(from, "From expression cannot be null");
        Objects.requireNonNull(to, "To expression cannot be null");
        children = List.copyOf(children);
    }
}
