package org.sasslite.sass.tree;

import org.sasslite.sass.script.SassExpression;

import java.util.Objects;

public record DebugNode(SassExpression expression, int line, String filename) implements SassNode {

    public DebugNode {
        Objects.requireNonNull(expression, "Expression cannot be null");
    }
}
