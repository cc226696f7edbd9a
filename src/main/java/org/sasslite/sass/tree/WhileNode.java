package org.sasslite.sass.tree;

import org.sasslite.sass.script.SassExpression;

import java.util.List;
import java.util.Objects;

public record WhileNode(SassExpression condition, List<SassNode> children, int line, String filename)
        implements SassNode {

    public WhileNode {
        Objects.requireNonNull(condition, "Condition cannot be null");
        children = List.copyOf(children);
    }
}
