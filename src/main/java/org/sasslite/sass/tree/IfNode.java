package org.sasslite.sass.tree;

import org.sasslite.sass.script.SassExpression;

import java.util.List;

/**
 * {@code @if <expr>} with its chain of {@code @else if} / {@code @else} branches.
 *
 * @param condition  The condition, or null for an unconditional {@code @else} branch
 * @param elseBranch The next branch of the chain, or null
 */
public record IfNode(
        SassExpression condition,
        List<SassNode> children,
        IfNode elseBranch,
        int line,
        String filename) implements SassNode {

    public IfNode {
        children = List.copyOf(children);
    }

    /**
     * Appends a branch to the end of this node's else chain.
     */
    public IfNode withElse(IfNode branch) {
        IfNode chained = elseBranch == null ? branch : elseBranch.withElse(branch);
        return new IfNode(condition, children, chained, line, filename);
    }

    public boolean isUnconditional() {
        return condition == null;
    }
}
