package org.sasslite.sass.tree;

import java.util.List;
import java.util.Objects;

/**
 * A directive the parser does not interpret ({@code @media}, {@code @font-face},
 * a CSS {@code @import url(...)}, ...). {@code text} is the full line, left for
 * the renderer.
 */
public record DirectiveNode(String text, List<SassNode> children, int line, String filename)
        implements SassNode {

    public DirectiveNode {
        Objects.requireNonNull(text, "Directive text cannot be null");
        children = List.copyOf(children);
    }
}
