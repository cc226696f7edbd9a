package org.sasslite.sass.tree;

import java.util.Objects;

/**
 * A comment. Silent ({@code //}) comments are dropped from the output; loud
 * ({@code /*}) comments are kept. {@code text} includes the introducer and any
 * continuation lines joined with newlines.
 */
public record CommentNode(String text, boolean silent, int line, String filename) implements SassNode {

    public CommentNode {
        Objects.requireNonNull(text, "Comment text cannot be null");
    }
}
