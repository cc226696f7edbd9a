package org.sasslite.sass.tree;

import org.sasslite.sass.SassOptions;

import java.util.List;
import java.util.Objects;

/**
 * The document node. Holds the original template and the options the document
 * was parsed with, for the rendering stage.
 */
public record RootNode(String template, List<SassNode> children, SassOptions options) implements SassNode {

    public RootNode {
        Objects.requireNonNull(template, "Template cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        children = List.copyOf(children);
    }

    @Override
    public int line() {
        return options.line();
    }

    @Override
    public String filename() {
        return options.filename();
    }
}
