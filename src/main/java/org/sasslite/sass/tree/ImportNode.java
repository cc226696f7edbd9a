package org.sasslite.sass.tree;

import java.util.Objects;

/**
 * An {@code @import} of another style sheet. Only legal at the document root.
 */
public record ImportNode(String path, int line, String filename) implements SassNode {

    public ImportNode {
        Objects.requireNonNull(path, "Import path cannot be null");
    }
}
