package org.sasslite.sass.script;

import java.util.Objects;

/**
 * A hex color such as {@code #fff} or {@code #0a0b0c}, kept as written.
 */
public record ColorLiteral(String hex) implements SassExpression {

    public ColorLiteral {
        Objects.requireNonNull(hex, "Hex text cannot be null");
    }
}
