package org.sasslite.sass.script;

import java.util.List;
import java.util.Objects;

/**
 * A list of values: {@code 1px solid black} (space separated) or
 * {@code "Helvetica", sans-serif} (comma separated).
 */
public record ListExpression(List<SassExpression> items, Separator separator) implements SassExpression {

    public enum Separator {
        SPACE,
        COMMA
    }

    public ListExpression {
        Objects.requireNonNull(separator, "Separator cannot be null");
        items = List.copyOf(items);
    }
}
