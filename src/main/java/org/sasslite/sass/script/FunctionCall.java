package org.sasslite.sass.script;

import java.util.List;
import java.util.Objects;

/**
 * A function call such as {@code darken(#fff, 10%)}.
 */
public record FunctionCall(String name, List<SassExpression> arguments) implements SassExpression {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
