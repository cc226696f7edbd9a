package org.sasslite.sass.script;

import java.util.Objects;

/**
 * A parameter in a mixin definition's argument list.
 *
 * @param name         The parameter name without the {@code $} introducer
 * @param defaultValue The default value expression, or null when the parameter is required
 */
public record MixinParameter(String name, SassExpression defaultValue) {

    public MixinParameter {
        Objects.requireNonNull(name, "Parameter name cannot be null");
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
