package org.sasslite.sass.script;

import java.util.Objects;

/**
 * A number with an optional unit, e.g. {@code 10}, {@code 1.5em}, {@code 50%}.
 *
 * @param value The numeric value
 * @param unit  The unit suffix, empty when the number is unitless
 */
public record NumberLiteral(double value, String unit) implements SassExpression {

    public NumberLiteral {
        Objects.requireNonNull(unit, "Unit cannot be null (use empty string)");
    }

    public static NumberLiteral of(double value) {
        return new NumberLiteral(value, "");
    }

    public boolean isUnitless() {
        return unit.isEmpty();
    }
}
