package org.sasslite.sass.script;

import java.util.Objects;

/**
 * A binary operation. Chains of the same precedence level are left-associative,
 * so {@code 1 - 2 - 3} is {@code (1 - 2) - 3}.
 */
public record BinaryOperation(Operator operator, SassExpression left, SassExpression right)
        implements SassExpression {

    public BinaryOperation {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }
}
