package org.sasslite.sass.script;

import java.util.Objects;

public record UnaryOperation(Operator operator, SassExpression operand) implements SassExpression {

    public UnaryOperation {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }
}
