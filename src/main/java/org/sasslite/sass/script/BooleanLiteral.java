package org.sasslite.sass.script;

public record BooleanLiteral(boolean value) implements SassExpression {
}
