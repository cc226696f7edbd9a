package org.sasslite.sass.script;

/**
 * Sealed interface representing expressions of the embedded script language.
 *
 * Type hierarchy:
 * SassExpression
 * ├── literals (NumberLiteral, ColorLiteral, StringLiteral, BooleanLiteral)
 * ├── VariableReference ($name)
 * ├── FunctionCall (name(args...))
 * ├── UnaryOperation / BinaryOperation
 * └── ListExpression (space or comma separated values)
 *
 * The front end only builds these trees; evaluating them belongs to a later stage.
 */
public sealed interface SassExpression
        permits NumberLiteral, ColorLiteral, StringLiteral, BooleanLiteral,
        VariableReference, FunctionCall, UnaryOperation, BinaryOperation, ListExpression {
}
