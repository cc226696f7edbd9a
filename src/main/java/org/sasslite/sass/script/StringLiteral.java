package org.sasslite.sass.script;

import java.util.Objects;

/**
 * A string value. Bare identifiers such as {@code bold} are unquoted strings.
 *
 * @param value  The string contents with quotes and escapes removed
 * @param quoted Whether the source wrote the string in quotes
 */
public record StringLiteral(String value, boolean quoted) implements SassExpression {

    public StringLiteral {
        Objects.requireNonNull(value, "String value cannot be null");
    }

    public static StringLiteral unquoted(String value) {
        return new StringLiteral(value, false);
    }

    public static StringLiteral quoted(String value) {
        return new StringLiteral(value, true);
    }
}
