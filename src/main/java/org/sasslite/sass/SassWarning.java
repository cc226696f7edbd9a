package org.sasslite.sass;

import java.util.Objects;

/**
 * A non-fatal problem found while parsing.
 *
 * @param message  What is wrong
 * @param line     The line the problem was found on
 * @param filename The source file name, may be null
 */
public record SassWarning(String message, int line, String filename) {

    public SassWarning {
        Objects.requireNonNull(message, "Warning message cannot be null");
    }

    @Override
    public String toString() {
        return "WARNING on line " + line + (filename != null ? " of " + filename : "") + ":\n" + message;
    }
}
