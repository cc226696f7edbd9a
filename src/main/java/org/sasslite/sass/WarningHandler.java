package org.sasslite.sass;

/**
 * Receives warnings emitted while parsing.
 */
@FunctionalInterface
public interface WarningHandler {

    void warn(SassWarning warning);
}
