package org.sasslite.sass;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link WarningHandler}: logs each warning at WARN level.
 */
public final class LoggingWarningHandler implements WarningHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingWarningHandler.class);

    @Override
    public void warn(SassWarning warning) {
        log.warn("{}", warning);
    }
}
