package de.upb.sse.jsweep.cleanup;

import java.util.logging.Logger;

/** Sends progress to java.util.logging; status text goes to FINE. */
public class LoggingProgressSink implements ProgressSink {
    private static final Logger logger = Logger.getLogger(LoggingProgressSink.class.getName());

    @Override
    public void text(String message) {
        logger.fine(message);
    }

    @Override
    public void log(String message) {
        logger.info(message);
    }
}
