package io.stylusport.anchor.cli;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Routes the application's java.util.logging output to the console at the requested level. */
final class LoggingSetup {
    static final String APPLICATION_LOGGER = "io.stylusport.anchor";

    // Held strongly so the configured level is not lost when the logger is collected.
    private static final Logger APPLICATION = Logger.getLogger(APPLICATION_LOGGER);

    private LoggingSetup() {}

    static void configure(Level level) {
        APPLICATION.setLevel(level);
        APPLICATION.setUseParentHandlers(false);
        boolean hasConsole = false;
        for (Handler handler : APPLICATION.getHandlers()) {
            if (handler instanceof ConsoleHandler console) {
                console.setLevel(level);
                hasConsole = true;
            }
        }
        if (!hasConsole) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(level);
            APPLICATION.addHandler(handler);
        }
    }
}
