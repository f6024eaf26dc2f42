package redlet.utils;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Redlet");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";

                return String.format("[%s] %s%n", levelStr, record.getMessage());
            }
        });
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    /**
     * Accepts the names used in config files: debug, info, warn(ing), error.
     * Anything else leaves the current level untouched.
     */
    public static void setLevel(String level) {
        if (level == null) return;
        switch (level.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG": logger.setLevel(Level.FINE); break;
            case "INFO": logger.setLevel(Level.INFO); break;
            case "WARN":
            case "WARNING": logger.setLevel(Level.WARNING); break;
            case "ERROR": logger.setLevel(Level.SEVERE); break;
            default: warn("Unknown log level '" + level + "', keeping " + logger.getLevel());
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void warn(String msg, Throwable cause) {
        logger.log(Level.WARNING, msg, cause);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
