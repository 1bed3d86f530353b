package dumb.relevance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

public class Log {

    private static final Logger logger = LoggerFactory.getLogger("dumb.relevance");

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void error(String message, Throwable cause) {
        logger.error(requireNonNull(message), cause);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void message(String message, LogLevel level) {
        requireNonNull(message);
        switch (level) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
