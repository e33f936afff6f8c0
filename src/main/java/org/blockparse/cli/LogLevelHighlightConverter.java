package org.blockparse.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the wrapped pattern by log level:
 * ERROR red, WARN yellow, INFO blue, DEBUG gray, TRACE uncolored.
 * Registered in {@code logback.xml} as {@code %levelColor(...)}.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_GRAY = "\u001B[90m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorFor(event.getLevel());
        return color == null ? in : color + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            case Level.DEBUG_INT -> ANSI_GRAY;
            default -> null;
        };
    }
}
