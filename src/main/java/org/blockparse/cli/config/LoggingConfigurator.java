package org.blockparse.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   format = COLOR
 *   default-level = WARN
 *   levels {
 *     "org.blockparse.compiler.frontend.parser" = DEBUG
 *   }
 * }
 * </pre>
 * {@code format} selects the appender of {@code logback.xml} through the
 * {@value #APPENDER_PROPERTY} system property, which requires reloading that file.
 */
public final class LoggingConfigurator {

    static final String APPENDER_PROPERTY = "blockparse.logging.format";

    private LoggingConfigurator() {
    }

    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.format")) {
            final String appender = appenderFor(config.getString("logging.format"));
            if (!appender.equals(System.getProperty(APPENDER_PROPERTY))) {
                System.setProperty(APPENDER_PROPERTY, appender);
                reload(context);
            }
        }

        if (config.hasPath("logging.default-level")) {
            final Level level = Level.toLevel(config.getString("logging.default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (config.hasPath("logging.levels")) {
            final Config levels = config.getConfig("logging.levels");
            for (Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(levelName, Level.INFO));
            }
        }
    }

    static String appenderFor(final String format) {
        return switch (format.trim().toUpperCase(Locale.ROOT)) {
            case "COLOR" -> "STDOUT";
            case "PLAIN" -> "STDOUT_PLAIN";
            default -> throw new IllegalArgumentException(
                    "Invalid value '" + format + "' for logging.format, expected PLAIN or COLOR");
        };
    }

    private static void reload(final LoggerContext context) {
        final URL logbackXml = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (logbackXml == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(logbackXml);
        } catch (JoranException e) {
            System.err.println("Could not reload " + logbackXml + ": " + e.getMessage());
        }
    }
}
