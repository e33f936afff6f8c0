package org.blockparse.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.Optional;

/**
 * Builds the application {@link Config} for the command line tools.
 * <p>
 * Layers, first wins: JVM system properties, environment variables, one user file,
 * {@code reference.conf}. The user file is the first of:
 * <ol>
 *   <li>the file given with {@code --config},</li>
 *   <li>the file named by {@code -Dconfig.file},</li>
 *   <li>{@code config/blockparse.conf} below the working directory.</li>
 * </ol>
 * Without any of them only the classpath defaults apply.
 */
public final class ConfigLoader {

    static final File WORKING_DIRECTORY_FILE = new File("config", "blockparse.conf");

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives one line per decision taken while looking for the user file.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Where the user file came from.
     */
    enum Origin {
        COMMAND_LINE("--config"),
        SYSTEM_PROPERTY("-Dconfig.file"),
        WORKING_DIRECTORY("the working directory");

        private final String description;

        Origin(String description) {
            this.description = description;
        }
    }

    /**
     * @param explicitConfigFile the {@code --config} value, or null.
     * @param handler            receives the lookup trail.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if a file named by {@code --config} or {@code -Dconfig.file} is missing.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        final Optional<File> userFile = locate(explicitConfigFile, handler);
        if (userFile.isEmpty()) {
            handler.log(MessageLevel.INFO, "No " + WORKING_DIRECTORY_FILE.getPath()
                    + " in the working directory, using built-in defaults");
            return loadDefaults();
        }

        final File file = userFile.get();
        final Config config = loadFromFile(file);
        if (ConfigFactory.parseFile(file).isEmpty()) {
            handler.log(MessageLevel.WARN, "Configuration file " + file.getAbsolutePath()
                    + " is empty, only defaults apply");
        }
        return config;
    }

    private static Optional<File> locate(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return Optional.of(checked(explicitConfigFile, Origin.COMMAND_LINE, handler));
        }

        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return Optional.of(checked(new File(property).getAbsoluteFile(), Origin.SYSTEM_PROPERTY, handler));
        }

        if (WORKING_DIRECTORY_FILE.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file from " + Origin.WORKING_DIRECTORY.description
                    + ": " + WORKING_DIRECTORY_FILE.getAbsolutePath());
            return Optional.of(WORKING_DIRECTORY_FILE);
        }
        return Optional.empty();
    }

    private static File checked(final File file, final Origin origin, final ConfigMessageHandler handler) {
        if (!file.exists()) {
            final String prefix = origin == Origin.COMMAND_LINE
                    ? "Configuration file not found: "
                    : "Configuration file named by " + origin.description + " not found: ";
            throw new IllegalArgumentException(prefix + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file from " + origin.description + ": " + file.getAbsolutePath());
        return file;
    }

    static Config loadFromFile(final File configFile) {
        return compose(ConfigFactory.parseFile(configFile));
    }

    static Config loadDefaults() {
        return compose(ConfigFactory.empty());
    }

    private static Config compose(final Config userConfig) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(userConfig)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
