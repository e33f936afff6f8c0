package org.blockparse.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LOGGER = "org.blockparse.compiler.frontend.parser";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void remember() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void restore() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(LOGGER).setLevel(null);
    }

    @Test
    void appliesDefaultAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging {
                  default-level = ERROR
                  levels { "org.blockparse.compiler.frontend.parser" = DEBUG }
                }
                """));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void missingBlockChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
    }

    @Test
    void formatNamesTheAppender() {
        assertThat(LoggingConfigurator.appenderFor("color")).isEqualTo("STDOUT");
        assertThat(LoggingConfigurator.appenderFor("PLAIN")).isEqualTo("STDOUT_PLAIN");
        assertThatThrownBy(() -> LoggingConfigurator.appenderFor("JSON"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("logging.format");
    }
}
