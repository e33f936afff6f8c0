package org.blockparse.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.blockparse.cli.commands.ParseCommand;
import org.blockparse.cli.commands.TokenizeCommand;
import org.blockparse.cli.config.ConfigLoader;
import org.blockparse.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "blockparse",
    mixinStandardHelpOptions = true,
    version = "blockparse 1.0",
    description = "Tokenizer and error-recovering parser for BEGIN/END block programs",
    subcommands = {
        ParseCommand.class,
        TokenizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: config/blockparse.conf if present)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * The command line used by {@link #main(String[])}. Tests run commands through it and
     * redirect its writers.
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new CommandLineInterface());
    }

    /**
     * Resolves the configuration once per invocation and applies its logging block.
     *
     * @throws IllegalArgumentException if a named file is missing or a logging value is invalid.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            final Config resolved = ConfigLoader.resolve(configFile, (level, message) -> {
                if (level == ConfigLoader.MessageLevel.WARN) {
                    log.warn(message);
                } else {
                    log.debug(message);
                }
            });
            LoggingConfigurator.configure(resolved);
            config = resolved;
        }
        return config;
    }
}
