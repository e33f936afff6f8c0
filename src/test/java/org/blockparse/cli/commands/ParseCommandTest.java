package org.blockparse.cli.commands;

import org.blockparse.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the parse command: tree output, diagnostics and exit codes.
 */
@Tag("unit")
public class ParseCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    private Path program(String source) throws Exception {
        Path file = tempDir.resolve("program.blk");
        Files.writeString(file, source);
        return file;
    }

    @Test
    void testCommandIsRegistered() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("parse", "tokenize", "help");
    }

    @Test
    void testHelpOutput() {
        run("help", "parse");

        String output = out.toString() + err.toString();
        assertThat(output).contains("parse");
        assertThat(output).contains("--file");
        assertThat(output).contains("--verbose");
    }

    @Test
    void testCleanProgramPrintsTree() throws Exception {
        Path file = program("BEGIN\n  PRINT \"HI\"\nEND\n");

        int exitCode = run("parse", "-f", file.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(ParseCommand.EXIT_OK);
        assertThat(out.toString()).isEqualTo("""
            Program [#0]
              Statements [#1]
                PrintStatement [#2]
                  StringLiteral [#3]
                    Value [#4] "HI"
            """);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testRecoveredProgramExitsWithErrors() throws Exception {
        Path file = program("BEGIN PRINT 5 PRINT \"ok\" END");

        int exitCode = run("parse", "-f", file.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_SYNTAX_ERRORS);
        assertThat(out.toString()).contains("PrintStatement").contains("\"ok\"");
        assertThat(err.toString()).contains("ERROR").contains("expected STRING_LITERAL");
        assertThat(err.toString()).doesNotContain("Skipping");
    }

    @Test
    void testVerbosePrintsRecoveryNotes() throws Exception {
        Path file = program("BEGIN PRINT 5 PRINT \"ok\" END");

        run("parse", "--verbose", "-f", file.toString());

        assertThat(err.toString()).contains("NOTE").contains("Skipping token INT_LITERAL '5'");
    }

    @Test
    void testVerboseCountsRecoveryPlaceholders() throws Exception {
        Path file = program("BEGIN A := 1 + END");

        int exitCode = run("parse", "--verbose", "-f", file.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_SYNTAX_ERRORS);
        assertThat(err.toString()).contains("Recovery placeholders: 1");
    }

    @Test
    void testNoTreeSuppressesOutput() throws Exception {
        Path file = program("BEGIN PRINT \"HI\" END");

        int exitCode = run("parse", "--no-tree", "-f", file.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_OK);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testFatalErrorExitCode() throws Exception {
        Path file = program("BEGIN A := PRINT END");

        int exitCode = run("parse", "-f", file.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_FATAL);
        assertThat(err.toString()).contains("FATAL MALFORMED_TERM").contains(":1:12:");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testMissingFile() {
        int exitCode = run("parse", "-f", tempDir.resolve("missing.blk").toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_IO);
        assertThat(err.toString()).contains("cannot read");
    }

    @Test
    void testMissingFileOption() {
        int exitCode = run("parse");

        assertThat(exitCode).isNotEqualTo(ParseCommand.EXIT_OK);
        assertThat(err.toString()).contains("--file");
    }

    @Test
    void testConfigFileSelectsFailPolicy() throws Exception {
        Path config = tempDir.resolve("strict.conf");
        Files.writeString(config, "blockparse.lexer.unrecognized-character = FAIL\n");
        Path file = program("BEGIN # END");

        int exitCode = run("--config", config.toString(), "parse", "-f", file.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_FATAL);
        assertThat(err.toString()).contains("UNRECOGNIZED_CHARACTER");
    }

    @Test
    void testInvalidConfigValue() throws Exception {
        Path config = tempDir.resolve("broken.conf");
        Files.writeString(config, "blockparse.lexer.position-tracking = SOMETIMES\n");
        Path file = program("BEGIN END");

        int exitCode = run("-c", config.toString(), "parse", "-f", file.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_IO);
        assertThat(err.toString()).contains("SOMETIMES");
    }

    @Test
    void testMissingConfigFile() throws Exception {
        Path file = program("BEGIN END");

        int exitCode = run("-c", tempDir.resolve("nope.conf").toString(), "parse", "-f", file.toString());

        assertThat(exitCode).isEqualTo(ParseCommand.EXIT_IO);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
