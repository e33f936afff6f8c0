package org.blockparse.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.blockparse.cli.CommandLineInterface;
import org.blockparse.compiler.Frontend;
import org.blockparse.compiler.diagnostics.DiagnosticsEngine;
import org.blockparse.compiler.frontend.io.SourceLoader;
import org.blockparse.compiler.frontend.lexer.LexerException;
import org.blockparse.compiler.model.Token;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the token stream of a program, one token per line.
 */
@Command(
    name = "tokenize",
    description = "Print the tokens of a program"
)
public class TokenizeCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Program source file"
    )
    private File file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Frontend frontend = Frontend.fromConfig(parent.getConfig());
            SourceLoader.LoadResult source = SourceLoader.loadFile(file.toPath());
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            List<Token> tokens = frontend.tokenize(source.content(), source.logicalName(), diagnostics);

            for (Token token : tokens) {
                out.printf("%-15s '%s' @%d:%d%n", token.type(), token.text(), token.line(), token.column());
            }
            err.print(diagnostics.summary());
            out.flush();
            err.flush();
            return diagnostics.hasErrors() ? ParseCommand.EXIT_SYNTAX_ERRORS : ParseCommand.EXIT_OK;
        } catch (LexerException e) {
            err.println("FATAL " + e.getFileName() + ":" + e.getLine() + ":" + e.getColumn() + ": " + e.getMessage());
            return ParseCommand.EXIT_FATAL;
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return ParseCommand.EXIT_IO;
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return ParseCommand.EXIT_IO;
        }
    }
}
