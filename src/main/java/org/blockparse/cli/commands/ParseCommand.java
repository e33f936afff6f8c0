package org.blockparse.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.blockparse.cli.CommandLineInterface;
import org.blockparse.compiler.Frontend;
import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.api.ParseResult;
import org.blockparse.compiler.diagnostics.Diagnostic;
import org.blockparse.compiler.diagnostics.DiagnosticsEngine;
import org.blockparse.compiler.frontend.io.SourceLoader;
import org.blockparse.compiler.frontend.parser.ast.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that parses a program file and prints its syntax tree and diagnostics.
 * <p>
 * Exit codes: 0 clean parse, 1 errors were reported (tree recovered), 2 fatal parse error,
 * 3 the file or configuration could not be read.
 */
@Command(
    name = "parse",
    description = "Parse a program and print its syntax tree"
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERRORS = 1;
    static final int EXIT_FATAL = 2;
    static final int EXIT_IO = 3;

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Program source file"
    )
    private File file;

    @Option(
        names = {"--tree"},
        negatable = true,
        defaultValue = "true",
        description = "Print the syntax tree (default: ${DEFAULT-VALUE})"
    )
    private boolean printTree;

    @Option(
        names = {"-v", "--verbose"},
        description = "Also print recovery notes (skipped tokens and resynchronizations)"
    )
    private boolean verbose;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Frontend frontend;
        SourceLoader.LoadResult source;
        try {
            frontend = Frontend.fromConfig(parent.getConfig());
            source = SourceLoader.loadFile(file.toPath());
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return EXIT_IO;
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_IO;
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ParseResult result;
        try {
            result = frontend.parse(source.content(), source.logicalName(), diagnostics);
        } catch (ParseException e) {
            printDiagnostics(diagnostics, err);
            err.println("FATAL " + e.getKind() + " " + e.format());
            return EXIT_FATAL;
        }

        if (printTree) {
            out.print(AstPrinter.print(result.root()));
        }
        printDiagnostics(diagnostics, err);
        if (verbose && result.recovered()) {
            err.println("Recovery placeholders: " + result.recoveryPlaceholders().size());
        }
        out.flush();
        err.flush();

        log.debug("{}: {} nodes, recovered={}", source.logicalName(), result.nodeCount(), result.recovered());
        return diagnostics.hasErrors() ? EXIT_SYNTAX_ERRORS : EXIT_OK;
    }

    private void printDiagnostics(DiagnosticsEngine diagnostics, PrintWriter err) {
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            if (verbose || diagnostic.type() != Diagnostic.Type.NOTE) {
                err.println(diagnostic);
            }
        }
    }
}
