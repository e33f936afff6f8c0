package org.blockparse.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects errors, warnings and notes for one parse.
 * The engine is not shared between parses and is not thread-safe.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportError(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, line, column));
    }

    public void reportWarning(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, line, column));
    }

    /**
     * Records a note, used for the trail of skipped tokens and resynchronizations
     * during error recovery.
     */
    public void reportNote(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.NOTE, message, fileName, line, column));
    }

    public boolean hasErrors() {
        return count(Diagnostic.Type.ERROR) > 0;
    }

    public boolean hasWarnings() {
        return count(Diagnostic.Type.WARNING) > 0;
    }

    /**
     * @return An unmodifiable view of all diagnostics in the order they were reported.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @param type The severity to filter by.
     * @return The diagnostics of the given severity, in report order.
     */
    public List<Diagnostic> getDiagnostics(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }

    /**
     * Formats all errors and warnings, one per line. Notes are left out.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            if (d.type() != Diagnostic.Type.NOTE) {
                sb.append(d).append('\n');
            }
        }
        return sb.toString();
    }

    private long count(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).count();
    }
}
