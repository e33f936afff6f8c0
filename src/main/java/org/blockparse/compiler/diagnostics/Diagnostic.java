package org.blockparse.compiler.diagnostics;

/**
 * A single message produced while scanning or parsing.
 *
 * @param type     The severity.
 * @param message  The human-readable description.
 * @param fileName The source the message refers to.
 * @param line     The line number, or 0 if unknown.
 * @param column   The column number, or 0 if unknown.
 */
public record Diagnostic(Type type, String message, String fileName, int line, int column) {

    public enum Type {
        ERROR,
        WARNING,
        NOTE
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type).append(' ');
        if (fileName != null) {
            sb.append(fileName);
        }
        if (line > 0) {
            sb.append(':').append(line);
            if (column > 0) {
                sb.append(':').append(column);
            }
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
