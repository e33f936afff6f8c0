package org.blockparse.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads program source text from the filesystem.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path to read.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.normalize().toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(path, StandardCharsets.UTF_8));
        return new LoadResult(content, logicalName);
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
