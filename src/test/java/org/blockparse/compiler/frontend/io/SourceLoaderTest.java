package org.blockparse.compiler.frontend.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SourceLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadFileNormalizesLineEndings() throws Exception {
        Path file = tempDir.resolve("crlf.blk");
        Files.writeString(file, "BEGIN\r\nPRINT \"x\"\rEND\r\n");

        SourceLoader.LoadResult result = SourceLoader.loadFile(file);

        assertThat(result.content()).isEqualTo("BEGIN\nPRINT \"x\"\nEND\n");
        assertThat(result.logicalName()).endsWith("crlf.blk");
    }

    @Test
    void loadFileFailsForMissingFile() {
        assertThatThrownBy(() -> SourceLoader.loadFile(tempDir.resolve("missing.blk")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void loadFileReadsSampleProgram() throws Exception {
        Path sample = Path.of(getClass().getClassLoader().getResource("programs/sample.blk").toURI());

        SourceLoader.LoadResult result = SourceLoader.loadFile(sample);

        assertThat(result.logicalName()).endsWith("programs/sample.blk");
        assertThat(result.content()).startsWith("BEGIN\n").endsWith("END\n");
    }

    @Test
    void loadFileNormalizesLogicalName() throws Exception {
        Files.createDirectories(tempDir.resolve("dir"));
        Files.writeString(tempDir.resolve("dir/a.blk"), "BEGIN END");

        SourceLoader.LoadResult result = SourceLoader.loadFile(tempDir.resolve("dir/../dir/./a.blk"));

        assertThat(result.logicalName()).endsWith("/dir/a.blk").doesNotContain("..");
    }
}
