package org.smpels.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class FilePatternsTest {

    @TempDir
    Path dir;

    @Test
    @Tag("unit")
    void expandsGlobInSortedOrder() throws IOException {
        // Arrange
        Files.writeString(dir.resolve("b.mcs"), "");
        Files.writeString(dir.resolve("a.mcs"), "");
        Files.writeString(dir.resolve("notes.txt"), "");
        Files.createDirectory(dir.resolve("sub.mcs"));

        // Act
        List<String> files = FilePatterns.expand(List.of(dir.resolve("*.mcs").toString()));

        // Assert
        assertThat(files).containsExactly(dir.resolve("a.mcs").toString(), dir.resolve("b.mcs").toString());
    }

    @Test
    @Tag("unit")
    void keepsPlainNamesAndUnmatchedPatterns() throws IOException {
        String plain = dir.resolve("missing.mcs").toString();
        String unmatched = dir.resolve("*.none").toString();

        assertThat(FilePatterns.expand(List.of(plain, unmatched, plain))).containsExactly(plain, unmatched);
    }
}
