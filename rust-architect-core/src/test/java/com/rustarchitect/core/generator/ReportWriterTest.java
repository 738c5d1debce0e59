package com.rustarchitect.core.generator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_createsDirectoryAndFiles() throws IOException {
        // Given
        Path output = tempDir.resolve("docs/architecture");
        ReportWriter writer = new ReportWriter(output);

        // When
        List<Path> written = writer.write(List.of(
            new GeneratedReport("patterns", "# Patterns\n", "md"),
            new GeneratedReport("patterns", "{}\n", "json")
        ));

        // Then
        assertThat(written).containsExactly(output.resolve("patterns.md"), output.resolve("patterns.json"));
        assertThat(Files.readString(output.resolve("patterns.md"))).isEqualTo("# Patterns\n");
        assertThat(Files.readString(output.resolve("patterns.json"))).isEqualTo("{}\n");
    }

    @Test
    void write_overwritesExistingReport() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("metrics.md"), "stale");

        // When
        new ReportWriter(tempDir).write(List.of(new GeneratedReport("metrics", "fresh", "md")));

        // Then
        assertThat(Files.readString(tempDir.resolve("metrics.md"))).isEqualTo("fresh");
    }

    @Test
    void write_whenOutputIsAFile_throwsException() throws IOException {
        // Given
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "");

        // When / Then
        assertThatThrownBy(() -> new ReportWriter(blocker).write(List.of(new GeneratedReport("x", "", "md"))))
            .isInstanceOf(IllegalStateException.class);
    }
}
