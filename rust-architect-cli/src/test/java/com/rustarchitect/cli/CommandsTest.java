package com.rustarchitect.cli;

import com.rustarchitect.RustArchitectCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the CLI commands end to end against small Rust projects.
 */
class CommandsTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = RustArchitectCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void analyze_withDryRun_printsSummaryWithoutWriting() throws IOException {
        // Given
        Path project = createProject("demo");

        // When
        int exitCode = execute("analyze", project.toString(), "--dry-run");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Architecture Model Summary:")
            .contains("Dry-run mode: Skipping report generation");
        assertThat(project.resolve("docs")).doesNotExist();
    }

    @Test
    void analyze_withOutputDirectory_writesReports() throws IOException {
        // Given
        Path project = createProject("demo");
        Path output = tempDir.resolve("reports");

        // When
        int exitCode = execute("analyze", project.toString(), "-o", output.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(output.resolve("knowledge-graph.json")).exists();
        assertThat(output.resolve("knowledge-graph.md")).exists();
        assertThat(output.resolve("layers.md")).exists();
        assertThat(out.toString()).contains("✓ Analysis complete");
    }

    @Test
    void analyze_withMissingDirectory_returnsError() {
        // When
        int exitCode = execute("analyze", tempDir.resolve("missing").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Project directory not found");
    }

    @Test
    void analyze_withMissingCatalogOverride_returnsError() throws IOException {
        // Given
        Path project = createProject("demo");
        Files.writeString(project.resolve("rustarchitect.yaml"), """
            detection:
              catalogs:
                designPatterns: missing-patterns.yaml
            """);

        // When
        int exitCode = execute("analyze", project.toString(), "--dry-run");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Analysis failed").contains("missing-patterns.yaml");
    }

    @Test
    void list_withGenerators_printsDiscoveredGenerators() {
        // When
        int exitCode = execute("list", "generators");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Available Generators:")
            .contains("(ID: json)")
            .contains("(ID: markdown)")
            .contains("(ID: mermaid)");
    }

    @Test
    void list_withCatalogs_printsBundledSignatures() {
        // When
        int exitCode = execute("list", "catalogs");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Bundled Signature Catalogs:")
            .contains("Builder (max score 7)");
    }

    @Test
    void list_withUnknownType_returnsError() {
        // When
        int exitCode = execute("list", "widgets");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Unknown type: widgets");
    }

    @Test
    void patterns_withAsyncCrate_printsDetections() throws IOException {
        // Given
        Path project = createProject("demo");

        // When
        int exitCode = execute("patterns", project.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Design Patterns:")
            .contains("Architecture Styles:")
            .contains("Communication Patterns:")
            .contains("Async/Await Runtime");
    }

    @Test
    void compare_withTwoProjects_printsMatrix() throws IOException {
        // Given
        Path first = createProject("first");
        Path second = createProject("second");

        // When
        int exitCode = execute("compare", first.toString(), second.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("# Pattern Cross-Reference Matrix")
            .contains("first")
            .contains("second");
    }

    @Test
    void compare_withOutputFile_writesMatrix() throws IOException {
        // Given
        Path first = createProject("first");
        Path second = createProject("second");
        Path target = tempDir.resolve("out/matrix.md");

        // When
        int exitCode = execute("compare", first.toString(), second.toString(), "-o", target.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(target).exists();
        assertThat(Files.readString(target)).startsWith("# Pattern Cross-Reference Matrix");
        assertThat(out.toString()).contains("✓ Compared 2 projects");
    }

    @Test
    void compare_withMissingProject_returnsError() throws IOException {
        // Given
        Path first = createProject("first");

        // When
        int exitCode = execute("compare", first.toString(), tempDir.resolve("missing").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("✗ Project directory not found");
    }

    @Test
    void version_printsProductVersion() {
        // When
        int exitCode = execute("--version");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("RustArchitect 1.0.0-SNAPSHOT");
    }

    private int execute(String... args) {
        int exitCode = commandLine.execute(args);
        commandLine.getOut().flush();
        commandLine.getErr().flush();
        return exitCode;
    }

    private Path createProject(String name) throws IOException {
        Path project = Files.createDirectories(tempDir.resolve(name));
        Files.writeString(project.resolve("Cargo.toml"), """
            [package]
            name = "%s"
            version = "0.1.0"

            [dependencies]
            tokio = { version = "1", features = ["full"] }
            """.formatted(name));
        Path src = Files.createDirectories(project.resolve("src"));
        Files.writeString(src.resolve("main.rs"), """
            use crate::server::Server;

            #[tokio::main]
            async fn main() {
                let server = Server::new();
                server.run().await;
            }
            """);
        Files.writeString(src.resolve("server.rs"), """
            /// Accepts connections.
            pub struct Server {
                port: u16,
            }

            impl Server {
                pub fn new() -> Self {
                    Server { port: 8080 }
                }

                pub async fn run(&self) {
                    tokio::spawn(async move {});
                }
            }
            """);
        return project;
    }
}
