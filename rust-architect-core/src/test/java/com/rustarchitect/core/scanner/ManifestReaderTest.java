package com.rustarchitect.core.scanner;

import com.rustarchitect.core.AnalyzerTestBase;
import com.rustarchitect.core.model.Manifest;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ManifestReader}.
 */
class ManifestReaderTest extends AnalyzerTestBase {

    private final ManifestReader reader = new ManifestReader();

    @Test
    void read_withoutManifest_returnsEmptyManifest() {
        // When
        Manifest manifest = reader.read(tempDir);

        // Then
        assertThat(manifest.rawText()).isEmpty();
        assertThat(manifest.packageCount()).isZero();
        assertThat(manifest.isWorkspace()).isFalse();
    }

    @Test
    void read_withSinglePackage_readsNameVersionAndDependencies() throws IOException {
        // Given
        createFile("Cargo.toml", """
            [package]
            name = "service"
            version = "0.3.1"
            edition = "2021"

            [dependencies]
            serde = { version = "1", features = ["derive"] }
            tokio = "1"
            """);

        // When
        Manifest manifest = reader.read(tempDir);

        // Then
        assertThat(manifest.packageName()).isEqualTo("service");
        assertThat(manifest.packageVersion()).isEqualTo("0.3.1");
        assertThat(manifest.dependencies()).containsExactly("serde", "tokio");
        assertThat(manifest.packageCount()).isEqualTo(1);
        assertThat(manifest.isWorkspace()).isFalse();
        assertThat(manifest.rawText()).contains("tokio = \"1\"");
    }

    @Test
    void read_withGlobMembers_expandsDirectoriesWithManifests() throws IOException {
        // Given
        createFile("Cargo.toml", """
            [workspace]
            members = ["crates/*"]
            exclude = ["crates/experimental"]

            [workspace.dependencies]
            anyhow = "1"
            """);
        createFile("crates/core/Cargo.toml", "[package]\nname = \"core\"\n");
        createFile("crates/api/Cargo.toml", "[package]\nname = \"api\"\n");
        createFile("crates/experimental/Cargo.toml", "[package]\nname = \"experimental\"\n");
        createDirectory("crates/docs");

        // When
        Manifest manifest = reader.read(tempDir);

        // Then
        assertThat(manifest.workspaceMembers()).containsExactly("crates/api", "crates/core");
        assertThat(manifest.packageCount()).isEqualTo(2);
        assertThat(manifest.isWorkspace()).isTrue();
        assertThat(manifest.dependencies()).containsExactly("anyhow");
        assertThat(manifest.packageName()).isNull();
    }

    @Test
    void read_withRootPackageAndExplicitMembers_countsRootPackage() throws IOException {
        // Given
        createFile("Cargo.toml", """
            [package]
            name = "app"
            version = "0.1.0"

            [workspace]
            members = ["core", "./cli/", "missing"]
            """);
        createFile("core/Cargo.toml", "[package]\nname = \"app-core\"\n");
        createFile("cli/Cargo.toml", "[package]\nname = \"app-cli\"\n");

        // When
        Manifest manifest = reader.read(tempDir);

        // Then
        assertThat(manifest.workspaceMembers()).containsExactly("core", "cli");
        assertThat(manifest.packageCount()).isEqualTo(3);
    }

    @Test
    void read_withMalformedToml_keepsRawTextOnly() throws IOException {
        // Given
        createFile("Cargo.toml", "[package\nname = \n");

        // When
        Manifest manifest = reader.read(tempDir);

        // Then
        assertThat(manifest.rawText()).isEqualTo("[package\nname = \n");
        assertThat(manifest.packageName()).isNull();
        assertThat(manifest.packageCount()).isZero();
    }
}
