package com.rustarchitect.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("rustarchitect.yaml");
        Files.writeString(configFile, """
            project:
              name: "ledger"

            source:
              directory: "crates"
              includeTests: true
              excludePatterns:
                - "/generated/"

            detection:
              patternThreshold: 0.5
              styleThreshold: 0.6
              workspacePackageThreshold: 5
              monolithModuleThreshold: 20
              catalogs:
                designPatterns: "catalogs/patterns.yaml"

            index:
              hotSpotLimit: 7

            output:
              directory: "./out"
              generators:
                - json
            """);

        AnalysisConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("ledger");
        assertThat(config.source().directory()).isEqualTo("crates");
        assertThat(config.source().includeTests()).isTrue();
        assertThat(config.source().excludePatterns()).containsExactly("/generated/");
        assertThat(config.detection().patternThreshold()).isEqualTo(0.5);
        assertThat(config.detection().styleThreshold()).isEqualTo(0.6);
        assertThat(config.detection().workspacePackageThreshold()).isEqualTo(5);
        assertThat(config.detection().monolithModuleThreshold()).isEqualTo(20);
        assertThat(config.detection().catalogs().designPatterns()).isEqualTo("catalogs/patterns.yaml");
        assertThat(config.detection().catalogs().architectureStyles()).isNull();
        assertThat(config.index().hotSpotLimit()).isEqualTo(7);
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.output().generators()).containsExactly("json");
    }

    @Test
    void load_minimalYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("rustarchitect.yaml");
        Files.writeString(configFile, """
            project:
              name: "minimal"
            detection:
              patternThreshold: 0.4
            """);

        AnalysisConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("minimal");
        assertThat(config.detection().patternThreshold()).isEqualTo(0.4);
        assertThat(config.detection().styleThreshold()).isEqualTo(0.3);
        assertThat(config.source()).isEqualTo(AnalysisConfig.SourceConfig.defaults());
        assertThat(config.index().hotSpotLimit()).isEqualTo(20);
        assertThat(config.output().generators()).containsExactly("json", "markdown", "mermaid");
    }

    @Test
    void load_withUnknownProperties_ignoresThem() throws IOException {
        Path configFile = tempDir.resolve("rustarchitect.yaml");
        Files.writeString(configFile, """
            project:
              name: "extra"
              owner: "platform"
            telemetry:
              enabled: true
            """);

        AnalysisConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("extra");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        AnalysisConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("rustarchitect.yaml");
        Files.writeString(configFile, "project: [unclosed\n  name: :\n");

        AnalysisConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("rustarchitect.yaml");
        Files.writeString(configFile, "");

        AnalysisConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    void loadFromProject_readsDefaultFileName() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), "project:\n  name: rooted\n");

        AnalysisConfig config = ConfigLoader.loadFromProject(tempDir);

        assertThat(config.project().name()).isEqualTo("rooted");
    }

    @Test
    void defaults_useDocumentedValues() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThat(config.project().name()).isNull();
        assertThat(config.source().directory()).isEqualTo("src");
        assertThat(config.source().includeTests()).isFalse();
        assertThat(config.source().excludePatterns()).contains("/tests/", "_test.rs", "/benches/");
        assertThat(config.detection().patternThreshold()).isEqualTo(0.2);
        assertThat(config.detection().styleThreshold()).isEqualTo(0.3);
        assertThat(config.detection().workspacePackageThreshold()).isEqualTo(3);
        assertThat(config.detection().monolithModuleThreshold()).isEqualTo(10);
        assertThat(config.output().directory()).isEqualTo("./docs/architecture");
    }
}
