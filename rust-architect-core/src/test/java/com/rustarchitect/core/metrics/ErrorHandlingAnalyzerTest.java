package com.rustarchitect.core.metrics;

import com.rustarchitect.core.model.ErrorHandling;
import com.rustarchitect.core.scanner.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ErrorHandlingAnalyzer}.
 */
class ErrorHandlingAnalyzerTest {

    private final ErrorHandlingAnalyzer analyzer = new ErrorHandlingAnalyzer();

    @Test
    void analyze_countsErrorCratesTypesAndPropagation() {
        // Given
        SourceFile lib = new SourceFile("src/lib.rs", """
            use anyhow::Context;

            #[derive(Debug, thiserror::Error)]
            pub enum ConfigError {
                #[error("missing")]
                Missing,
            }

            enum ErrorKind {
                Io,
            }

            pub fn load(path: &str) -> anyhow::Result<Config> {
                let text = std::fs::read_to_string(path)?;
                let value = parse(&text).expect("valid config");
                let port = value.port.unwrap();
                Ok(build(port)?)
            }

            fn parse(text: &str) -> Result<Value, ConfigError> {
                Ok(helper(text)?.into())
            }
            """);
        SourceFile math = new SourceFile("src/math.rs", "pub fn add(a: u32, b: u32) -> u32 { a + b }\n");

        // When
        ErrorHandling errors = analyzer.analyze(List.of(lib, math));

        // Then
        assertThat(errors.usesAnyhow()).isTrue();
        assertThat(errors.usesThiserror()).isTrue();
        assertThat(errors.customErrors()).containsExactly(new ErrorHandling.CustomError("ConfigError", "src/lib.rs"));
        assertThat(errors.errorDerives()).isEqualTo(1);
        assertThat(errors.resultReturns()).isEqualTo(2);
        assertThat(errors.unwrapCalls()).isEqualTo(1);
        assertThat(errors.expectCalls()).isEqualTo(1);
        assertThat(errors.questionMarks()).isEqualTo(3);
        assertThat(errors.panickingCalls()).isEqualTo(2);
    }

    @Test
    void analyze_withPlainErrorEnumAndIoResult_countsBoth() {
        // Given
        SourceFile io = new SourceFile("src/io.rs", """
            pub enum Error {
                Closed,
            }

            pub fn read() -> std::io::Result<Vec<u8>> {
                todo!()
            }
            """);

        // When
        ErrorHandling errors = analyzer.analyze(List.of(io));

        // Then
        assertThat(errors.usesAnyhow()).isFalse();
        assertThat(errors.usesThiserror()).isFalse();
        assertThat(errors.customErrors()).extracting(ErrorHandling.CustomError::name).containsExactly("Error");
        assertThat(errors.resultReturns()).isEqualTo(1);
        assertThat(errors.questionMarks()).isZero();
    }

    @Test
    void analyze_withNoFiles_returnsEmpty() {
        assertThat(analyzer.analyze(List.of())).isEqualTo(ErrorHandling.empty());
    }
}
